package com.firehose.domain.resilience;

import com.firehose.config.IngestionProperties;
import com.firehose.domain.exception.PermanentStoreException;
import com.firehose.domain.exception.RateLimitedException;
import com.firehose.domain.model.WriteOutcome;
import com.firehose.domain.service.IngestionMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded retry with exponential backoff for store writes.
 * 
 * Schedule: attempt 1 immediately, then wait {@code baseDelay * multiplier^(k-1)}
 * after the k-th failure, up to {@code maxAttempts} attempts in total.
 * A rate-limited failure that carries a reset time waits until that time instead.
 * 
 * Permanent failures are not retried while {@code ingest.retry.fail-fast-on-permanent}
 * is set. The outcome is returned, never thrown.
 */
@Slf4j
@Component
public class RetryExecutor {
    
    private final IngestionProperties.Retry properties;
    private final IngestionMetrics metrics;
    private final Clock clock;
    private final IntervalFunction backoff;
    private final RetryConfig retryConfig;
    private final Map<String, Retry> retries = new ConcurrentHashMap<>();
    
    public RetryExecutor(IngestionProperties properties, IngestionMetrics metrics, Clock clock) {
        this.properties = properties.getRetry();
        this.metrics = metrics;
        this.clock = clock;
        this.backoff = IntervalFunction.ofExponentialBackoff(
                this.properties.getBaseDelay(), this.properties.getMultiplier());
        this.retryConfig = RetryConfig.<Object>custom()
                .maxAttempts(this.properties.getMaxAttempts())
                .intervalBiFunction((attempt, result) -> result.isLeft()
                        ? waitAfterFailure(attempt, result.getLeft())
                        : backoff.apply(attempt))
                .retryOnException(this::isRetryable)
                .build();
    }
    
    public WriteOutcome execute(String destination, Runnable operation) {
        Retry retry = retries.computeIfAbsent(destination, this::createRetry);
        AtomicInteger attempts = new AtomicInteger();
        try {
            Retry.decorateRunnable(retry, () -> {
                attempts.incrementAndGet();
                operation.run();
            }).run();
            return WriteOutcome.success(attempts.get());
        } catch (RuntimeException e) {
            log.warn("Write to {} failed after {} attempt(s): {}", destination, attempts.get(), e.toString());
            return WriteOutcome.failure(attempts.get(), e);
        }
    }
    
    /**
     * Wait in milliseconds after the given number of failed attempts.
     */
    public long waitAfterFailure(int failedAttempts, Throwable error) {
        if (error instanceof RateLimitedException) {
            Optional<Long> untilReset = ((RateLimitedException) error).getResetAt()
                    .map(resetAt -> Math.max(0L, Duration.between(clock.instant(), resetAt).toMillis()));
            if (untilReset.isPresent()) {
                return untilReset.get();
            }
        }
        return backoff.apply(failedAttempts);
    }
    
    boolean isRetryable(Throwable error) {
        return !(properties.isFailFastOnPermanent() && error instanceof PermanentStoreException);
    }
    
    private Retry createRetry(String destination) {
        Retry retry = Retry.of(destination, retryConfig);
        retry.getEventPublisher().onRetry(event -> {
            metrics.recordRetry(destination);
            log.warn("Retrying write to {} (attempt {}/{}) in {}ms: {}",
                    destination,
                    event.getNumberOfRetryAttempts() + 1,
                    properties.getMaxAttempts(),
                    event.getWaitInterval().toMillis(),
                    String.valueOf(event.getLastThrowable()));
        });
        return retry;
    }
}

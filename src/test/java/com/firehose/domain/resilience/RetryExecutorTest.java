package com.firehose.domain.resilience;

import com.firehose.config.IngestionProperties;
import com.firehose.domain.exception.PermanentStoreException;
import com.firehose.domain.exception.RateLimitedException;
import com.firehose.domain.exception.TransientStoreException;
import com.firehose.domain.model.FailureKind;
import com.firehose.domain.model.WriteOutcome;
import com.firehose.domain.service.IngestionMetrics;
import com.firehose.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

    private static final String DESTINATION = "bluesky_posts";

    private MutableClock clock;
    private IngestionProperties properties;
    private IngestionMetrics metrics;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-09-10T00:00:00Z"));
        properties = new IngestionProperties();
        metrics = new IngestionMetrics(new SimpleMeterRegistry(), properties, clock);
    }

    @Test
    void waitAfterFailure_followsExponentialSchedule() {
        RetryExecutor executor = new RetryExecutor(properties, metrics, clock);
        TransientStoreException error = new TransientStoreException(DESTINATION, "timeout", null);

        assertEquals(1000, executor.waitAfterFailure(1, error));
        assertEquals(2000, executor.waitAfterFailure(2, error));
        assertEquals(4000, executor.waitAfterFailure(3, error));
    }

    @Test
    void waitAfterFailure_rateLimitWaitsUntilReset() {
        RetryExecutor executor = new RetryExecutor(properties, metrics, clock);
        RateLimitedException error = new RateLimitedException(
                DESTINATION, "too many connections", clock.instant().plusSeconds(5), null);

        assertEquals(5000, executor.waitAfterFailure(1, error));
    }

    @Test
    void waitAfterFailure_rateLimitWithoutResetUsesBackoff() {
        RetryExecutor executor = new RetryExecutor(properties, metrics, clock);
        RateLimitedException error = new RateLimitedException(DESTINATION, "too many connections", null, null);

        assertEquals(1000, executor.waitAfterFailure(1, error));
    }

    @Test
    void waitAfterFailure_pastResetDoesNotGoNegative() {
        RetryExecutor executor = new RetryExecutor(properties, metrics, clock);
        RateLimitedException error = new RateLimitedException(
                DESTINATION, "too many connections", clock.instant().minusSeconds(1), null);

        assertEquals(0, executor.waitAfterFailure(1, error));
    }

    @Test
    void execute_exhaustsAttemptsOnTransientFailure() {
        RetryExecutor executor = fastExecutor();
        AtomicInteger calls = new AtomicInteger();

        WriteOutcome outcome = executor.execute(DESTINATION, () -> {
            calls.incrementAndGet();
            throw new TransientStoreException(DESTINATION, "timeout", null);
        });

        assertFalse(outcome.isSuccess());
        assertEquals(3, outcome.getAttempts());
        assertEquals(3, calls.get());
        assertEquals(FailureKind.TRANSIENT, outcome.getFailureKind());
        assertTrue(outcome.getErrorMessage().contains("timeout"));
        assertEquals(2, metrics.snapshot().getRetries());
    }

    @Test
    void execute_succeedsAfterTransientFailure() {
        RetryExecutor executor = fastExecutor();
        AtomicInteger calls = new AtomicInteger();

        WriteOutcome outcome = executor.execute(DESTINATION, () -> {
            if (calls.incrementAndGet() == 1) {
                throw new TransientStoreException(DESTINATION, "timeout", null);
            }
        });

        assertTrue(outcome.isSuccess());
        assertEquals(2, outcome.getAttempts());
    }

    @Test
    void execute_permanentFailureIsNotRetried() {
        RetryExecutor executor = fastExecutor();
        AtomicInteger calls = new AtomicInteger();

        WriteOutcome outcome = executor.execute(DESTINATION, () -> {
            calls.incrementAndGet();
            throw new PermanentStoreException(DESTINATION, "value too long", null);
        });

        assertFalse(outcome.isSuccess());
        assertEquals(1, calls.get());
        assertEquals(FailureKind.PERMANENT, outcome.getFailureKind());
    }

    @Test
    void execute_permanentFailureRetriedWhenFailFastDisabled() {
        properties.getRetry().setFailFastOnPermanent(false);
        RetryExecutor executor = fastExecutor();
        AtomicInteger calls = new AtomicInteger();

        executor.execute(DESTINATION, () -> {
            calls.incrementAndGet();
            throw new PermanentStoreException(DESTINATION, "value too long", null);
        });

        assertEquals(3, calls.get());
    }

    @Test
    void execute_firstAttemptSuccessReportsOneAttempt() {
        WriteOutcome outcome = fastExecutor().execute(DESTINATION, () -> { });

        assertTrue(outcome.isSuccess());
        assertEquals(1, outcome.getAttempts());
        assertEquals(0, metrics.snapshot().getRetries());
    }

    private RetryExecutor fastExecutor() {
        properties.getRetry().setBaseDelay(Duration.ofMillis(10));
        return new RetryExecutor(properties, metrics, clock);
    }

    @Test
    void execute_waitsBackoffBetweenAttempts() {
        properties.getRetry().setBaseDelay(Duration.ofMillis(100));
        RetryExecutor executor = new RetryExecutor(properties, metrics, clock);
        List<Long> attemptNanos = new ArrayList<>();

        executor.execute(DESTINATION, () -> {
            attemptNanos.add(System.nanoTime());
            throw new TransientStoreException(DESTINATION, "timeout", null);
        });

        assertEquals(3, attemptNanos.size());
        long firstGapMs = TimeUnit.NANOSECONDS.toMillis(attemptNanos.get(1) - attemptNanos.get(0));
        long secondGapMs = TimeUnit.NANOSECONDS.toMillis(attemptNanos.get(2) - attemptNanos.get(1));
        assertTrue(firstGapMs >= 95, "first wait " + firstGapMs + "ms");
        assertTrue(secondGapMs >= 195, "second wait " + secondGapMs + "ms");
        assertTrue(secondGapMs > firstGapMs, "waits must grow: " + firstGapMs + "ms, " + secondGapMs + "ms");
    }
}

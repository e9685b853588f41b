package com.firehose.domain.resilience;

import com.firehose.config.IngestionProperties;
import com.firehose.domain.exception.CircuitOpenException;
import com.firehose.domain.model.CircuitBreakerStats;
import com.firehose.domain.model.CircuitBreakerStats.BreakerState;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * One circuit breaker per store destination.
 * 
 * Configuration maps "N consecutive failures" onto Resilience4j's count-based
 * window: a window of N calls with a 100% failure-rate threshold trips exactly
 * when the last N calls all failed. Breakers run on the injected clock, so
 * reported next-attempt times match when a call is admitted again.
 * 
 * States:
 * - CLOSED: calls pass through, consecutive failures counted
 * - OPEN: calls rejected with {@link CircuitOpenException} until the recovery timeout passes
 * - HALF_OPEN: a single trial call; success closes, failure reopens
 */
@Slf4j
@Component
public class StoreCircuitBreakers {
    
    private final CircuitBreakerConfig breakerConfig;
    private final IngestionProperties.CircuitBreaker properties;
    private final Clock clock;
    private final Map<String, BreakerTracker> trackers = new ConcurrentHashMap<>();
    
    public StoreCircuitBreakers(IngestionProperties properties, Clock clock) {
        this.properties = properties.getCircuitBreaker();
        this.clock = clock;
        
        int threshold = this.properties.getFailureThreshold();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(this.properties.getRecoveryTimeout())
                .permittedNumberOfCallsInHalfOpenState(1)
                .maxWaitDurationInHalfOpenState(this.properties.getHalfOpenTimeout())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
        this.breakerConfig = config;
    }
    
    /**
     * Run {@code operation} through the destination's breaker.
     *
     * @throws CircuitOpenException if the breaker is open or its half-open trial is taken
     */
    public void execute(String destination, Runnable operation) {
        CircuitBreaker breaker = tracker(destination).breaker;
        try {
            breaker.executeRunnable(operation);
        } catch (CallNotPermittedException e) {
            throw new CircuitOpenException(destination, e);
        }
    }
    
    public CircuitBreakerStats stats(String destination) {
        return tracker(destination).toStats();
    }
    
    public List<CircuitBreakerStats> allStats() {
        return trackers.values().stream()
                .map(BreakerTracker::toStats)
                .sorted(Comparator.comparing(CircuitBreakerStats::getName))
                .collect(Collectors.toList());
    }
    
    public void reset(String destination) {
        BreakerTracker tracker = trackers.get(destination);
        if (tracker != null) {
            tracker.reset();
        }
    }
    
    public void resetAll() {
        trackers.values().forEach(BreakerTracker::reset);
    }
    
    private BreakerTracker tracker(String destination) {
        return trackers.computeIfAbsent(destination, name -> new BreakerTracker(
                new CircuitBreakerStateMachine(name, breakerConfig, clock)));
    }
    
    private final class BreakerTracker {
        
        private final CircuitBreaker breaker;
        private final AtomicInteger consecutiveFailures = new AtomicInteger();
        private final AtomicLong successCount = new AtomicLong();
        private volatile Instant lastFailureTime;
        private volatile Instant nextAttemptTime;
        
        BreakerTracker(CircuitBreaker breaker) {
            this.breaker = breaker;
            breaker.getEventPublisher()
                    .onSuccess(event -> {
                        consecutiveFailures.set(0);
                        successCount.incrementAndGet();
                    })
                    .onError(event -> {
                        consecutiveFailures.incrementAndGet();
                        lastFailureTime = clock.instant();
                    })
                    .onStateTransition(event -> onTransition(event.getStateTransition().getToState()))
                    .onCallNotPermitted(event -> log.debug("Circuit breaker {} rejected a call", breaker.getName()));
        }
        
        private void onTransition(CircuitBreaker.State toState) {
            switch (toState) {
                case OPEN:
                    nextAttemptTime = clock.instant().plus(properties.getRecoveryTimeout());
                    log.warn("Circuit breaker {} OPEN after {} consecutive failures, next attempt at {}",
                            breaker.getName(), consecutiveFailures.get(), nextAttemptTime);
                    break;
                case HALF_OPEN:
                    log.info("Circuit breaker {} HALF_OPEN, allowing one trial call", breaker.getName());
                    break;
                case CLOSED:
                    consecutiveFailures.set(0);
                    nextAttemptTime = null;
                    log.info("Circuit breaker {} CLOSED", breaker.getName());
                    break;
                default:
                    log.info("Circuit breaker {} transitioned to {}", breaker.getName(), toState);
            }
        }
        
        void reset() {
            breaker.reset();
            consecutiveFailures.set(0);
            successCount.set(0);
            lastFailureTime = null;
            nextAttemptTime = null;
        }
        
        CircuitBreakerStats toStats() {
            return CircuitBreakerStats.builder()
                    .name(breaker.getName())
                    .state(stateOf(breaker.getState()))
                    .consecutiveFailures(consecutiveFailures.get())
                    .successCount(successCount.get())
                    .lastFailureTime(lastFailureTime)
                    .nextAttemptTime(breaker.getState() == CircuitBreaker.State.OPEN ? nextAttemptTime : null)
                    .failureThreshold(properties.getFailureThreshold())
                    .recoveryTimeout(properties.getRecoveryTimeout())
                    .build();
        }
    }
    
    private static BreakerState stateOf(CircuitBreaker.State state) {
        switch (state) {
            case OPEN:
            case FORCED_OPEN:
                return BreakerState.OPEN;
            case HALF_OPEN:
                return BreakerState.HALF_OPEN;
            default:
                return BreakerState.CLOSED;
        }
    }
}

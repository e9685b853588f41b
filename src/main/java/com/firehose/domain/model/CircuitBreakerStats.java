package com.firehose.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class CircuitBreakerStats {
    
    String name;
    BreakerState state;
    int consecutiveFailures;
    long successCount;
    Instant lastFailureTime;
    Instant nextAttemptTime;
    int failureThreshold;
    Duration recoveryTimeout;
    
    public enum BreakerState {
        CLOSED,
        OPEN,
        HALF_OPEN
    }
}

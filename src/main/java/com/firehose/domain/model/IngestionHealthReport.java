package com.firehose.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class IngestionHealthReport {
    
    Instant generatedAt;
    boolean healthy;
    boolean paused;
    Instant pausedUntil;
    MetricsSnapshot metrics;
    Map<EntityKind, Integer> queueSizes;
    List<CircuitBreakerStats> circuitBreakers;
}

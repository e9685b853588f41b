package com.firehose.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the ingestion counters and derived health.
 */
@Value
@Builder
public class MetricsSnapshot {
    
    long received;
    long processed;
    long dropped;
    double dropRate;
    long flushCount;
    long flushErrors;
    long rowsFlushed;
    long deadLetters;
    long retries;
    long backpressureEvents;
    Instant lastBackpressureAt;
    double avgProcessingMs;
    double maxProcessingMs;
    double avgFlushMs;
    double maxFlushMs;
    long queueSizeCurrent;
    long queueSizeMax;
    double eventsPerSecond;
    Duration uptime;
    boolean healthy;
    List<String> warnings;
}

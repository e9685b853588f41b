package com.firehose.api;

import com.firehose.domain.model.IngestionHealthReport;
import com.firehose.domain.model.MetricsSnapshot;
import com.firehose.domain.service.MetricsReporter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of pipeline health: DOWN while drops, slow processing, slow
 * flushes or recent backpressure make the pipeline unhealthy.
 */
@Component
@RequiredArgsConstructor
public class IngestionHealthIndicator implements HealthIndicator {
    
    private final MetricsReporter metricsReporter;
    
    @Override
    public Health health() {
        IngestionHealthReport report = metricsReporter.report();
        MetricsSnapshot metrics = report.getMetrics();
        
        Health.Builder builder = report.isHealthy()
                ? Health.up()
                : Health.down();
        
        return builder
                .withDetail("paused", report.isPaused())
                .withDetail("received", metrics.getReceived())
                .withDetail("dropped", metrics.getDropped())
                .withDetail("dropRate", metrics.getDropRate())
                .withDetail("avgProcessingMs", metrics.getAvgProcessingMs())
                .withDetail("avgFlushMs", metrics.getAvgFlushMs())
                .withDetail("queueSize", metrics.getQueueSizeCurrent())
                .withDetail("deadLetters", metrics.getDeadLetters())
                .withDetail("warnings", metrics.getWarnings())
                .withDetail("circuitBreakers", report.getCircuitBreakers())
                .build();
    }
}

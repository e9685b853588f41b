package com.firehose.domain.service;

import com.firehose.domain.model.CircuitBreakerStats;
import com.firehose.domain.model.IngestionHealthReport;
import com.firehose.domain.model.MetricsSnapshot;
import com.firehose.domain.queue.IngestGate;
import com.firehose.domain.queue.QueueManager;
import com.firehose.domain.resilience.StoreCircuitBreakers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Assembles the health report and logs it periodically.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsReporter {
    
    private final IngestionMetrics metrics;
    private final QueueManager queueManager;
    private final StoreCircuitBreakers circuitBreakers;
    private final IngestGate ingestGate;
    private final Clock clock;
    
    public IngestionHealthReport report() {
        metrics.updateQueueSize(queueManager.totalSize());
        MetricsSnapshot snapshot = metrics.snapshot();
        return IngestionHealthReport.builder()
                .generatedAt(clock.instant())
                .healthy(snapshot.isHealthy())
                .paused(ingestGate.isPaused())
                .pausedUntil(ingestGate.getPausedUntil().orElse(null))
                .metrics(snapshot)
                .queueSizes(queueManager.sizes())
                .circuitBreakers(circuitBreakers.allStats())
                .build();
    }
    
    public void logReport() {
        IngestionHealthReport report = report();
        MetricsSnapshot m = report.getMetrics();
        
        log.info("Ingestion health: {} | uptime {}s | received {} ({}/s) | processed {} | dropped {} ({}%) | queued {} (peak {})",
                report.isHealthy() ? "HEALTHY" : "DEGRADED",
                m.getUptime().getSeconds(),
                m.getReceived(),
                String.format("%.1f", m.getEventsPerSecond()),
                m.getProcessed(),
                m.getDropped(),
                String.format("%.2f", m.getDropRate() * 100),
                m.getQueueSizeCurrent(),
                m.getQueueSizeMax());
        log.info("Flushes: {} ({} failed, {} rows, {} dead letters, {} retries) | avg flush {}ms | avg processing {}ms | backpressure events {}",
                m.getFlushCount(),
                m.getFlushErrors(),
                m.getRowsFlushed(),
                m.getDeadLetters(),
                m.getRetries(),
                String.format("%.0f", m.getAvgFlushMs()),
                String.format("%.2f", m.getAvgProcessingMs()),
                m.getBackpressureEvents());
        
        for (CircuitBreakerStats breaker : report.getCircuitBreakers()) {
            if (breaker.getState() != CircuitBreakerStats.BreakerState.CLOSED) {
                log.warn("Circuit breaker {} is {} (next attempt {})",
                        breaker.getName(), breaker.getState(), breaker.getNextAttemptTime());
            }
        }
        m.getWarnings().forEach(warning -> log.warn("Health warning: {}", warning));
    }
}

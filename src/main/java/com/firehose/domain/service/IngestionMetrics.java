package com.firehose.domain.service;

import com.firehose.config.IngestionProperties;
import com.firehose.domain.model.EntityKind;
import com.firehose.domain.model.MetricsSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ingestion metrics.
 * 
 * Keeps its own counters and rolling samples so health can be derived locally,
 * and mirrors every update into Micrometer for export.
 * 
 * Health:
 * - no drops since start (or last reset)
 * - average processing time under {@code ingest.health.max-avg-processing-ms}
 * - average flush time under {@code ingest.health.max-avg-flush-ms}
 * - no backpressure event within {@code ingest.health.backpressure-window}
 */
@Slf4j
@Component
public class IngestionMetrics {
    
    private final MeterRegistry meterRegistry;
    private final IngestionProperties.Health healthProperties;
    private final int queueCapacity;
    private final Clock clock;
    
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong flushCount = new AtomicLong();
    private final AtomicLong flushErrors = new AtomicLong();
    private final AtomicLong rowsFlushed = new AtomicLong();
    private final AtomicLong deadLetters = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong backpressureEvents = new AtomicLong();
    private final AtomicReference<Instant> lastBackpressureAt = new AtomicReference<>();
    private final AtomicLong queueSizeCurrent = new AtomicLong();
    private final AtomicLong queueSizeMax = new AtomicLong();
    private final RollingWindow processingSamples;
    private final RollingWindow flushSamples;
    private volatile Instant startedAt;
    
    private final Counter receivedCounter;
    private final Counter processedCounter;
    
    public IngestionMetrics(MeterRegistry meterRegistry, IngestionProperties properties, Clock clock) {
        this.meterRegistry = meterRegistry;
        this.healthProperties = properties.getHealth();
        this.queueCapacity = properties.getQueue().getCapacity();
        this.clock = clock;
        this.processingSamples = new RollingWindow(healthProperties.getProcessingSamples());
        this.flushSamples = new RollingWindow(healthProperties.getFlushSamples());
        this.startedAt = clock.instant();
        
        this.receivedCounter = Counter.builder("ingest.records.received")
                .description("Records offered to the queues")
                .register(meterRegistry);
        this.processedCounter = Counter.builder("ingest.records.processed")
                .description("Records accepted into a queue")
                .register(meterRegistry);
        
        Gauge.builder("ingest.queue.size.total", queueSizeCurrent, AtomicLong::get)
                .description("Aggregate size of all queues at last observation")
                .register(meterRegistry);
    }
    
    public void recordReceived(int records) {
        received.addAndGet(records);
        receivedCounter.increment(records);
    }
    
    /**
     * Record one classified event: how many records it put into queues and how
     * long classification plus enqueue took.
     */
    public void recordProcessed(int records, long processingNanos) {
        processed.addAndGet(records);
        processedCounter.increment(records);
        processingSamples.add(processingNanos / 1_000_000.0);
    }
    
    public void recordDropped(int records, String reason) {
        dropped.addAndGet(records);
        Counter.builder("ingest.records.dropped")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment(records);
    }
    
    public void recordFlush(EntityKind kind, long durationMs, boolean success, int rows) {
        flushCount.incrementAndGet();
        if (success) {
            rowsFlushed.addAndGet(rows);
        } else {
            flushErrors.incrementAndGet();
        }
        flushSamples.add(durationMs);
        
        Timer.builder("ingest.flush.duration")
                .tag("kind", kind.name())
                .tag("result", success ? "success" : "failure")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
    
    public void recordDeadLetters(String destination, int count) {
        deadLetters.addAndGet(count);
        Counter.builder("ingest.dead_letters")
                .tag("destination", destination)
                .register(meterRegistry)
                .increment(count);
    }
    
    public void recordRetry(String destination) {
        retries.incrementAndGet();
        Counter.builder("ingest.store.retries")
                .tag("destination", destination)
                .register(meterRegistry)
                .increment();
    }
    
    public void recordBackpressure(String trigger, long queueSize) {
        backpressureEvents.incrementAndGet();
        lastBackpressureAt.set(clock.instant());
        updateQueueSize(queueSize);
        
        Counter.builder("ingest.backpressure.events")
                .tag("trigger", trigger)
                .register(meterRegistry)
                .increment();
    }
    
    public void updateQueueSize(long size) {
        queueSizeCurrent.set(size);
        queueSizeMax.accumulateAndGet(size, Math::max);
    }
    
    public MetricsSnapshot snapshot() {
        Instant now = clock.instant();
        long receivedCount = received.get();
        long droppedCount = dropped.get();
        double dropRate = receivedCount == 0 ? 0.0 : (double) droppedCount / receivedCount;
        double avgProcessing = processingSamples.average();
        double avgFlush = flushSamples.average();
        Instant lastBackpressure = lastBackpressureAt.get();
        boolean recentBackpressure = lastBackpressure != null
                && Duration.between(lastBackpressure, now).compareTo(healthProperties.getBackpressureWindow()) < 0;
        Duration uptime = Duration.between(startedAt, now);
        long uptimeSeconds = Math.max(1, uptime.getSeconds());
        
        List<String> warnings = new ArrayList<>();
        if (droppedCount > 0) {
            warnings.add(String.format("Dropped %d records (%.2f%%)", droppedCount, dropRate * 100));
        }
        if (avgProcessing >= healthProperties.getMaxAvgProcessingMs()) {
            warnings.add(String.format("Slow event processing: %.1fms average", avgProcessing));
        }
        if (avgFlush >= healthProperties.getMaxAvgFlushMs()) {
            warnings.add(String.format("Slow flushes: %.0fms average", avgFlush));
        }
        if (recentBackpressure) {
            warnings.add("Backpressure applied " + Duration.between(lastBackpressure, now).getSeconds() + "s ago");
        }
        if (queueSizeCurrent.get() >= queueCapacity * 3L / 4) {
            warnings.add("Queues at " + queueSizeCurrent.get() + " of " + queueCapacity + " records");
        }
        
        return MetricsSnapshot.builder()
                .received(receivedCount)
                .processed(processed.get())
                .dropped(droppedCount)
                .dropRate(dropRate)
                .flushCount(flushCount.get())
                .flushErrors(flushErrors.get())
                .rowsFlushed(rowsFlushed.get())
                .deadLetters(deadLetters.get())
                .retries(retries.get())
                .backpressureEvents(backpressureEvents.get())
                .lastBackpressureAt(lastBackpressure)
                .avgProcessingMs(avgProcessing)
                .maxProcessingMs(processingSamples.max())
                .avgFlushMs(avgFlush)
                .maxFlushMs(flushSamples.max())
                .queueSizeCurrent(queueSizeCurrent.get())
                .queueSizeMax(queueSizeMax.get())
                .eventsPerSecond((double) receivedCount / uptimeSeconds)
                .uptime(uptime)
                .healthy(droppedCount == 0
                        && avgProcessing < healthProperties.getMaxAvgProcessingMs()
                        && avgFlush < healthProperties.getMaxAvgFlushMs()
                        && !recentBackpressure)
                .warnings(List.copyOf(warnings))
                .build();
    }
    
    /**
     * Clear counters and samples. Micrometer meters are cumulative and keep their values.
     */
    public void reset() {
        received.set(0);
        processed.set(0);
        dropped.set(0);
        flushCount.set(0);
        flushErrors.set(0);
        rowsFlushed.set(0);
        deadLetters.set(0);
        retries.set(0);
        backpressureEvents.set(0);
        lastBackpressureAt.set(null);
        queueSizeCurrent.set(0);
        queueSizeMax.set(0);
        processingSamples.clear();
        flushSamples.clear();
        startedAt = clock.instant();
        log.info("Ingestion metrics reset");
    }
    
    /**
     * Fixed-size window over the most recent samples.
     */
    static final class RollingWindow {
        
        private final int capacity;
        private final Deque<Double> samples = new ArrayDeque<>();
        
        RollingWindow(int capacity) {
            this.capacity = capacity;
        }
        
        synchronized void add(double sample) {
            if (samples.size() == capacity) {
                samples.removeFirst();
            }
            samples.addLast(sample);
        }
        
        synchronized double average() {
            return samples.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        }
        
        synchronized double max() {
            return samples.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        }
        
        synchronized void clear() {
            samples.clear();
        }
    }
}

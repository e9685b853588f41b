package com.firehose.domain.queue;

import com.firehose.domain.model.Batch;
import com.firehose.domain.model.EntityKind;
import com.firehose.domain.model.IngestRecord;
import com.firehose.domain.service.IngestionMetrics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns one {@link RecordQueue} per entity kind.
 * 
 * Responsibilities:
 * - Enqueue with last-write-wins dedup, vetoed while the ingest gate is paused
 * - Hand out batch snapshots, at most one in flight per kind
 * - Report per-kind and aggregate sizes
 */
@Slf4j
@Component
public class QueueManager {
    
    private final Map<EntityKind, RecordQueue> queues = new EnumMap<>(EntityKind.class);
    private final Map<EntityKind, AtomicBoolean> flushing = new EnumMap<>(EntityKind.class);
    private final IngestGate ingestGate;
    private final IngestionMetrics metrics;
    private final Clock clock;
    
    public QueueManager(IngestGate ingestGate, IngestionMetrics metrics, MeterRegistry meterRegistry, Clock clock) {
        this.ingestGate = ingestGate;
        this.metrics = metrics;
        this.clock = clock;
        
        for (EntityKind kind : EntityKind.values()) {
            RecordQueue queue = new RecordQueue(kind);
            queues.put(kind, queue);
            flushing.put(kind, new AtomicBoolean(false));
            
            Gauge.builder("ingest.queue.size", queue, RecordQueue::size)
                    .tag("kind", kind.name())
                    .description("Records waiting for flush")
                    .register(meterRegistry);
        }
    }
    
    public EnqueueResult enqueue(IngestRecord record) {
        RecordQueue queue = queues.get(record.getKind());
        if (ingestGate.isPaused()) {
            metrics.recordDropped(1, "backpressure");
            return new EnqueueResult(false, queue.size());
        }
        int queueSize = queue.put(record);
        metrics.updateQueueSize(totalSize());
        return new EnqueueResult(true, queueSize);
    }
    
    /**
     * Take the current contents of a queue for flushing.
     * 
     * Returns empty when a flush for the kind is already in flight or the queue
     * is empty. A non-empty result must be followed by {@link #completeFlush}.
     */
    public Optional<Batch> beginFlush(EntityKind kind) {
        AtomicBoolean inFlight = flushing.get(kind);
        if (!inFlight.compareAndSet(false, true)) {
            log.debug("Flush already in flight for {}", kind);
            return Optional.empty();
        }
        List<IngestRecord> records = queues.get(kind).drain();
        if (records.isEmpty()) {
            inFlight.set(false);
            return Optional.empty();
        }
        return Optional.of(new Batch(kind, records, clock.instant()));
    }
    
    public void completeFlush(EntityKind kind) {
        flushing.get(kind).set(false);
    }
    
    public boolean isFlushing(EntityKind kind) {
        return flushing.get(kind).get();
    }
    
    public int size(EntityKind kind) {
        return queues.get(kind).size();
    }
    
    public long totalSize() {
        long total = 0;
        for (RecordQueue queue : queues.values()) {
            total += queue.size();
        }
        return total;
    }
    
    public Map<EntityKind, Integer> sizes() {
        Map<EntityKind, Integer> sizes = new EnumMap<>(EntityKind.class);
        queues.forEach((kind, queue) -> sizes.put(kind, queue.size()));
        return Collections.unmodifiableMap(sizes);
    }
    
    @Value
    public static class EnqueueResult {
        boolean accepted;
        int queueSize;
    }
}

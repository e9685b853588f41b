package com.firehose.domain.service;

import com.firehose.config.IngestionProperties;
import com.firehose.domain.queue.IngestGate;
import com.firehose.domain.queue.QueueManager;
import com.firehose.infrastructure.system.MemoryProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Resource monitor that pauses ingestion under memory or queue pressure.
 * 
 * Each tick checks, in priority order:
 * 1. Resident memory at or above the hard limit: pause for the hard cooldown,
 *    hint a GC and force a flush of every queue
 * 2. Resident memory at or above the soft limit: pause for the cooldown
 * 3. Aggregate queue size at or above capacity: pause for the cooldown
 * 
 * Pauses end on their own when the cooldown passes; the next tick pauses again
 * if the pressure persists. Records arriving while paused are dropped and counted.
 */
@Slf4j
@Service
public class BackpressureController {
    
    static final Duration PAUSE_LOG_INTERVAL = Duration.ofSeconds(5);
    
    public enum Trigger {
        MEMORY_HARD,
        MEMORY_SOFT,
        QUEUE_CAPACITY
    }
    
    private final IngestGate ingestGate;
    private final QueueManager queueManager;
    private final BatchFlusher batchFlusher;
    private final MemoryProbe memoryProbe;
    private final IngestionMetrics metrics;
    private final IngestionProperties properties;
    private final Clock clock;
    
    private volatile Instant lastPauseLog;
    private volatile boolean wasPaused;
    
    public BackpressureController(IngestGate ingestGate,
                                  QueueManager queueManager,
                                  BatchFlusher batchFlusher,
                                  MemoryProbe memoryProbe,
                                  IngestionMetrics metrics,
                                  IngestionProperties properties,
                                  Clock clock) {
        this.ingestGate = ingestGate;
        this.queueManager = queueManager;
        this.batchFlusher = batchFlusher;
        this.memoryProbe = memoryProbe;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }
    
    /**
     * One monitor tick.
     *
     * @return the trigger that fired, or null if no pressure was found
     */
    public Trigger check() {
        IngestionProperties.Backpressure limits = properties.getBackpressure();
        long memoryMb = memoryProbe.residentMegabytes();
        long queueSize = queueManager.totalSize();
        metrics.updateQueueSize(queueSize);
        
        if (wasPaused && !ingestGate.isPaused()) {
            wasPaused = false;
            log.info("Ingestion resumed (memory {}MB, queued {})", memoryMb, queueSize);
        }
        
        if (memoryMb >= limits.getMemoryHardLimitMb()) {
            applyPause(Trigger.MEMORY_HARD, limits.getHardPauseCooldown(), memoryMb, queueSize);
            if (limits.isGcHintEnabled()) {
                System.gc();
            }
            batchFlusher.flushAll();
            return Trigger.MEMORY_HARD;
        }
        if (memoryMb >= limits.getMemorySoftLimitMb()) {
            applyPause(Trigger.MEMORY_SOFT, limits.getPauseCooldown(), memoryMb, queueSize);
            return Trigger.MEMORY_SOFT;
        }
        if (queueSize >= properties.getQueue().getCapacity()) {
            applyPause(Trigger.QUEUE_CAPACITY, limits.getPauseCooldown(), memoryMb, queueSize);
            return Trigger.QUEUE_CAPACITY;
        }
        return null;
    }
    
    public boolean isPaused() {
        return ingestGate.isPaused();
    }
    
    private void applyPause(Trigger trigger, Duration cooldown, long memoryMb, long queueSize) {
        Instant until = ingestGate.pauseFor(cooldown);
        wasPaused = true;
        metrics.recordBackpressure(trigger.name().toLowerCase(Locale.ROOT), queueSize);
        
        Instant now = clock.instant();
        if (lastPauseLog == null || !now.isBefore(lastPauseLog.plus(PAUSE_LOG_INTERVAL))) {
            lastPauseLog = now;
            log.warn("Backpressure {}: memory {}MB, queued {}, ingestion paused until {}",
                    trigger, memoryMb, queueSize, until);
        }
    }
}

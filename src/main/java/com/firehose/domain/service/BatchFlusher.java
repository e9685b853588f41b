package com.firehose.domain.service;

import com.firehose.config.IngestionProperties;
import com.firehose.domain.model.Batch;
import com.firehose.domain.model.EntityKind;
import com.firehose.domain.model.FailureKind;
import com.firehose.domain.model.FlushResult;
import com.firehose.domain.model.IngestRecord;
import com.firehose.domain.model.WriteOutcome;
import com.firehose.domain.queue.QueueManager;
import com.firehose.domain.resilience.RetryExecutor;
import com.firehose.domain.resilience.StoreCircuitBreakers;
import com.firehose.infrastructure.persistence.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Moves queued records into the store.
 * 
 * Flush Flow:
 * 1. Swap the kind's queue for an empty one (skipped if a flush of that kind is in flight)
 * 2. Dedup the snapshot by key (later record wins)
 * 3. Upsert through retry, then the destination's circuit breaker
 * 4. Success: batch discarded. Failure after retries: every row dead-lettered
 * 5. Re-trigger if the queue refilled past its threshold meanwhile
 * 
 * Failure Handling:
 * - Every exception is caught at the flush boundary and turned into dead letters
 * - Dead-lettered rows are never requeued
 * - A flush always completes, so the in-flight flag is always released
 */
@Slf4j
@Service
public class BatchFlusher {
    
    private static final long DRAIN_POLL_MS = 50;
    
    private final QueueManager queueManager;
    private final RecordStore recordStore;
    private final RetryExecutor retryExecutor;
    private final StoreCircuitBreakers circuitBreakers;
    private final DeadLetterService deadLetterService;
    private final IngestionMetrics metrics;
    private final IngestionProperties.Queue queueProperties;
    private final Executor flushExecutor;
    
    public BatchFlusher(QueueManager queueManager,
                        RecordStore recordStore,
                        RetryExecutor retryExecutor,
                        StoreCircuitBreakers circuitBreakers,
                        DeadLetterService deadLetterService,
                        IngestionMetrics metrics,
                        IngestionProperties properties,
                        @Qualifier("flushExecutor") Executor flushExecutor) {
        this.queueManager = queueManager;
        this.recordStore = recordStore;
        this.retryExecutor = retryExecutor;
        this.circuitBreakers = circuitBreakers;
        this.deadLetterService = deadLetterService;
        this.metrics = metrics;
        this.queueProperties = properties.getQueue();
        this.flushExecutor = flushExecutor;
    }
    
    /**
     * Size-based trigger, called after every accepted enqueue.
     */
    public void onEnqueued(EntityKind kind, int queueSize) {
        if (queueSize >= queueProperties.batchSizeFor(kind)) {
            flush(kind);
        }
    }
    
    public CompletableFuture<FlushResult> flush(EntityKind kind) {
        Optional<Batch> snapshot = queueManager.beginFlush(kind);
        if (snapshot.isEmpty()) {
            return CompletableFuture.completedFuture(FlushResult.skipped(kind));
        }
        Batch batch = snapshot.get();
        
        CompletableFuture<FlushResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> process(batch), flushExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Flush executor rejected {} batch of {}, flushing on caller thread", kind, batch.size());
            future = CompletableFuture.completedFuture(process(batch));
        }
        return future.whenComplete((result, error) -> afterFlush(kind));
    }
    
    public CompletableFuture<List<FlushResult>> flushAll() {
        List<CompletableFuture<FlushResult>> flushes = Arrays.stream(EntityKind.values())
                .map(this::flush)
                .collect(Collectors.toList());
        return CompletableFuture.allOf(flushes.toArray(new CompletableFuture[0]))
                .thenApply(done -> flushes.stream()
                        .map(CompletableFuture::join)
                        .collect(Collectors.toList()));
    }
    
    /**
     * Flush repeatedly until every queue is empty and no flush is in flight,
     * or the timeout elapses.
     *
     * @return true if everything was flushed in time
     */
    public boolean drain(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (System.nanoTime() < deadline) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                flushAll().get(Math.max(1, remainingMs), TimeUnit.MILLISECONDS);
                if (queueManager.totalSize() == 0 && noFlushInFlight()) {
                    return true;
                }
                Thread.sleep(DRAIN_POLL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining queues");
        } catch (TimeoutException e) {
            log.warn("Timed out after {} draining queues", timeout);
        } catch (ExecutionException e) {
            log.error("Drain flush failed: {}", e.getMessage(), e);
        }
        return queueManager.totalSize() == 0 && noFlushInFlight();
    }
    
    FlushResult process(Batch batch) {
        EntityKind kind = batch.getKind();
        String table = kind.table();
        long startNanos = System.nanoTime();
        List<Map<String, Object>> rows = null;
        
        try {
            rows = toRows(batch);
            List<Map<String, Object>> upsertRows = rows;
            WriteOutcome outcome = retryExecutor.execute(table, () -> circuitBreakers.execute(table,
                    () -> recordStore.upsert(table, upsertRows, kind.conflictColumns())));
            long durationMs = elapsedMs(startNanos);
            
            if (outcome.isSuccess()) {
                metrics.recordFlush(kind, durationMs, true, rows.size());
                log.debug("Flushed {} {} rows in {}ms ({} attempt(s))", rows.size(), kind, durationMs, outcome.getAttempts());
                return FlushResult.builder()
                        .kind(kind)
                        .status(FlushResult.FlushStatus.SUCCEEDED)
                        .rowCount(rows.size())
                        .attempts(outcome.getAttempts())
                        .durationMs(durationMs)
                        .build();
            }
            return deadLetter(kind, rows, outcome.getFailureKind(), outcome.getErrorMessage(),
                    outcome.getAttempts(), durationMs);
            
        } catch (Exception e) {
            log.error("Unexpected error flushing {} batch of {}: {}", kind, batch.size(), e.getMessage(), e);
            List<Map<String, Object>> payloads = rows != null ? rows : fallbackPayloads(batch);
            return deadLetter(kind, payloads, FailureKind.UNEXPECTED, e.toString(), 0, elapsedMs(startNanos));
        }
    }
    
    private FlushResult deadLetter(EntityKind kind, List<Map<String, Object>> rows, FailureKind failureKind,
                                   String error, int attempts, long durationMs) {
        metrics.recordFlush(kind, durationMs, false, rows.size());
        deadLetterService.record(kind.table(), rows, failureKind, error, attempts);
        return FlushResult.builder()
                .kind(kind)
                .status(FlushResult.FlushStatus.DEAD_LETTERED)
                .rowCount(rows.size())
                .attempts(attempts)
                .durationMs(durationMs)
                .error(error)
                .build();
    }
    
    private void afterFlush(EntityKind kind) {
        queueManager.completeFlush(kind);
        metrics.updateQueueSize(queueManager.totalSize());
        int remaining = queueManager.size(kind);
        if (remaining >= queueProperties.batchSizeFor(kind)) {
            log.debug("{} queue refilled to {} during flush, flushing again", kind, remaining);
            flush(kind);
        }
    }
    
    private boolean noFlushInFlight() {
        return Arrays.stream(EntityKind.values()).noneMatch(queueManager::isFlushing);
    }
    
    private static List<Map<String, Object>> toRows(Batch batch) {
        Map<String, IngestRecord> unique = new LinkedHashMap<>();
        for (IngestRecord record : batch.getRecords()) {
            unique.merge(record.getDedupKey(), record, (previous, latest) -> latest.mergeWith(previous));
        }
        List<Map<String, Object>> rows = new ArrayList<>(unique.size());
        unique.values().forEach(record -> rows.add(record.toRow()));
        return rows;
    }
    
    private static List<Map<String, Object>> fallbackPayloads(Batch batch) {
        return batch.getRecords().stream()
                .map(record -> Map.<String, Object>of("record", String.valueOf(record)))
                .collect(Collectors.toList());
    }
    
    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}

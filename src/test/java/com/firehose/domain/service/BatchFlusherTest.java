package com.firehose.domain.service;

import com.firehose.config.IngestionProperties;
import com.firehose.domain.exception.TransientStoreException;
import com.firehose.domain.model.EntityKind;
import com.firehose.domain.model.FailureKind;
import com.firehose.domain.model.FlushResult;
import com.firehose.domain.model.FlushResult.FlushStatus;
import com.firehose.domain.queue.IngestGate;
import com.firehose.domain.queue.QueueManager;
import com.firehose.domain.resilience.RetryExecutor;
import com.firehose.domain.resilience.StoreCircuitBreakers;
import com.firehose.support.InMemoryRecordStore;
import com.firehose.support.MutableClock;
import com.firehose.support.TestEvents;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchFlusherTest {

    private static final String LIKES = EntityKind.LIKE.table();

    @Mock
    private DeadLetterService deadLetterService;

    private IngestionProperties properties;
    private IngestionMetrics metrics;
    private QueueManager queueManager;
    private InMemoryRecordStore recordStore;
    private RetryExecutor retryExecutor;
    private StoreCircuitBreakers circuitBreakers;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-09-10T00:00:00Z"));
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        properties = new IngestionProperties();
        properties.getRetry().setBaseDelay(Duration.ofMillis(10));
        metrics = new IngestionMetrics(meterRegistry, properties, clock);
        queueManager = new QueueManager(new IngestGate(clock), metrics, meterRegistry, clock);
        recordStore = new InMemoryRecordStore();
        retryExecutor = new RetryExecutor(properties, metrics, clock);
        circuitBreakers = new StoreCircuitBreakers(properties, clock);
    }

    private BatchFlusher flusher(Executor executor) {
        return new BatchFlusher(queueManager, recordStore, retryExecutor, circuitBreakers,
                deadLetterService, metrics, properties, executor);
    }

    @Test
    void flush_writesBatchAndEmptiesQueue() {
        queueManager.enqueue(TestEvents.likeRecord("a", "at://x"));
        queueManager.enqueue(TestEvents.likeRecord("b", "at://x"));

        FlushResult result = flusher(Runnable::run).flush(EntityKind.LIKE).join();

        assertEquals(FlushStatus.SUCCEEDED, result.getStatus());
        assertEquals(2, result.getRowCount());
        assertEquals(1, result.getAttempts());
        assertEquals(2, recordStore.table(LIKES).size());
        assertEquals(0, queueManager.size(EntityKind.LIKE));
        assertFalse(queueManager.isFlushing(EntityKind.LIKE));
        assertEquals(2, metrics.snapshot().getRowsFlushed());
        verifyNoInteractions(deadLetterService);
    }

    @Test
    void flush_emptyQueueIsSkipped() {
        FlushResult result = flusher(Runnable::run).flush(EntityKind.POST).join();

        assertEquals(FlushStatus.SKIPPED, result.getStatus());
        assertEquals(0, recordStore.callCount(EntityKind.POST.table()));
    }

    @Test
    void flush_exhaustedRetriesDeadLetterEveryRowOnce() {
        recordStore.failNext(3, () -> new TransientStoreException(LIKES, "connection reset", null));
        queueManager.enqueue(TestEvents.likeRecord("a", "at://x"));
        queueManager.enqueue(TestEvents.likeRecord("b", "at://x"));

        FlushResult result = flusher(Runnable::run).flush(EntityKind.LIKE).join();

        assertEquals(FlushStatus.DEAD_LETTERED, result.getStatus());
        assertEquals(3, result.getAttempts());
        assertEquals(3, recordStore.callCount(LIKES));
        verify(deadLetterService, times(1)).record(eq(LIKES), argThat(rows -> rows.size() == 2),
                eq(FailureKind.TRANSIENT), contains("connection reset"), eq(3));
        assertEquals(0, queueManager.size(EntityKind.LIKE));
        assertEquals(1, metrics.snapshot().getFlushErrors());
    }

    @Test
    void flush_nonStoreExceptionIsDeadLetteredAsUnexpected() {
        recordStore.failNext(3, () -> new IllegalStateException("driver bug"));
        queueManager.enqueue(TestEvents.likeRecord("a", "at://x"));

        FlushResult result = flusher(Runnable::run).flush(EntityKind.LIKE).join();

        assertEquals(FlushStatus.DEAD_LETTERED, result.getStatus());
        verify(deadLetterService).record(eq(LIKES), anyList(), eq(FailureKind.UNEXPECTED), anyString(), anyInt());
        assertFalse(queueManager.isFlushing(EntityKind.LIKE));
    }

    @Test
    void flush_secondFlushOfSameKindIsSkippedWhileInFlight() {
        List<Runnable> pending = new ArrayList<>();
        BatchFlusher batchFlusher = flusher(pending::add);
        queueManager.enqueue(TestEvents.likeRecord("a", "at://x"));

        CompletableFuture<FlushResult> first = batchFlusher.flush(EntityKind.LIKE);
        queueManager.enqueue(TestEvents.likeRecord("b", "at://x"));
        FlushResult second = batchFlusher.flush(EntityKind.LIKE).join();

        assertEquals(FlushStatus.SKIPPED, second.getStatus());
        assertEquals(1, pending.size());

        pending.get(0).run();
        assertEquals(1, first.join().getRowCount());
        assertFalse(queueManager.isFlushing(EntityKind.LIKE));
        assertEquals(1, queueManager.size(EntityKind.LIKE));
    }

    @Test
    void flush_refilledQueueIsFlushedAgainAfterCompletion() {
        properties.getQueue().getBatchSizes().put(EntityKind.LIKE, 2);
        List<Runnable> pending = new ArrayList<>();
        BatchFlusher batchFlusher = flusher(pending::add);
        queueManager.enqueue(TestEvents.likeRecord("a", "at://x"));
        queueManager.enqueue(TestEvents.likeRecord("b", "at://x"));
        batchFlusher.flush(EntityKind.LIKE);
        queueManager.enqueue(TestEvents.likeRecord("c", "at://x"));
        queueManager.enqueue(TestEvents.likeRecord("d", "at://x"));

        pending.get(0).run();

        assertEquals(2, pending.size());
        pending.get(1).run();
        assertEquals(List.of(2, 2), recordStore.batchSizes(LIKES));
    }

    @Test
    void flush_rejectedExecutorFlushesOnCallerThread() {
        queueManager.enqueue(TestEvents.likeRecord("a", "at://x"));
        BatchFlusher batchFlusher = flusher(task -> {
            throw new java.util.concurrent.RejectedExecutionException("shut down");
        });

        FlushResult result = batchFlusher.flush(EntityKind.LIKE).join();

        assertEquals(FlushStatus.SUCCEEDED, result.getStatus());
        assertFalse(queueManager.isFlushing(EntityKind.LIKE));
    }

    @Test
    void flush_replayedBatchLeavesStoreUnchanged() {
        queueManager.enqueue(TestEvents.likeRecord("a", "at://x"));
        BatchFlusher batchFlusher = flusher(Runnable::run);
        batchFlusher.flush(EntityKind.LIKE).join();
        Map<String, Map<String, Object>> afterFirst = recordStore.table(LIKES);

        queueManager.enqueue(TestEvents.likeRecord("a", "at://x"));
        batchFlusher.flush(EntityKind.LIKE).join();

        assertEquals(afterFirst, recordStore.table(LIKES));
    }

    @Test
    void drain_flushesEveryKind() {
        queueManager.enqueue(TestEvents.likeRecord("a", "at://x"));
        queueManager.enqueue(com.firehose.domain.model.record.UserRecord.stub("did:plc:alice", Instant.now()));

        assertTrue(flusher(Runnable::run).drain(Duration.ofSeconds(5)));

        assertEquals(0, queueManager.totalSize());
        assertEquals(1, recordStore.table(LIKES).size());
        assertEquals(1, recordStore.table(EntityKind.USER.table()).size());
    }
}

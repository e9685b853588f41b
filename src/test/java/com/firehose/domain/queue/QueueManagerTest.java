package com.firehose.domain.queue;

import com.firehose.config.IngestionProperties;
import com.firehose.domain.model.Batch;
import com.firehose.domain.model.EntityKind;
import com.firehose.domain.service.IngestionMetrics;
import com.firehose.support.MutableClock;
import com.firehose.support.TestEvents;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QueueManagerTest {

    private MutableClock clock;
    private IngestGate ingestGate;
    private IngestionMetrics metrics;
    private MeterRegistry meterRegistry;
    private QueueManager queueManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-09-10T00:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();
        ingestGate = new IngestGate(clock);
        metrics = new IngestionMetrics(meterRegistry, new IngestionProperties(), clock);
        queueManager = new QueueManager(ingestGate, metrics, meterRegistry, clock);
    }

    @Test
    void enqueue_acceptedWhenNotPaused() {
        QueueManager.EnqueueResult result = queueManager.enqueue(TestEvents.likeRecord("a", "at://x"));

        assertTrue(result.isAccepted());
        assertEquals(1, result.getQueueSize());
        assertEquals(1, queueManager.size(EntityKind.LIKE));
        assertEquals(1, queueManager.totalSize());
        assertEquals(1.0, meterRegistry.get("ingest.queue.size").tag("kind", "LIKE").gauge().value());
        assertEquals(1, metrics.snapshot().getQueueSizeMax());
    }

    @Test
    void enqueue_whilePausedDropsAndCounts() {
        ingestGate.pauseFor(Duration.ofSeconds(3));

        QueueManager.EnqueueResult result = queueManager.enqueue(TestEvents.likeRecord("a", "at://x"));

        assertFalse(result.isAccepted());
        assertEquals(0, queueManager.totalSize());
        assertEquals(1, metrics.snapshot().getDropped());
    }

    @Test
    void enqueue_acceptedAgainAfterPauseExpires() {
        ingestGate.pauseFor(Duration.ofSeconds(3));
        clock.advance(Duration.ofSeconds(3));

        assertTrue(queueManager.enqueue(TestEvents.likeRecord("a", "at://x")).isAccepted());
    }

    @Test
    void beginFlush_onlyOneInFlightPerKind() {
        queueManager.enqueue(TestEvents.likeRecord("a", "at://x"));

        Optional<Batch> first = queueManager.beginFlush(EntityKind.LIKE);
        queueManager.enqueue(TestEvents.likeRecord("b", "at://x"));
        Optional<Batch> second = queueManager.beginFlush(EntityKind.LIKE);

        assertTrue(first.isPresent());
        assertEquals(1, first.get().size());
        assertTrue(second.isEmpty());
        assertTrue(queueManager.isFlushing(EntityKind.LIKE));
        assertEquals(1, queueManager.size(EntityKind.LIKE));

        queueManager.completeFlush(EntityKind.LIKE);
        Optional<Batch> third = queueManager.beginFlush(EntityKind.LIKE);
        assertTrue(third.isPresent());
        assertEquals(1, third.get().size());
    }

    @Test
    void beginFlush_emptyQueueReleasesInFlightFlag() {
        assertTrue(queueManager.beginFlush(EntityKind.POST).isEmpty());
        assertFalse(queueManager.isFlushing(EntityKind.POST));
    }

    @Test
    void enqueue_peakSurvivesDrain() {
        queueManager.enqueue(TestEvents.likeRecord("a", "at://x"));
        queueManager.enqueue(TestEvents.likeRecord("b", "at://x"));
        queueManager.enqueue(com.firehose.domain.model.record.UserRecord.stub("did:plc:alice", clock.instant()));
        queueManager.beginFlush(EntityKind.LIKE);
        queueManager.completeFlush(EntityKind.LIKE);

        queueManager.enqueue(TestEvents.likeRecord("c", "at://x"));

        assertEquals(3, metrics.snapshot().getQueueSizeMax());
        assertEquals(2, metrics.snapshot().getQueueSizeCurrent());
    }
}

package com.firehose.domain.service;

import com.firehose.config.IngestionProperties;
import com.firehose.domain.queue.IngestGate;
import com.firehose.domain.queue.QueueManager;
import com.firehose.domain.service.BackpressureController.Trigger;
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
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BackpressureControllerTest {

    @Mock
    private BatchFlusher batchFlusher;

    private MutableClock clock;
    private IngestGate ingestGate;
    private QueueManager queueManager;
    private IngestionMetrics metrics;
    private IngestionProperties properties;
    private final AtomicLong memoryMb = new AtomicLong(200);
    private BackpressureController controller;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-09-10T00:00:00Z"));
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        properties = new IngestionProperties();
        properties.getBackpressure().setGcHintEnabled(false);
        properties.getQueue().setCapacity(3);
        ingestGate = new IngestGate(clock);
        metrics = new IngestionMetrics(meterRegistry, properties, clock);
        queueManager = new QueueManager(ingestGate, metrics, meterRegistry, clock);
        controller = new BackpressureController(ingestGate, queueManager, batchFlusher,
                memoryMb::get, metrics, properties, clock);
    }

    @Test
    void check_noPressureLeavesIngestionRunning() {
        assertNull(controller.check());
        assertFalse(controller.isPaused());
        verifyNoInteractions(batchFlusher);
    }

    @Test
    void check_hardLimitPausesAndForcesFlush() {
        memoryMb.set(1600);

        assertEquals(Trigger.MEMORY_HARD, controller.check());

        assertTrue(controller.isPaused());
        assertEquals(clock.instant().plusSeconds(6), ingestGate.getPausedUntil().orElseThrow());
        verify(batchFlusher).flushAll();
        assertEquals(1, metrics.snapshot().getBackpressureEvents());
    }

    @Test
    void check_softLimitPausesWithoutFlush() {
        memoryMb.set(1300);

        assertEquals(Trigger.MEMORY_SOFT, controller.check());

        assertEquals(clock.instant().plusSeconds(3), ingestGate.getPausedUntil().orElseThrow());
        verify(batchFlusher, never()).flushAll();
    }

    @Test
    void check_queueCapacityPauses() {
        for (String rkey : new String[] {"a", "b", "c"}) {
            queueManager.enqueue(TestEvents.likeRecord(rkey, "at://x"));
        }

        assertEquals(Trigger.QUEUE_CAPACITY, controller.check());
        assertTrue(controller.isPaused());
    }

    @Test
    void check_hardLimitTakesPriorityOverQueueCapacity() {
        for (String rkey : new String[] {"a", "b", "c"}) {
            queueManager.enqueue(TestEvents.likeRecord(rkey, "at://x"));
        }
        memoryMb.set(1500);

        assertEquals(Trigger.MEMORY_HARD, controller.check());
    }

    @Test
    void check_pauseExpiresAfterCooldown() {
        memoryMb.set(1300);
        controller.check();
        memoryMb.set(200);

        clock.advance(Duration.ofSeconds(2));
        assertTrue(controller.isPaused());
        clock.advance(Duration.ofSeconds(1));
        assertFalse(controller.isPaused());
        assertNull(controller.check());
    }

    @Test
    void check_recordsArrivingWhilePausedAreDropped() {
        memoryMb.set(1300);
        controller.check();

        assertFalse(queueManager.enqueue(TestEvents.likeRecord("a", "at://x")).isAccepted());
        assertEquals(1, metrics.snapshot().getDropped());
    }

    @Test
    void check_hardLimitPauseExpiresAfterHardCooldown() {
        memoryMb.set(1600);
        controller.check();
        memoryMb.set(200);

        clock.advance(Duration.ofSeconds(5));
        assertTrue(controller.isPaused());
        assertFalse(queueManager.enqueue(TestEvents.likeRecord("a", "at://x")).isAccepted());

        clock.advance(Duration.ofSeconds(1));
        assertFalse(controller.isPaused());
        assertNull(controller.check());
        assertTrue(queueManager.enqueue(TestEvents.likeRecord("b", "at://x")).isAccepted());
    }
}

package com.firehose.domain.queue;

import com.firehose.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class IngestGateTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-09-10T00:00:00Z"));
    private final IngestGate gate = new IngestGate(clock);

    @Test
    void pauseFor_keepsLongerExistingPause() {
        Instant longUntil = gate.pauseFor(Duration.ofSeconds(6));
        Instant shortUntil = gate.pauseFor(Duration.ofSeconds(3));

        assertEquals(longUntil, shortUntil);
        clock.advance(Duration.ofSeconds(4));
        assertTrue(gate.isPaused());
        clock.advance(Duration.ofSeconds(2));
        assertFalse(gate.isPaused());
        assertTrue(gate.getPausedUntil().isEmpty());
    }

    @Test
    void resume_clearsPauseImmediately() {
        gate.pauseFor(Duration.ofSeconds(6));

        gate.resume();

        assertFalse(gate.isPaused());
    }
}

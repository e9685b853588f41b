package com.firehose.domain.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Shared pause flag between the resource monitor and the enqueue path.
 * 
 * The flag is a deadline rather than a boolean: ingestion resumes as soon as the
 * deadline passes, so a pause cannot outlive its cooldown even if no timer fires.
 */
@Slf4j
@Component
public class IngestGate {
    
    private final Clock clock;
    private volatile Instant pausedUntil;
    
    public IngestGate(Clock clock) {
        this.clock = clock;
    }
    
    public boolean isPaused() {
        Instant until = pausedUntil;
        return until != null && clock.instant().isBefore(until);
    }
    
    /**
     * Pause ingestion for {@code cooldown}. An already longer pause is kept.
     */
    public synchronized Instant pauseFor(Duration cooldown) {
        Instant candidate = clock.instant().plus(cooldown);
        if (pausedUntil == null || candidate.isAfter(pausedUntil)) {
            pausedUntil = candidate;
        }
        return pausedUntil;
    }
    
    public synchronized void resume() {
        pausedUntil = null;
    }
    
    public Optional<Instant> getPausedUntil() {
        return isPaused() ? Optional.ofNullable(pausedUntil) : Optional.empty();
    }
}

package com.firehose.domain.exception;

import java.time.Instant;
import java.util.Optional;

/**
 * Upstream refused the call because of a rate or connection limit.
 * 
 * When the upstream advertises a reset time the retry waits until then,
 * otherwise the regular exponential schedule applies.
 */
public class RateLimitedException extends TransientStoreException {
    
    private final Instant resetAt;
    
    public RateLimitedException(String destination, String message, Instant resetAt, Throwable cause) {
        super(destination, message, cause);
        this.resetAt = resetAt;
    }
    
    public Optional<Instant> getResetAt() {
        return Optional.ofNullable(resetAt);
    }
}

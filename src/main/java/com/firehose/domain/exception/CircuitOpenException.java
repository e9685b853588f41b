package com.firehose.domain.exception;

/**
 * The destination's circuit breaker rejected the call without invoking the store.
 */
public class CircuitOpenException extends TransientStoreException {
    
    public CircuitOpenException(String destination, Throwable cause) {
        super(destination, "Circuit breaker open for " + destination, cause);
    }
}

package com.firehose.domain.model;

import com.firehose.domain.exception.CircuitOpenException;
import com.firehose.domain.exception.PermanentStoreException;
import com.firehose.domain.exception.RateLimitedException;
import com.firehose.domain.exception.StoreException;
import com.firehose.domain.exception.TransientStoreException;

public enum FailureKind {
    TRANSIENT,
    PERMANENT,
    RATE_LIMITED,
    CIRCUIT_OPEN,
    UNCLASSIFIED,
    UNEXPECTED;
    
    public static FailureKind of(Throwable error) {
        if (error instanceof CircuitOpenException) {
            return CIRCUIT_OPEN;
        }
        if (error instanceof RateLimitedException) {
            return RATE_LIMITED;
        }
        if (error instanceof TransientStoreException) {
            return TRANSIENT;
        }
        if (error instanceof PermanentStoreException) {
            return PERMANENT;
        }
        if (error instanceof StoreException) {
            return UNCLASSIFIED;
        }
        return UNEXPECTED;
    }
}

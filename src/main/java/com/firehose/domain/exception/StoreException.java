package com.firehose.domain.exception;

import lombok.Getter;

/**
 * Failure of a store write that could not be classified further.
 * 
 * Subclasses split store failures into transient ones (worth retrying)
 * and permanent ones (the same batch will fail again).
 */
@Getter
public class StoreException extends RuntimeException {
    
    private final String destination;
    
    public StoreException(String destination, String message, Throwable cause) {
        super(message, cause);
        this.destination = destination;
    }
}

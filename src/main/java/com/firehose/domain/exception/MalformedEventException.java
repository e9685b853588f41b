package com.firehose.domain.exception;

/**
 * Raised when an event is missing a field its record kind requires.
 * The event is dropped and counted; it never reaches a queue.
 */
public class MalformedEventException extends RuntimeException {
    
    public MalformedEventException(String message) {
        super(message);
    }
    
    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}

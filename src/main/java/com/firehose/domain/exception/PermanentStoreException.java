package com.firehose.domain.exception;

/**
 * Store rejected the batch for a reason a retry cannot fix
 * (constraint violation, bad SQL, unsupported value).
 */
public class PermanentStoreException extends StoreException {
    
    public PermanentStoreException(String destination, String message, Throwable cause) {
        super(destination, message, cause);
    }
}

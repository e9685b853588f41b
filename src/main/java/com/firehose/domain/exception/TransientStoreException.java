package com.firehose.domain.exception;

public class TransientStoreException extends StoreException {
    
    public TransientStoreException(String destination, String message, Throwable cause) {
        super(destination, message, cause);
    }
}

package com.firehose.domain.model;

import lombok.Value;

/**
 * Result of a store write after retries, returned instead of thrown so the
 * flusher can decide on dead-lettering and metrics in one place.
 */
@Value
public class WriteOutcome {
    
    boolean success;
    int attempts;
    FailureKind failureKind;
    String errorMessage;
    
    public static WriteOutcome success(int attempts) {
        return new WriteOutcome(true, attempts, null, null);
    }
    
    public static WriteOutcome failure(int attempts, Throwable error) {
        return new WriteOutcome(false, attempts, FailureKind.of(error), describe(error));
    }
    
    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}

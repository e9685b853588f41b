package com.firehose.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FlushResult {
    
    EntityKind kind;
    FlushStatus status;
    int rowCount;
    int attempts;
    long durationMs;
    String error;
    
    public enum FlushStatus {
        SUCCEEDED,
        DEAD_LETTERED,
        SKIPPED
    }
    
    public static FlushResult skipped(EntityKind kind) {
        return FlushResult.builder()
                .kind(kind)
                .status(FlushStatus.SKIPPED)
                .build();
    }
}

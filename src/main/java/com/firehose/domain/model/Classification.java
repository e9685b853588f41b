package com.firehose.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Result of classifying one event: the records to enqueue, or an explicit
 * ignored outcome for collections and operations the pipeline does not store.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Classification {
    
    private final List<IngestRecord> records;
    private final String ignoredReason;
    
    public static Classification of(List<IngestRecord> records) {
        return new Classification(List.copyOf(records), null);
    }
    
    public static Classification ignored(String reason) {
        return new Classification(List.of(), reason);
    }
    
    public boolean isIgnored() {
        return ignoredReason != null;
    }
}

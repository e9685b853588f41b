package com.firehose.domain.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of one queue taken at flush time.
 */
@Value
public class Batch {
    
    EntityKind kind;
    List<IngestRecord> records;
    Instant takenAt;
    
    public Batch(EntityKind kind, List<IngestRecord> records, Instant takenAt) {
        this.kind = kind;
        this.records = List.copyOf(records);
        this.takenAt = takenAt;
    }
    
    public int size() {
        return records.size();
    }
    
    public boolean isEmpty() {
        return records.isEmpty();
    }
}

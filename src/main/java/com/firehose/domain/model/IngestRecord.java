package com.firehose.domain.model;

import com.firehose.domain.exception.MalformedEventException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Normalized record produced by the classifier.
 * 
 * One concrete subclass exists per {@link EntityKind}. Each subclass validates
 * its required identifiers on construction, so an instance that exists is
 * always safe to enqueue.
 * 
 * Identity:
 * - The dedup key is built from the values of the kind's conflict columns
 * - Two records with the same key are the same row in the destination table
 */
public abstract class IngestRecord {
    
    static final String KEY_SEPARATOR = "|";
    
    public abstract EntityKind getKind();
    
    /**
     * Column values for the destination table, in a stable column order.
     * Values may be null; the store never overwrites a stored value with null.
     */
    public abstract Map<String, Object> toRow();
    
    public String getDedupKey() {
        Map<String, Object> row = toRow();
        return getKind().conflictColumns().stream()
                .map(column -> String.valueOf(row.get(column)))
                .collect(Collectors.joining(KEY_SEPARATOR));
    }
    
    /**
     * Resolve an overwrite of {@code previous} by this record in the same queue.
     * The later record wins by default.
     */
    public IngestRecord mergeWith(IngestRecord previous) {
        return this;
    }
    
    protected static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new MalformedEventException("Missing required field: " + field);
        }
        return value;
    }
}

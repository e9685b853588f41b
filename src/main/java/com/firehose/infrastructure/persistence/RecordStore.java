package com.firehose.infrastructure.persistence;

import java.util.List;
import java.util.Map;

/**
 * Upsert contract of the relational store.
 * 
 * Implementations must be idempotent: writing the same rows twice leaves the
 * same table state as writing them once.
 */
public interface RecordStore {
    
    /**
     * Insert rows, updating existing rows that collide on {@code conflictColumns}.
     *
     * @throws com.firehose.domain.exception.StoreException classified as transient,
     *         permanent or rate-limited where the cause allows it
     */
    void upsert(String table, List<Map<String, Object>> rows, List<String> conflictColumns);
}

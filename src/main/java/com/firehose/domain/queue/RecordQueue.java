package com.firehose.domain.queue;

import com.firehose.domain.model.EntityKind;
import com.firehose.domain.model.IngestRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Insertion-ordered, deduplicating buffer for one entity kind.
 * 
 * Enqueue and drain share one monitor; drain swaps the backing map for an empty
 * one, so a record enqueued concurrently lands either in the drained snapshot or
 * in the fresh map, never in both and never in neither.
 */
public class RecordQueue {
    
    private final EntityKind kind;
    private LinkedHashMap<String, IngestRecord> entries = new LinkedHashMap<>();
    
    public RecordQueue(EntityKind kind) {
        this.kind = kind;
    }
    
    public EntityKind getKind() {
        return kind;
    }
    
    /**
     * Insert or overwrite by dedup key.
     *
     * @return queue size after the insert
     */
    public synchronized int put(IngestRecord record) {
        if (record.getKind() != kind) {
            throw new IllegalArgumentException("Record of kind " + record.getKind() + " offered to " + kind + " queue");
        }
        entries.merge(record.getDedupKey(), record, (previous, latest) -> latest.mergeWith(previous));
        return entries.size();
    }
    
    public synchronized List<IngestRecord> drain() {
        LinkedHashMap<String, IngestRecord> drained = entries;
        entries = new LinkedHashMap<>();
        return new ArrayList<>(drained.values());
    }
    
    public synchronized int size() {
        return entries.size();
    }
}

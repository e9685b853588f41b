package com.firehose.domain.model.record;

import com.firehose.domain.model.EntityKind;
import com.firehose.domain.model.IngestRecord;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@EqualsAndHashCode(callSuper = false)
public class ListItemRecord extends IngestRecord {
    
    String uri;
    String ownerDid;
    String listUri;
    String subjectDid;
    Instant createdAt;
    Instant indexedAt;
    
    @Builder
    public ListItemRecord(String uri, String ownerDid, String listUri, String subjectDid,
                          Instant createdAt, Instant indexedAt) {
        this.uri = requireText(uri, "uri");
        this.ownerDid = requireText(ownerDid, "ownerDid");
        this.listUri = requireText(listUri, "list");
        this.subjectDid = requireText(subjectDid, "subject");
        this.createdAt = createdAt;
        this.indexedAt = indexedAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.LIST_ITEM;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("uri", uri);
        row.put("owner_did", ownerDid);
        row.put("list_uri", listUri);
        row.put("subject_did", subjectDid);
        row.put("created_at", createdAt);
        row.put("indexed_at", indexedAt);
        return row;
    }
}

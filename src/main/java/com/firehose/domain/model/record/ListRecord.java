package com.firehose.domain.model.record;

import com.firehose.domain.model.EntityKind;
import com.firehose.domain.model.IngestRecord;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Curation or moderation list owned by an actor.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class ListRecord extends IngestRecord {
    
    String uri;
    String ownerDid;
    String name;
    String purpose;
    String description;
    String avatarCid;
    Instant createdAt;
    Instant indexedAt;
    
    @Builder
    public ListRecord(String uri, String ownerDid, String name, String purpose, String description,
                      String avatarCid, Instant createdAt, Instant indexedAt) {
        this.uri = requireText(uri, "uri");
        this.ownerDid = requireText(ownerDid, "ownerDid");
        this.name = name;
        this.purpose = purpose;
        this.description = description;
        this.avatarCid = avatarCid;
        this.createdAt = createdAt;
        this.indexedAt = indexedAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.LIST;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("uri", uri);
        row.put("owner_did", ownerDid);
        row.put("name", name);
        row.put("purpose", purpose);
        row.put("description", description);
        row.put("avatar_cid", avatarCid);
        row.put("created_at", createdAt);
        row.put("indexed_at", indexedAt);
        return row;
    }
}

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
public class FeedGeneratorRecord extends IngestRecord {
    
    String uri;
    String ownerDid;
    String serviceDid;
    String displayName;
    String description;
    String avatarCid;
    Boolean acceptsInteractions;
    String labelsJson;
    Instant createdAt;
    Instant indexedAt;
    
    @Builder
    public FeedGeneratorRecord(String uri, String ownerDid, String serviceDid, String displayName,
                               String description, String avatarCid, Boolean acceptsInteractions,
                               String labelsJson, Instant createdAt, Instant indexedAt) {
        this.uri = requireText(uri, "uri");
        this.ownerDid = requireText(ownerDid, "ownerDid");
        this.serviceDid = serviceDid;
        this.displayName = displayName;
        this.description = description;
        this.avatarCid = avatarCid;
        this.acceptsInteractions = acceptsInteractions;
        this.labelsJson = labelsJson;
        this.createdAt = createdAt;
        this.indexedAt = indexedAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.FEED_GENERATOR;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("uri", uri);
        row.put("owner_did", ownerDid);
        row.put("service_did", serviceDid);
        row.put("display_name", displayName);
        row.put("description", description);
        row.put("avatar_cid", avatarCid);
        row.put("accepts_interactions", acceptsInteractions);
        row.put("labels", labelsJson);
        row.put("created_at", createdAt);
        row.put("indexed_at", indexedAt);
        return row;
    }
}

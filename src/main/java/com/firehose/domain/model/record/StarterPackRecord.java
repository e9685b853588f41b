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
public class StarterPackRecord extends IngestRecord {
    
    String uri;
    String ownerDid;
    String name;
    String description;
    String listUri;
    String feedsJson;
    Instant createdAt;
    Instant indexedAt;
    
    @Builder
    public StarterPackRecord(String uri, String ownerDid, String name, String description,
                             String listUri, String feedsJson, Instant createdAt, Instant indexedAt) {
        this.uri = requireText(uri, "uri");
        this.ownerDid = requireText(ownerDid, "ownerDid");
        this.name = name;
        this.description = description;
        this.listUri = listUri;
        this.feedsJson = feedsJson;
        this.createdAt = createdAt;
        this.indexedAt = indexedAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.STARTER_PACK;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("uri", uri);
        row.put("owner_did", ownerDid);
        row.put("name", name);
        row.put("description", description);
        row.put("list_uri", listUri);
        row.put("feeds", feedsJson);
        row.put("created_at", createdAt);
        row.put("indexed_at", indexedAt);
        return row;
    }
}

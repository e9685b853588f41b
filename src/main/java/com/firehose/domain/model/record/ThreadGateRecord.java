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
 * Reply restrictions attached to a post. A post has at most one gate.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class ThreadGateRecord extends IngestRecord {
    
    String postUri;
    String uri;
    String ownerDid;
    String allowJson;
    Instant createdAt;
    Instant indexedAt;
    
    @Builder
    public ThreadGateRecord(String postUri, String uri, String ownerDid, String allowJson,
                            Instant createdAt, Instant indexedAt) {
        this.postUri = requireText(postUri, "post");
        this.uri = uri;
        this.ownerDid = requireText(ownerDid, "ownerDid");
        this.allowJson = allowJson;
        this.createdAt = createdAt;
        this.indexedAt = indexedAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.THREAD_GATE;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("post_uri", postUri);
        row.put("uri", uri);
        row.put("owner_did", ownerDid);
        row.put("allow_rules", allowJson);
        row.put("created_at", createdAt);
        row.put("indexed_at", indexedAt);
        return row;
    }
}

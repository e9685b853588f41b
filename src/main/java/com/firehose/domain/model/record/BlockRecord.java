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
public class BlockRecord extends IngestRecord {
    
    String uri;
    String blockerDid;
    String blockedDid;
    Instant createdAt;
    Instant indexedAt;
    
    @Builder
    public BlockRecord(String uri, String blockerDid, String blockedDid,
                       Instant createdAt, Instant indexedAt) {
        this.uri = requireText(uri, "uri");
        this.blockerDid = requireText(blockerDid, "blockerDid");
        this.blockedDid = requireText(blockedDid, "subject");
        this.createdAt = createdAt;
        this.indexedAt = indexedAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.BLOCK;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("uri", uri);
        row.put("blocker_did", blockerDid);
        row.put("blocked_did", blockedDid);
        row.put("created_at", createdAt);
        row.put("indexed_at", indexedAt);
        return row;
    }
}

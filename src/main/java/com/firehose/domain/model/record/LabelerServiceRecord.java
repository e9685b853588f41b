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
public class LabelerServiceRecord extends IngestRecord {
    
    String uri;
    String ownerDid;
    String policiesJson;
    String labelsJson;
    Instant createdAt;
    Instant indexedAt;
    
    @Builder
    public LabelerServiceRecord(String uri, String ownerDid, String policiesJson, String labelsJson,
                                Instant createdAt, Instant indexedAt) {
        this.uri = requireText(uri, "uri");
        this.ownerDid = requireText(ownerDid, "ownerDid");
        this.policiesJson = policiesJson;
        this.labelsJson = labelsJson;
        this.createdAt = createdAt;
        this.indexedAt = indexedAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.LABELER_SERVICE;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("uri", uri);
        row.put("owner_did", ownerDid);
        row.put("policies", policiesJson);
        row.put("labels", labelsJson);
        row.put("created_at", createdAt);
        row.put("indexed_at", indexedAt);
        return row;
    }
}

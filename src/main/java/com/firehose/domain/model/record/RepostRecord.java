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
 * A repost of a post, keyed by the repost record's own URI.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class RepostRecord extends IngestRecord {
    
    String uri;
    String authorDid;
    String subjectUri;
    String subjectCid;
    Instant createdAt;
    Instant indexedAt;
    
    @Builder
    public RepostRecord(String uri, String authorDid, String subjectUri, String subjectCid,
                      Instant createdAt, Instant indexedAt) {
        this.uri = requireText(uri, "uri");
        this.authorDid = requireText(authorDid, "authorDid");
        this.subjectUri = requireText(subjectUri, "subject.uri");
        this.subjectCid = subjectCid;
        this.createdAt = createdAt;
        this.indexedAt = indexedAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.REPOST;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("uri", uri);
        row.put("author_did", authorDid);
        row.put("subject_uri", subjectUri);
        row.put("subject_cid", subjectCid);
        row.put("created_at", createdAt);
        row.put("indexed_at", indexedAt);
        return row;
    }
}

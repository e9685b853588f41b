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
public class PostRecord extends IngestRecord {
    
    String uri;
    String cid;
    String authorDid;
    String text;
    String replyParentUri;
    String replyRootUri;
    String embedType;
    String embedJson;
    String langs;
    Instant createdAt;
    Instant indexedAt;
    
    @Builder
    public PostRecord(String uri, String cid, String authorDid, String text,
                      String replyParentUri, String replyRootUri, String embedType, String embedJson,
                      String langs, Instant createdAt, Instant indexedAt) {
        this.uri = requireText(uri, "uri");
        this.cid = cid;
        this.authorDid = requireText(authorDid, "authorDid");
        this.text = text;
        this.replyParentUri = replyParentUri;
        this.replyRootUri = replyRootUri;
        this.embedType = embedType;
        this.embedJson = embedJson;
        this.langs = langs;
        this.createdAt = createdAt;
        this.indexedAt = indexedAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.POST;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("uri", uri);
        row.put("cid", cid);
        row.put("author_did", authorDid);
        row.put("text", text);
        row.put("reply_parent", replyParentUri);
        row.put("reply_root", replyRootUri);
        row.put("embed_type", embedType);
        row.put("embed", embedJson);
        row.put("langs", langs);
        row.put("created_at", createdAt);
        row.put("indexed_at", indexedAt);
        return row;
    }
}

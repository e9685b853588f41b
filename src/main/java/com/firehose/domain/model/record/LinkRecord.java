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
public class LinkRecord extends IngestRecord {
    
    String postUri;
    String authorDid;
    String url;
    String domain;
    int position;
    Instant createdAt;
    
    @Builder
    public LinkRecord(String postUri, String authorDid, String url, String domain,
                      int position, Instant createdAt) {
        this.postUri = requireText(postUri, "postUri");
        this.authorDid = authorDid;
        this.url = requireText(url, "url");
        this.domain = domain;
        this.position = position;
        this.createdAt = createdAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.LINK;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("post_uri", postUri);
        row.put("author_did", authorDid);
        row.put("url", url);
        row.put("domain", domain);
        row.put("position", position);
        row.put("created_at", createdAt);
        return row;
    }
}

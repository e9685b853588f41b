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
 * Hashtag used in a post. {@code tag} is the lowercase form used for identity,
 * {@code originalTag} keeps the author's spelling.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class HashtagRecord extends IngestRecord {
    
    String postUri;
    String authorDid;
    String tag;
    String originalTag;
    int position;
    Instant createdAt;
    
    @Builder
    public HashtagRecord(String postUri, String authorDid, String tag, String originalTag,
                         int position, Instant createdAt) {
        this.postUri = requireText(postUri, "postUri");
        this.authorDid = authorDid;
        this.tag = requireText(tag, "tag");
        this.originalTag = originalTag;
        this.position = position;
        this.createdAt = createdAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.HASHTAG;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("post_uri", postUri);
        row.put("author_did", authorDid);
        row.put("tag", tag);
        row.put("original_tag", originalTag);
        row.put("position", position);
        row.put("created_at", createdAt);
        return row;
    }
}

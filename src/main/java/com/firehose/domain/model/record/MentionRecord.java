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
public class MentionRecord extends IngestRecord {
    
    String postUri;
    String authorDid;
    String mentionedHandle;
    int position;
    Instant createdAt;
    
    @Builder
    public MentionRecord(String postUri, String authorDid, String mentionedHandle,
                         int position, Instant createdAt) {
        this.postUri = requireText(postUri, "postUri");
        this.authorDid = authorDid;
        this.mentionedHandle = requireText(mentionedHandle, "mentionedHandle");
        this.position = position;
        this.createdAt = createdAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.MENTION;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("post_uri", postUri);
        row.put("author_did", authorDid);
        row.put("mentioned_handle", mentionedHandle);
        row.put("position", position);
        row.put("created_at", createdAt);
        return row;
    }
}

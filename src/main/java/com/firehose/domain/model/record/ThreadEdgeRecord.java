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
 * Reply edge derived from a post. Depth is 1 for a direct reply to the thread
 * root and 2 for anything deeper; exact depth is not known from one event.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class ThreadEdgeRecord extends IngestRecord {
    
    String postUri;
    String authorDid;
    String parentUri;
    String rootUri;
    int depth;
    Instant createdAt;
    
    @Builder
    public ThreadEdgeRecord(String postUri, String authorDid, String parentUri, String rootUri,
                            int depth, Instant createdAt) {
        this.postUri = requireText(postUri, "postUri");
        this.authorDid = authorDid;
        this.parentUri = requireText(parentUri, "reply.parent.uri");
        this.rootUri = requireText(rootUri, "reply.root.uri");
        this.depth = depth;
        this.createdAt = createdAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.THREAD_EDGE;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("post_uri", postUri);
        row.put("author_did", authorDid);
        row.put("parent_uri", parentUri);
        row.put("root_uri", rootUri);
        row.put("depth", depth);
        row.put("created_at", createdAt);
        return row;
    }
}

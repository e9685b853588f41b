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
 * Directed follow edge. Identity is the (follower, following) pair, not the
 * record URI, so a re-follow overwrites the earlier edge.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class FollowRecord extends IngestRecord {
    
    String uri;
    String followerDid;
    String followingDid;
    Instant createdAt;
    Instant indexedAt;
    
    @Builder
    public FollowRecord(String uri, String followerDid, String followingDid,
                        Instant createdAt, Instant indexedAt) {
        this.uri = uri;
        this.followerDid = requireText(followerDid, "followerDid");
        this.followingDid = requireText(followingDid, "subject");
        this.createdAt = createdAt;
        this.indexedAt = indexedAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.FOLLOW;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("uri", uri);
        row.put("follower_did", followerDid);
        row.put("following_did", followingDid);
        row.put("created_at", createdAt);
        row.put("indexed_at", indexedAt);
        return row;
    }
}

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
 * Actor profile. Most user records are bare {@code did} stubs emitted for every
 * actor seen in the stream; profile events carry the full set of fields.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class UserRecord extends IngestRecord {
    
    String did;
    String displayName;
    String description;
    String avatarCid;
    String bannerCid;
    Instant updatedAt;
    
    @Builder
    public UserRecord(String did, String displayName, String description,
                      String avatarCid, String bannerCid, Instant updatedAt) {
        this.did = requireText(did, "did");
        this.displayName = displayName;
        this.description = description;
        this.avatarCid = avatarCid;
        this.bannerCid = bannerCid;
        this.updatedAt = updatedAt;
    }
    
    public static UserRecord stub(String did, Instant seenAt) {
        return UserRecord.builder().did(did).updatedAt(seenAt).build();
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.USER;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("did", did);
        row.put("display_name", displayName);
        row.put("description", description);
        row.put("avatar_cid", avatarCid);
        row.put("banner_cid", bannerCid);
        row.put("updated_at", updatedAt);
        return row;
    }
    
    /**
     * Later values win, but a stub never erases profile fields enqueued before it.
     */
    @Override
    public IngestRecord mergeWith(IngestRecord previous) {
        if (!(previous instanceof UserRecord)) {
            return this;
        }
        UserRecord older = (UserRecord) previous;
        return new UserRecord(
                did,
                displayName != null ? displayName : older.displayName,
                description != null ? description : older.description,
                avatarCid != null ? avatarCid : older.avatarCid,
                bannerCid != null ? bannerCid : older.bannerCid,
                updatedAt != null ? updatedAt : older.updatedAt
        );
    }
}

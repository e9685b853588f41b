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
 * Posting activity of an author in one hour-of-week slot (UTC).
 * Day of week follows the 0 = Sunday convention.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class ActivitySampleRecord extends IngestRecord {
    
    String authorDid;
    int hourOfDay;
    int dayOfWeek;
    String lastPostUri;
    Instant lastActiveAt;
    
    @Builder
    public ActivitySampleRecord(String authorDid, int hourOfDay, int dayOfWeek,
                                String lastPostUri, Instant lastActiveAt) {
        this.authorDid = requireText(authorDid, "authorDid");
        this.hourOfDay = hourOfDay;
        this.dayOfWeek = dayOfWeek;
        this.lastPostUri = lastPostUri;
        this.lastActiveAt = lastActiveAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.ACTIVITY_SAMPLE;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("author_did", authorDid);
        row.put("hour_of_day", hourOfDay);
        row.put("day_of_week", dayOfWeek);
        row.put("last_post_uri", lastPostUri);
        row.put("last_active_at", lastActiveAt);
        return row;
    }
}

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
 * Media embedded in a post: an image, a video, an external link card or a quoted record.
 * Images carry a blob CID and no URL, so identity is the index within the post's embed.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class MediaAttachmentRecord extends IngestRecord {
    
    String postUri;
    String authorDid;
    int mediaIndex;
    String mediaType;
    String mediaUrl;
    String mediaCid;
    String altText;
    String mimeType;
    Integer width;
    Integer height;
    Instant createdAt;
    
    @Builder
    public MediaAttachmentRecord(String postUri, String authorDid, int mediaIndex, String mediaType,
                                 String mediaUrl, String mediaCid, String altText, String mimeType,
                                 Integer width, Integer height, Instant createdAt) {
        this.postUri = requireText(postUri, "postUri");
        this.authorDid = authorDid;
        this.mediaIndex = mediaIndex;
        this.mediaType = requireText(mediaType, "mediaType");
        this.mediaUrl = mediaUrl;
        this.mediaCid = mediaCid;
        this.altText = altText;
        this.mimeType = mimeType;
        this.width = width;
        this.height = height;
        this.createdAt = createdAt;
    }
    
    @Override
    public EntityKind getKind() {
        return EntityKind.MEDIA_ATTACHMENT;
    }
    
    @Override
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("post_uri", postUri);
        row.put("author_did", authorDid);
        row.put("media_index", mediaIndex);
        row.put("media_type", mediaType);
        row.put("media_url", mediaUrl);
        row.put("media_cid", mediaCid);
        row.put("alt_text", altText);
        row.put("mime_type", mimeType);
        row.put("width", width);
        row.put("height", height);
        row.put("created_at", createdAt);
        return row;
    }
}

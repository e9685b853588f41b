package com.firehose.domain.model;

import java.util.List;

/**
 * Entity kinds handled by the pipeline.
 * 
 * Each kind owns one in-memory queue and maps to one destination table.
 * The conflict columns are the upsert target and also define the in-memory
 * dedup key, so both layers agree on record identity.
 */
public enum EntityKind {
    
    USER("bluesky_users", "did"),
    POST("bluesky_posts", "uri"),
    LIKE("bluesky_likes", "uri"),
    REPOST("bluesky_reposts", "uri"),
    FOLLOW("bluesky_follows", "follower_did", "following_did"),
    BLOCK("bluesky_blocks", "uri"),
    LIST("bluesky_lists", "uri"),
    LIST_ITEM("bluesky_list_items", "uri"),
    THREAD_EDGE("bluesky_threads", "post_uri"),
    MENTION("bluesky_mentions", "post_uri", "mentioned_handle"),
    HASHTAG("bluesky_hashtags", "post_uri", "tag"),
    LINK("bluesky_links", "post_uri", "url"),
    MEDIA_ATTACHMENT("bluesky_media", "post_uri", "media_index"),
    ACTIVITY_SAMPLE("bluesky_activity_patterns", "author_did", "hour_of_day", "day_of_week"),
    FEED_GENERATOR("bluesky_feed_generators", "uri"),
    THREAD_GATE("bluesky_threadgates", "post_uri"),
    STARTER_PACK("bluesky_starterpacks", "uri"),
    LABELER_SERVICE("bluesky_labeler_services", "uri");
    
    private final String table;
    private final List<String> conflictColumns;
    
    EntityKind(String table, String... conflictColumns) {
        this.table = table;
        this.conflictColumns = List.of(conflictColumns);
    }
    
    public String table() {
        return table;
    }
    
    public List<String> conflictColumns() {
        return conflictColumns;
    }
}

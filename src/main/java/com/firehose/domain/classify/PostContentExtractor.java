package com.firehose.domain.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.firehose.domain.model.record.ActivitySampleRecord;
import com.firehose.domain.model.record.HashtagRecord;
import com.firehose.domain.model.record.LinkRecord;
import com.firehose.domain.model.record.MediaAttachmentRecord;
import com.firehose.domain.model.record.MentionRecord;
import com.firehose.domain.model.record.ThreadEdgeRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives secondary records from a post: mentions, hashtags, links, reply
 * structure, embedded media and the author's activity slot.
 * 
 * Pure functions of the post; no I/O.
 */
@Slf4j
@Component
public class PostContentExtractor {
    
    private static final Pattern MENTION = Pattern.compile("@([a-zA-Z0-9.-]+(?:\\.[a-zA-Z]{2,})?)");
    private static final Pattern HASHTAG = Pattern.compile("#([a-zA-Z0-9_]+)");
    private static final Pattern URL = Pattern.compile(
            "https?://(www\\.)?[-a-zA-Z0-9@:%._+~#=]{1,256}\\.[a-zA-Z0-9()]{1,6}\\b([-a-zA-Z0-9()@:%_+.~#?&/=]*)");
    
    static final String EMBED_IMAGES = "app.bsky.embed.images";
    static final String EMBED_VIDEO = "app.bsky.embed.video";
    static final String EMBED_EXTERNAL = "app.bsky.embed.external";
    static final String EMBED_RECORD = "app.bsky.embed.record";
    static final String EMBED_RECORD_WITH_MEDIA = "app.bsky.embed.recordWithMedia";
    
    public List<MentionRecord> mentions(String postUri, String authorDid, String text, Instant createdAt) {
        List<MentionRecord> mentions = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return mentions;
        }
        Matcher matcher = MENTION.matcher(text);
        while (matcher.find()) {
            mentions.add(MentionRecord.builder()
                    .postUri(postUri)
                    .authorDid(authorDid)
                    .mentionedHandle(matcher.group(1).toLowerCase(Locale.ROOT))
                    .position(matcher.start())
                    .createdAt(createdAt)
                    .build());
        }
        return mentions;
    }
    
    public List<HashtagRecord> hashtags(String postUri, String authorDid, String text, Instant createdAt) {
        List<HashtagRecord> hashtags = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return hashtags;
        }
        Matcher matcher = HASHTAG.matcher(text);
        while (matcher.find()) {
            String tag = matcher.group(1);
            hashtags.add(HashtagRecord.builder()
                    .postUri(postUri)
                    .authorDid(authorDid)
                    .tag(tag.toLowerCase(Locale.ROOT))
                    .originalTag(tag)
                    .position(matcher.start())
                    .createdAt(createdAt)
                    .build());
        }
        return hashtags;
    }
    
    public List<LinkRecord> links(String postUri, String authorDid, String text, Instant createdAt) {
        List<LinkRecord> links = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return links;
        }
        Matcher matcher = URL.matcher(text);
        while (matcher.find()) {
            String url = matcher.group();
            Optional<String> domain = domainOf(url);
            if (domain.isEmpty()) {
                log.debug("Skipping unparseable link in {}: {}", postUri, url);
                continue;
            }
            links.add(LinkRecord.builder()
                    .postUri(postUri)
                    .authorDid(authorDid)
                    .url(url)
                    .domain(domain.get())
                    .position(matcher.start())
                    .createdAt(createdAt)
                    .build());
        }
        return links;
    }
    
    /**
     * Reply edge for a post, if the post is a reply with both parent and root set.
     */
    public Optional<ThreadEdgeRecord> threadEdge(String postUri, String authorDid, JsonNode record, Instant createdAt) {
        JsonNode reply = record.path("reply");
        String parentUri = textOrNull(reply.path("parent").path("uri"));
        String rootUri = textOrNull(reply.path("root").path("uri"));
        if (parentUri == null || rootUri == null) {
            return Optional.empty();
        }
        return Optional.of(ThreadEdgeRecord.builder()
                .postUri(postUri)
                .authorDid(authorDid)
                .parentUri(parentUri)
                .rootUri(rootUri)
                .depth(parentUri.equals(rootUri) ? 1 : 2)
                .createdAt(createdAt)
                .build());
    }
    
    public List<MediaAttachmentRecord> media(String postUri, String authorDid, JsonNode embed, Instant createdAt) {
        List<MediaAttachmentRecord> media = new ArrayList<>();
        collectMedia(postUri, authorDid, embed, createdAt, media);
        return media;
    }
    
    public ActivitySampleRecord activitySample(String authorDid, String postUri, Instant createdAt) {
        ZonedDateTime at = createdAt.atZone(ZoneOffset.UTC);
        return ActivitySampleRecord.builder()
                .authorDid(authorDid)
                .hourOfDay(at.getHour())
                .dayOfWeek(at.getDayOfWeek().getValue() % 7)
                .lastPostUri(postUri)
                .lastActiveAt(createdAt)
                .build();
    }
    
    private void collectMedia(String postUri, String authorDid, JsonNode embed, Instant createdAt,
                              List<MediaAttachmentRecord> media) {
        if (embed == null || embed.isMissingNode() || embed.isNull()) {
            return;
        }
        String type = embed.path("$type").asText("");
        switch (type) {
            case EMBED_IMAGES:
                for (JsonNode image : embed.path("images")) {
                    JsonNode blob = image.path("image");
                    JsonNode aspect = image.path("aspectRatio");
                    media.add(attachment(postUri, authorDid, media.size(), "image", createdAt)
                            .mediaCid(blobCid(blob))
                            .altText(textOrNull(image.path("alt")))
                            .mimeType(textOrNull(blob.path("mimeType")))
                            .width(aspect.has("width") ? aspect.get("width").asInt() : null)
                            .height(aspect.has("height") ? aspect.get("height").asInt() : null)
                            .build());
                }
                break;
            case EMBED_VIDEO:
                JsonNode video = embed.path("video");
                media.add(attachment(postUri, authorDid, media.size(), "video", createdAt)
                        .mediaCid(blobCid(video))
                        .altText(textOrNull(embed.path("alt")))
                        .mimeType(textOrNull(video.path("mimeType")))
                        .build());
                break;
            case EMBED_EXTERNAL:
                JsonNode external = embed.path("external");
                media.add(attachment(postUri, authorDid, media.size(), "external", createdAt)
                        .mediaUrl(textOrNull(external.path("uri")))
                        .altText(textOrNull(external.path("title")))
                        .build());
                break;
            case EMBED_RECORD:
                JsonNode quoted = embed.path("record");
                media.add(attachment(postUri, authorDid, media.size(), "record", createdAt)
                        .mediaUrl(textOrNull(quoted.path("uri")))
                        .mediaCid(textOrNull(quoted.path("cid")))
                        .build());
                break;
            case EMBED_RECORD_WITH_MEDIA:
                collectMedia(postUri, authorDid, embed.path("media"), createdAt, media);
                collectMedia(postUri, authorDid, embed.path("record"), createdAt, media);
                break;
            default:
                break;
        }
    }
    
    private MediaAttachmentRecord.MediaAttachmentRecordBuilder attachment(String postUri, String authorDid,
                                                                         int index, String type, Instant createdAt) {
        return MediaAttachmentRecord.builder()
                .postUri(postUri)
                .authorDid(authorDid)
                .mediaIndex(index)
                .mediaType(type)
                .createdAt(createdAt);
    }
    
    static String blobCid(JsonNode blob) {
        String link = textOrNull(blob.path("ref").path("$link"));
        return link != null ? link : textOrNull(blob.path("cid"));
    }
    
    static String textOrNull(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
    }
    
    private static Optional<String> domainOf(String url) {
        try {
            String host = new URI(url).getHost();
            if (host == null) {
                return Optional.empty();
            }
            return Optional.of(host.startsWith("www.") ? host.substring(4) : host);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }
}

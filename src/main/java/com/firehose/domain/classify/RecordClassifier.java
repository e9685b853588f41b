package com.firehose.domain.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.firehose.domain.exception.MalformedEventException;
import com.firehose.domain.model.Classification;
import com.firehose.domain.model.IngestRecord;
import com.firehose.domain.model.RawEvent;
import com.firehose.domain.model.record.BlockRecord;
import com.firehose.domain.model.record.FeedGeneratorRecord;
import com.firehose.domain.model.record.FollowRecord;
import com.firehose.domain.model.record.LabelerServiceRecord;
import com.firehose.domain.model.record.LikeRecord;
import com.firehose.domain.model.record.ListItemRecord;
import com.firehose.domain.model.record.ListRecord;
import com.firehose.domain.model.record.PostRecord;
import com.firehose.domain.model.record.RepostRecord;
import com.firehose.domain.model.record.StarterPackRecord;
import com.firehose.domain.model.record.ThreadGateRecord;
import com.firehose.domain.model.record.UserRecord;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import static com.firehose.domain.classify.PostContentExtractor.blobCid;
import static com.firehose.domain.classify.PostContentExtractor.textOrNull;

/**
 * Routes stream events to typed records.
 * 
 * One handler is registered per collection NSID. A handler turns the event into
 * the primary record plus any derived records (user stubs for every actor,
 * post content artifacts). Each record belongs to exactly one queue by its kind.
 * 
 * Outcomes:
 * - Known collection, create/update commit: records to enqueue
 * - Unknown collection, identity/account events, deletes: ignored, not an error
 * - Missing required fields: {@link MalformedEventException}
 */
@Slf4j
@Component
public class RecordClassifier {
    
    public static final String POST = "app.bsky.feed.post";
    public static final String LIKE = "app.bsky.feed.like";
    public static final String REPOST = "app.bsky.feed.repost";
    public static final String FOLLOW = "app.bsky.graph.follow";
    public static final String BLOCK = "app.bsky.graph.block";
    public static final String LIST = "app.bsky.graph.list";
    public static final String LIST_ITEM = "app.bsky.graph.listitem";
    public static final String PROFILE = "app.bsky.actor.profile";
    public static final String FEED_GENERATOR = "app.bsky.feed.generator";
    public static final String THREAD_GATE = "app.bsky.feed.threadgate";
    public static final String STARTER_PACK = "app.bsky.graph.starterpack";
    public static final String LABELER_SERVICE = "app.bsky.labeler.service";
    
    private static final Set<String> STORED_OPERATIONS = Set.of("create", "update");
    
    private final PostContentExtractor contentExtractor;
    private final Clock clock;
    private final Map<String, CollectionHandler> handlers = new HashMap<>();
    
    public RecordClassifier(PostContentExtractor contentExtractor, Clock clock) {
        this.contentExtractor = contentExtractor;
        this.clock = clock;
        
        register(POST, this::mapPost);
        register(LIKE, this::mapLike);
        register(REPOST, this::mapRepost);
        register(FOLLOW, this::mapFollow);
        register(BLOCK, this::mapBlock);
        register(LIST, this::mapList);
        register(LIST_ITEM, this::mapListItem);
        register(PROFILE, this::mapProfile);
        register(FEED_GENERATOR, this::mapFeedGenerator);
        register(THREAD_GATE, this::mapThreadGate);
        register(STARTER_PACK, this::mapStarterPack);
        register(LABELER_SERVICE, this::mapLabelerService);
    }
    
    @FunctionalInterface
    interface CollectionHandler {
        List<IngestRecord> map(CommitContext context);
    }
    
    private void register(String collection, CollectionHandler handler) {
        handlers.put(collection, handler);
    }
    
    public Set<String> supportedCollections() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
    
    /**
     * Classify one event. Never performs I/O.
     *
     * @throws MalformedEventException if a handled event lacks a required field
     */
    public Classification classify(RawEvent event) {
        if (event == null) {
            throw new MalformedEventException("Event is null");
        }
        if (!RawEvent.KIND_COMMIT.equals(event.getKind())) {
            return Classification.ignored("kind " + event.getKind());
        }
        RawEvent.Commit commit = event.getCommit();
        if (commit == null) {
            throw new MalformedEventException("Commit event without commit body");
        }
        if (commit.getOperation() == null) {
            throw new MalformedEventException("Missing required field: commit.operation");
        }
        if (!STORED_OPERATIONS.contains(commit.getOperation())) {
            return Classification.ignored("operation " + commit.getOperation());
        }
        CollectionHandler handler = handlers.get(commit.getCollection());
        if (handler == null) {
            return Classification.ignored("collection " + commit.getCollection());
        }
        if (event.getDid() == null || event.getDid().isBlank()) {
            throw new MalformedEventException("Missing required field: did");
        }
        if (commit.getRkey() == null || commit.getRkey().isBlank()) {
            throw new MalformedEventException("Missing required field: commit.rkey");
        }
        if (commit.getRecord() == null || !commit.getRecord().isObject()) {
            throw new MalformedEventException("Missing required field: commit.record");
        }
        
        Instant indexedAt = event.getTimeUs() != null
                ? Instant.EPOCH.plusNanos(event.getTimeUs() * 1_000L)
                : clock.instant();
        CommitContext context = new CommitContext(
                event.getDid(),
                "at://" + event.getDid() + "/" + commit.getCollection() + "/" + commit.getRkey(),
                commit.getCid(),
                commit.getRecord(),
                parseTimestamp(commit.getRecord().path("createdAt"), indexedAt),
                indexedAt
        );
        return Classification.of(handler.map(context));
    }
    
    private List<IngestRecord> mapPost(CommitContext ctx) {
        JsonNode record = ctx.getRecord();
        String text = textOrNull(record.path("text"));
        JsonNode embed = record.path("embed");
        
        List<IngestRecord> records = new ArrayList<>();
        records.add(PostRecord.builder()
                .uri(ctx.getUri())
                .cid(ctx.getCid())
                .authorDid(ctx.getDid())
                .text(text)
                .replyParentUri(textOrNull(record.path("reply").path("parent").path("uri")))
                .replyRootUri(textOrNull(record.path("reply").path("root").path("uri")))
                .embedType(textOrNull(embed.path("$type")))
                .embedJson(embed.isMissingNode() ? null : embed.toString())
                .langs(joinArray(record.path("langs")))
                .createdAt(ctx.getCreatedAt())
                .indexedAt(ctx.getIndexedAt())
                .build());
        records.add(UserRecord.stub(ctx.getDid(), ctx.getIndexedAt()));
        
        contentExtractor.threadEdge(ctx.getUri(), ctx.getDid(), record, ctx.getCreatedAt()).ifPresent(records::add);
        records.addAll(contentExtractor.mentions(ctx.getUri(), ctx.getDid(), text, ctx.getCreatedAt()));
        records.addAll(contentExtractor.hashtags(ctx.getUri(), ctx.getDid(), text, ctx.getCreatedAt()));
        records.addAll(contentExtractor.links(ctx.getUri(), ctx.getDid(), text, ctx.getCreatedAt()));
        records.addAll(contentExtractor.media(ctx.getUri(), ctx.getDid(), embed, ctx.getCreatedAt()));
        records.add(contentExtractor.activitySample(ctx.getDid(), ctx.getUri(), ctx.getCreatedAt()));
        return records;
    }
    
    private List<IngestRecord> mapLike(CommitContext ctx) {
        JsonNode subject = ctx.getRecord().path("subject");
        return List.of(
                LikeRecord.builder()
                        .uri(ctx.getUri())
                        .authorDid(ctx.getDid())
                        .subjectUri(textOrNull(subject.path("uri")))
                        .subjectCid(textOrNull(subject.path("cid")))
                        .createdAt(ctx.getCreatedAt())
                        .indexedAt(ctx.getIndexedAt())
                        .build(),
                UserRecord.stub(ctx.getDid(), ctx.getIndexedAt()));
    }
    
    private List<IngestRecord> mapRepost(CommitContext ctx) {
        JsonNode subject = ctx.getRecord().path("subject");
        return List.of(
                RepostRecord.builder()
                        .uri(ctx.getUri())
                        .authorDid(ctx.getDid())
                        .subjectUri(textOrNull(subject.path("uri")))
                        .subjectCid(textOrNull(subject.path("cid")))
                        .createdAt(ctx.getCreatedAt())
                        .indexedAt(ctx.getIndexedAt())
                        .build(),
                UserRecord.stub(ctx.getDid(), ctx.getIndexedAt()));
    }
    
    private List<IngestRecord> mapFollow(CommitContext ctx) {
        FollowRecord follow = FollowRecord.builder()
                .uri(ctx.getUri())
                .followerDid(ctx.getDid())
                .followingDid(textOrNull(ctx.getRecord().path("subject")))
                .createdAt(ctx.getCreatedAt())
                .indexedAt(ctx.getIndexedAt())
                .build();
        return List.of(
                follow,
                UserRecord.stub(ctx.getDid(), ctx.getIndexedAt()),
                UserRecord.stub(follow.getFollowingDid(), ctx.getIndexedAt()));
    }
    
    private List<IngestRecord> mapBlock(CommitContext ctx) {
        BlockRecord block = BlockRecord.builder()
                .uri(ctx.getUri())
                .blockerDid(ctx.getDid())
                .blockedDid(textOrNull(ctx.getRecord().path("subject")))
                .createdAt(ctx.getCreatedAt())
                .indexedAt(ctx.getIndexedAt())
                .build();
        return List.of(
                block,
                UserRecord.stub(ctx.getDid(), ctx.getIndexedAt()),
                UserRecord.stub(block.getBlockedDid(), ctx.getIndexedAt()));
    }
    
    private List<IngestRecord> mapList(CommitContext ctx) {
        JsonNode record = ctx.getRecord();
        return List.of(
                ListRecord.builder()
                        .uri(ctx.getUri())
                        .ownerDid(ctx.getDid())
                        .name(textOrNull(record.path("name")))
                        .purpose(textOrNull(record.path("purpose")))
                        .description(textOrNull(record.path("description")))
                        .avatarCid(blobCid(record.path("avatar")))
                        .createdAt(ctx.getCreatedAt())
                        .indexedAt(ctx.getIndexedAt())
                        .build(),
                UserRecord.stub(ctx.getDid(), ctx.getIndexedAt()));
    }
    
    private List<IngestRecord> mapListItem(CommitContext ctx) {
        ListItemRecord item = ListItemRecord.builder()
                .uri(ctx.getUri())
                .ownerDid(ctx.getDid())
                .listUri(textOrNull(ctx.getRecord().path("list")))
                .subjectDid(textOrNull(ctx.getRecord().path("subject")))
                .createdAt(ctx.getCreatedAt())
                .indexedAt(ctx.getIndexedAt())
                .build();
        return List.of(
                item,
                UserRecord.stub(ctx.getDid(), ctx.getIndexedAt()),
                UserRecord.stub(item.getSubjectDid(), ctx.getIndexedAt()));
    }
    
    private List<IngestRecord> mapProfile(CommitContext ctx) {
        JsonNode record = ctx.getRecord();
        return List.of(UserRecord.builder()
                .did(ctx.getDid())
                .displayName(textOrNull(record.path("displayName")))
                .description(textOrNull(record.path("description")))
                .avatarCid(blobCid(record.path("avatar")))
                .bannerCid(blobCid(record.path("banner")))
                .updatedAt(ctx.getIndexedAt())
                .build());
    }
    
    private List<IngestRecord> mapFeedGenerator(CommitContext ctx) {
        JsonNode record = ctx.getRecord();
        JsonNode accepts = record.path("acceptsInteractions");
        return List.of(FeedGeneratorRecord.builder()
                .uri(ctx.getUri())
                .ownerDid(ctx.getDid())
                .serviceDid(textOrNull(record.path("did")))
                .displayName(textOrNull(record.path("displayName")))
                .description(textOrNull(record.path("description")))
                .avatarCid(blobCid(record.path("avatar")))
                .acceptsInteractions(accepts.isBoolean() ? accepts.booleanValue() : null)
                .labelsJson(jsonOrNull(record.path("labels")))
                .createdAt(ctx.getCreatedAt())
                .indexedAt(ctx.getIndexedAt())
                .build());
    }
    
    private List<IngestRecord> mapThreadGate(CommitContext ctx) {
        JsonNode record = ctx.getRecord();
        return List.of(ThreadGateRecord.builder()
                .postUri(textOrNull(record.path("post")))
                .uri(ctx.getUri())
                .ownerDid(ctx.getDid())
                .allowJson(jsonOrNull(record.path("allow")))
                .createdAt(ctx.getCreatedAt())
                .indexedAt(ctx.getIndexedAt())
                .build());
    }
    
    private List<IngestRecord> mapStarterPack(CommitContext ctx) {
        JsonNode record = ctx.getRecord();
        return List.of(StarterPackRecord.builder()
                .uri(ctx.getUri())
                .ownerDid(ctx.getDid())
                .name(textOrNull(record.path("name")))
                .description(textOrNull(record.path("description")))
                .listUri(textOrNull(record.path("list")))
                .feedsJson(jsonOrNull(record.path("feeds")))
                .createdAt(ctx.getCreatedAt())
                .indexedAt(ctx.getIndexedAt())
                .build());
    }
    
    private List<IngestRecord> mapLabelerService(CommitContext ctx) {
        JsonNode record = ctx.getRecord();
        return List.of(LabelerServiceRecord.builder()
                .uri(ctx.getUri())
                .ownerDid(ctx.getDid())
                .policiesJson(jsonOrNull(record.path("policies")))
                .labelsJson(jsonOrNull(record.path("labels")))
                .createdAt(ctx.getCreatedAt())
                .indexedAt(ctx.getIndexedAt())
                .build());
    }
    
    private Instant parseTimestamp(JsonNode node, Instant fallback) {
        String text = textOrNull(node);
        if (text == null) {
            return fallback;
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable createdAt '{}', using indexed time", text);
            return fallback;
        }
    }
    
    private static String jsonOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.toString();
    }
    
    private static String joinArray(JsonNode node) {
        if (!node.isArray() || node.isEmpty()) {
            return null;
        }
        return StreamSupport.stream(node.spliterator(), false)
                .map(JsonNode::asText)
                .collect(Collectors.joining(","));
    }
    
    @Value
    static class CommitContext {
        String did;
        String uri;
        String cid;
        JsonNode record;
        Instant createdAt;
        Instant indexedAt;
    }
}

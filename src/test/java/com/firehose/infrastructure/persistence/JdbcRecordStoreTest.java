package com.firehose.infrastructure.persistence;

import com.firehose.domain.exception.PermanentStoreException;
import com.firehose.domain.exception.RateLimitedException;
import com.firehose.domain.exception.StoreException;
import com.firehose.domain.exception.TransientStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.UncategorizedDataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcRecordStoreTest {

    @Mock
    private NamedParameterJdbcTemplate jdbcTemplate;

    @InjectMocks
    private JdbcRecordStore recordStore;

    @Test
    void buildUpsertSql_coalescesNonKeyColumns() {
        String sql = JdbcRecordStore.buildUpsertSql("bluesky_users",
                List.of("did", "handle", "display_name"), List.of("did"));

        assertEquals("INSERT INTO bluesky_users (did, handle, display_name) VALUES (:did, :handle, :display_name)"
                + " ON CONFLICT (did) DO UPDATE SET"
                + " handle = COALESCE(EXCLUDED.handle, bluesky_users.handle),"
                + " display_name = COALESCE(EXCLUDED.display_name, bluesky_users.display_name)", sql);
    }

    @Test
    void buildUpsertSql_onlyKeyColumnsDoNothing() {
        String sql = JdbcRecordStore.buildUpsertSql("bluesky_follows",
                List.of("follower_did", "following_did"), List.of("follower_did", "following_did"));

        assertTrue(sql.endsWith("ON CONFLICT (follower_did, following_did) DO NOTHING"));
    }

    @Test
    void buildUpsertSql_rejectsUnsafeIdentifiers() {
        assertThrows(IllegalArgumentException.class, () -> JdbcRecordStore.buildUpsertSql(
                "bluesky_posts; drop table x", List.of("uri"), List.of("uri")));
    }

    @Test
    void upsert_sendsOneBatchWithTimestampsAsOffsetDateTime() {
        Instant createdAt = Instant.parse("2024-09-09T19:46:02Z");
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("uri", "at://a");
        first.put("created_at", createdAt);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("uri", "at://b");
        second.put("created_at", null);

        recordStore.upsert("bluesky_likes", List.of(first, second), List.of("uri"));

        ArgumentCaptor<SqlParameterSource[]> batch = ArgumentCaptor.forClass(SqlParameterSource[].class);
        verify(jdbcTemplate).batchUpdate(startsWith("INSERT INTO bluesky_likes (uri, created_at)"), batch.capture());
        assertEquals(2, batch.getValue().length);
        assertEquals(OffsetDateTime.of(2024, 9, 9, 19, 46, 2, 0, ZoneOffset.UTC),
                batch.getValue()[0].getValue("created_at"));
        assertNull(batch.getValue()[1].getValue("created_at"));
    }

    @Test
    void upsert_emptyBatchSkipsDatabase() {
        recordStore.upsert("bluesky_likes", List.of(), List.of("uri"));

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void upsert_translatesDataAccessException() {
        when(jdbcTemplate.batchUpdate(anyString(), any(SqlParameterSource[].class)))
                .thenThrow(new DataIntegrityViolationException("value too long"));

        PermanentStoreException e = assertThrows(PermanentStoreException.class,
                () -> recordStore.upsert("bluesky_posts", List.of(Map.of("uri", "at://p")), List.of("uri")));
        assertEquals("bluesky_posts", e.getDestination());
    }

    @Test
    void translate_connectionLimitIsRateLimited() {
        SQLException tooMany = new SQLException("sorry, too many clients already", "53300");

        StoreException e = JdbcRecordStore.translate("bluesky_posts",
                new UncategorizedSQLException("batch", "INSERT", tooMany));

        assertInstanceOf(RateLimitedException.class, e);
        assertTrue(((RateLimitedException) e).getResetAt().isEmpty());
    }

    @Test
    void translate_transientAndResourceFailuresAreRetryable() {
        assertInstanceOf(TransientStoreException.class, JdbcRecordStore.translate("t",
                new CannotAcquireLockException("lock timeout")));
        assertInstanceOf(TransientStoreException.class, JdbcRecordStore.translate("t",
                new DataAccessResourceFailureException("connection refused")));
    }

    @Test
    void translate_badSqlIsPermanent() {
        StoreException e = JdbcRecordStore.translate("t",
                new BadSqlGrammarException("batch", "INSERT", new SQLException("column missing", "42703")));

        assertInstanceOf(PermanentStoreException.class, e);
    }

    @Test
    void translate_unknownFailureIsUnclassified() {
        StoreException e = JdbcRecordStore.translate("t", new UncategorizedDataAccessException("odd", null) { });

        assertEquals(StoreException.class, e.getClass());
    }
}

package com.firehose.infrastructure.persistence;

import com.firehose.domain.exception.PermanentStoreException;
import com.firehose.domain.exception.RateLimitedException;
import com.firehose.domain.exception.StoreException;
import com.firehose.domain.exception.TransientStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * PostgreSQL implementation of {@link RecordStore}.
 * 
 * Each call is one JDBC batch of
 * {@code INSERT ... ON CONFLICT (keys) DO UPDATE SET col = COALESCE(EXCLUDED.col, table.col)}
 * in a single transaction. COALESCE keeps stored values when the incoming row
 * has no value for a column, which keeps repeated upserts idempotent.
 * 
 * Spring's {@link DataAccessException} hierarchy is mapped onto the pipeline's
 * store exceptions so the retry layer can tell transient from permanent failures.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcRecordStore implements RecordStore {
    
    static final String SQLSTATE_TOO_MANY_CONNECTIONS = "53300";
    
    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");
    
    private final NamedParameterJdbcTemplate jdbcTemplate;
    
    @Override
    @Transactional
    public void upsert(String table, List<Map<String, Object>> rows, List<String> conflictColumns) {
        if (rows.isEmpty()) {
            return;
        }
        List<String> columns = columnsOf(rows);
        String sql = buildUpsertSql(table, columns, conflictColumns);
        SqlParameterSource[] batch = rows.stream()
                .map(row -> toParameters(row, columns))
                .toArray(SqlParameterSource[]::new);
        
        try {
            jdbcTemplate.batchUpdate(sql, batch);
            log.debug("Upserted {} rows into {}", rows.size(), table);
        } catch (DataAccessException e) {
            throw translate(table, e);
        }
    }
    
    static String buildUpsertSql(String table, List<String> columns, List<String> conflictColumns) {
        requireIdentifier(table);
        columns.forEach(JdbcRecordStore::requireIdentifier);
        conflictColumns.forEach(JdbcRecordStore::requireIdentifier);
        
        String columnList = String.join(", ", columns);
        String valueList = columns.stream().map(c -> ":" + c).collect(Collectors.joining(", "));
        List<String> updates = new ArrayList<>();
        for (String column : columns) {
            if (!conflictColumns.contains(column)) {
                updates.add(column + " = COALESCE(EXCLUDED." + column + ", " + table + "." + column + ")");
            }
        }
        
        StringBuilder sql = new StringBuilder()
                .append("INSERT INTO ").append(table)
                .append(" (").append(columnList).append(") VALUES (").append(valueList).append(")")
                .append(" ON CONFLICT (").append(String.join(", ", conflictColumns)).append(")");
        if (updates.isEmpty()) {
            sql.append(" DO NOTHING");
        } else {
            sql.append(" DO UPDATE SET ").append(String.join(", ", updates));
        }
        return sql.toString();
    }
    
    static StoreException translate(String table, DataAccessException e) {
        Throwable cause = e.getMostSpecificCause();
        if (cause instanceof SQLException
                && SQLSTATE_TOO_MANY_CONNECTIONS.equals(((SQLException) cause).getSQLState())) {
            return new RateLimitedException(table, "Connection limit reached: " + cause.getMessage(), null, e);
        }
        if (e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException) {
            return new TransientStoreException(table, e.getMessage(), e);
        }
        if (e instanceof DataIntegrityViolationException
                || e instanceof InvalidDataAccessResourceUsageException
                || e instanceof InvalidDataAccessApiUsageException) {
            return new PermanentStoreException(table, e.getMessage(), e);
        }
        return new StoreException(table, e.getMessage(), e);
    }
    
    private static List<String> columnsOf(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        return new ArrayList<>(columns);
    }
    
    private static SqlParameterSource toParameters(Map<String, Object> row, List<String> columns) {
        MapSqlParameterSource parameters = new MapSqlParameterSource();
        for (String column : columns) {
            Object value = row.get(column);
            if (value instanceof Instant) {
                value = ((Instant) value).atOffset(ZoneOffset.UTC);
            }
            parameters.addValue(column, value);
        }
        return parameters;
    }
    
    private static void requireIdentifier(String name) {
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Illegal SQL identifier: " + name);
        }
    }
}

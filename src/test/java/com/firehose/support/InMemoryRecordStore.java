package com.firehose.support;

import com.firehose.infrastructure.persistence.RecordStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Upsert store double with the same conflict semantics as the JDBC store:
 * rows collide on the conflict columns and null values never overwrite stored ones.
 */
public class InMemoryRecordStore implements RecordStore {
    
    private final Map<String, Map<String, Map<String, Object>>> tables = new ConcurrentHashMap<>();
    private final List<Call> calls = new ArrayList<>();
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private volatile Supplier<RuntimeException> failure;
    
    public synchronized void failNext(int times, Supplier<RuntimeException> error) {
        failuresLeft.set(times);
        failure = error;
    }
    
    @Override
    public synchronized void upsert(String table, List<Map<String, Object>> rows, List<String> conflictColumns) {
        calls.add(new Call(table, rows.size()));
        if (failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw failure.get();
        }
        Map<String, Map<String, Object>> tableRows = tables.computeIfAbsent(table, t -> new LinkedHashMap<>());
        for (Map<String, Object> row : rows) {
            String key = conflictColumns.stream()
                    .map(column -> String.valueOf(row.get(column)))
                    .collect(Collectors.joining("|"));
            Map<String, Object> stored = tableRows.computeIfAbsent(key, k -> new LinkedHashMap<>());
            row.forEach((column, value) -> {
                if (value != null || !stored.containsKey(column)) {
                    stored.put(column, value);
                }
            });
        }
    }
    
    public synchronized Map<String, Map<String, Object>> table(String table) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        tables.getOrDefault(table, Map.of()).forEach((key, row) -> copy.put(key, new LinkedHashMap<>(row)));
        return copy;
    }
    
    public synchronized List<Integer> batchSizes(String table) {
        return calls.stream()
                .filter(call -> call.table.equals(table))
                .map(call -> call.rows)
                .collect(Collectors.toList());
    }
    
    public synchronized int callCount(String table) {
        return batchSizes(table).size();
    }
    
    private static final class Call {
        private final String table;
        private final int rows;
        
        private Call(String table, int rows) {
            this.table = table;
            this.rows = rows;
        }
    }
}

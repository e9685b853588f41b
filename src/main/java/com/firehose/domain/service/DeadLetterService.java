package com.firehose.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firehose.domain.model.FailureKind;
import com.firehose.infrastructure.persistence.entity.DeadLetterEntity;
import com.firehose.infrastructure.persistence.repository.DeadLetterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Best-effort sink for rows that exhausted their retry budget.
 * 
 * A failure to persist dead letters is logged and the rows are discarded;
 * dead-letter writes are never retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeadLetterService {
    
    private final DeadLetterRepository deadLetterRepository;
    private final ObjectMapper objectMapper;
    private final IngestionMetrics metrics;
    private final Clock clock;
    
    /**
     * Persist one dead letter per row.
     *
     * @return number of dead letters persisted (0 when the write failed)
     */
    public int record(String destination, List<Map<String, Object>> rows,
                      FailureKind failureKind, String errorMessage, int attempts) {
        if (rows.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        List<DeadLetterEntity> entries = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            entries.add(DeadLetterEntity.builder()
                    .destination(destination)
                    .payload(serialize(destination, row))
                    .errorMessage(errorMessage)
                    .failureKind(failureKind != null ? failureKind.name() : null)
                    .attempts(attempts)
                    .createdAt(now)
                    .build());
        }
        metrics.recordDeadLetters(destination, entries.size());
        
        try {
            deadLetterRepository.saveAll(entries);
            log.warn("Dead-lettered {} rows for {} after {} attempt(s): {}",
                    entries.size(), destination, attempts, errorMessage);
            return entries.size();
        } catch (Exception e) {
            log.error("Failed to write {} dead letters for {}, discarding them: {}",
                    entries.size(), destination, e.getMessage(), e);
            return 0;
        }
    }
    
    private String serialize(String destination, Map<String, Object> row) {
        try {
            return objectMapper.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            log.warn("Dead letter payload for {} is not serializable, storing string form: {}",
                    destination, e.getMessage());
            return String.valueOf(row);
        }
    }
}

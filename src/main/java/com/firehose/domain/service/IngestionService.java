package com.firehose.domain.service;

import com.firehose.domain.classify.RecordClassifier;
import com.firehose.domain.exception.MalformedEventException;
import com.firehose.domain.model.Classification;
import com.firehose.domain.model.IngestRecord;
import com.firehose.domain.model.RawEvent;
import com.firehose.domain.queue.QueueManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for stream events: classify, enqueue, trigger size-based flushes.
 * 
 * Runs on the producer's thread and never blocks on the store; flushes it
 * triggers run on the flush executor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {
    
    private final RecordClassifier recordClassifier;
    private final QueueManager queueManager;
    private final BatchFlusher batchFlusher;
    private final IngestionMetrics metrics;
    
    /**
     * @return number of records accepted into queues
     */
    public int ingest(RawEvent event) {
        long startNanos = System.nanoTime();
        
        Classification classification;
        try {
            classification = recordClassifier.classify(event);
        } catch (MalformedEventException e) {
            metrics.recordReceived(1);
            metrics.recordDropped(1, "malformed");
            log.debug("Dropping malformed event from {}: {}", event != null ? event.getDid() : null, e.getMessage());
            return 0;
        } catch (RuntimeException e) {
            metrics.recordReceived(1);
            metrics.recordDropped(1, "classification_error");
            log.error("Failed to classify event from {}: {}", event != null ? event.getDid() : null, e.getMessage(), e);
            return 0;
        }
        
        if (classification.isIgnored()) {
            log.trace("Ignoring event: {}", classification.getIgnoredReason());
            return 0;
        }
        
        metrics.recordReceived(classification.getRecords().size());
        int accepted = 0;
        for (IngestRecord record : classification.getRecords()) {
            QueueManager.EnqueueResult result = queueManager.enqueue(record);
            if (result.isAccepted()) {
                accepted++;
                batchFlusher.onEnqueued(record.getKind(), result.getQueueSize());
            }
        }
        metrics.recordProcessed(accepted, System.nanoTime() - startNanos);
        return accepted;
    }
}

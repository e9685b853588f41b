package com.firehose.infrastructure.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firehose.domain.model.RawEvent;
import com.firehose.domain.service.IngestionMetrics;
import com.firehose.domain.service.IngestionService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for Jetstream events.
 * 
 * Each record carries one stream event as a JSON string. The event is handed to
 * the ingestion service and the offset is acknowledged right after hand-off.
 * 
 * Unparseable payloads and events the pipeline fails on are counted as dropped
 * and acknowledged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JetstreamEventConsumer {
    
    private final IngestionService ingestionService;
    private final IngestionMetrics ingestionMetrics;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    
    @KafkaListener(
            topics = "${app.kafka.topics.jetstream-events}",
            groupId = "${spring.kafka.consumer.group-id}",
            autoStartup = "${app.kafka.consumer.auto-startup:true}"
    )
    public void consumeJetstreamEvent(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        if (record.value() == null) {
            log.debug("Skipping empty record at partition={}, offset={}", record.partition(), record.offset());
            acknowledgment.acknowledge();
            return;
        }
        
        try {
            RawEvent event = objectMapper.readValue(record.value(), RawEvent.class);
            
            log.trace("Consumed event: partition={}, offset={}, did={}",
                    record.partition(), record.offset(), event.getDid());
            
            ingestionService.ingest(event);
            
            Counter.builder("kafka.jetstream.events.consumed")
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();
            
        } catch (JsonProcessingException e) {
            log.warn("Unparseable event at partition={}, offset={}: {}",
                    record.partition(), record.offset(), e.getOriginalMessage());
            
            ingestionMetrics.recordReceived(1);
            ingestionMetrics.recordDropped(1, "unparseable");
            
            Counter.builder("kafka.jetstream.events.consumed")
                    .tag("result", "unparseable")
                    .register(meterRegistry)
                    .increment();
            
        } catch (RuntimeException e) {
            log.error("Failed to ingest event at partition={}, offset={}: {}",
                    record.partition(), record.offset(), e.getMessage(), e);
            
            ingestionMetrics.recordReceived(1);
            ingestionMetrics.recordDropped(1, "ingest_error");
            
            Counter.builder("kafka.jetstream.events.consumed")
                    .tag("result", "failed")
                    .register(meterRegistry)
                    .increment();
        }
        
        acknowledgment.acknowledge();
    }
}

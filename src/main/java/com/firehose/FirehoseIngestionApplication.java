package com.firehose;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Social Network Firehose Ingestion Service
 * 
 * Ingests a real-time stream of social activity events and persists them
 * into PostgreSQL through batched, idempotent upserts.
 * 
 * Architecture:
 * - Kafka-based event intake (one callback per stream event)
 * - Typed classification into per-kind, deduplicating in-memory queues
 * - Size- and time-triggered batch flushes with retry and exponential backoff
 * - Circuit breaker per destination table
 * - Memory and queue-size backpressure
 * - Dead-letter table for rows that exhaust their retries
 * 
 * Delivery:
 * - At-least-once; duplicates are absorbed by upsert on natural keys
 * - Drops under backpressure are counted, not replayed
 */
@SpringBootApplication
@EnableTransactionManagement
@ConfigurationPropertiesScan
public class FirehoseIngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(FirehoseIngestionApplication.class, args);
    }
}

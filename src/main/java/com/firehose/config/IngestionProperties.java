package com.firehose.config;

import com.firehose.domain.model.EntityKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunables of the ingestion pipeline, bound from the {@code ingest.*} namespace.
 * 
 * Every key can be overridden from the environment through relaxed binding
 * (e.g. {@code INGEST_QUEUE_CAPACITY}); application.yml also maps the legacy
 * variable names such as {@code MAX_QUEUE_SIZE}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "ingest")
public class IngestionProperties {
    
    @Valid
    private Queue queue = new Queue();
    
    @Valid
    private Backpressure backpressure = new Backpressure();
    
    @Valid
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    
    @Valid
    private Retry retry = new Retry();
    
    @Valid
    private Health health = new Health();
    
    @Valid
    private Shutdown shutdown = new Shutdown();
    
    @Getter
    @Setter
    public static class Queue {
        
        @Min(1)
        private int defaultBatchSize = 100;
        
        private Map<EntityKind, Integer> batchSizes = new EnumMap<>(EntityKind.class);
        
        @NotNull
        private Duration flushInterval = Duration.ofSeconds(10);
        
        @Min(1)
        private int capacity = 50_000;
        
        @Min(1)
        private int flushThreads = 4;
        
        public int batchSizeFor(EntityKind kind) {
            return batchSizes.getOrDefault(kind, defaultBatchSize);
        }
    }
    
    @Getter
    @Setter
    public static class Backpressure {
        
        @Min(1)
        private long memorySoftLimitMb = 1200;
        
        @Min(1)
        private long memoryHardLimitMb = 1500;
        
        @NotNull
        private Duration checkInterval = Duration.ofSeconds(5);
        
        @NotNull
        private Duration pauseCooldown = Duration.ofSeconds(3);
        
        @NotNull
        private Duration hardPauseCooldown = Duration.ofSeconds(6);
        
        private boolean gcHintEnabled = true;
    }
    
    @Getter
    @Setter
    public static class CircuitBreaker {
        
        @Min(1)
        private int failureThreshold = 5;
        
        @NotNull
        private Duration recoveryTimeout = Duration.ofSeconds(20);
        
        @NotNull
        private Duration halfOpenTimeout = Duration.ofSeconds(5);
    }
    
    @Getter
    @Setter
    public static class Retry {
        
        @Min(1)
        private int maxAttempts = 3;
        
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);
        
        @DecimalMin("1.0")
        private double multiplier = 2.0;
        
        private boolean failFastOnPermanent = true;
    }
    
    @Getter
    @Setter
    public static class Health {
        
        private long maxAvgProcessingMs = 100;
        
        private long maxAvgFlushMs = 5000;
        
        @NotNull
        private Duration backpressureWindow = Duration.ofSeconds(60);
        
        @NotNull
        private Duration reportInterval = Duration.ofSeconds(60);
        
        @Min(1)
        private int processingSamples = 1000;
        
        @Min(1)
        private int flushSamples = 100;
    }
    
    @Getter
    @Setter
    public static class Shutdown {
        
        @NotNull
        private Duration gracePeriod = Duration.ofSeconds(30);
    }
}

package com.firehose.api;

import com.firehose.domain.model.CircuitBreakerStats;
import com.firehose.domain.model.FlushResult;
import com.firehose.domain.model.IngestionHealthReport;
import com.firehose.domain.model.RawEvent;
import com.firehose.domain.resilience.StoreCircuitBreakers;
import com.firehose.domain.service.BatchFlusher;
import com.firehose.domain.service.IngestionService;
import com.firehose.domain.service.MetricsReporter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for the ingestion pipeline.
 * 
 * Accepts events over HTTP (in addition to Kafka intake) and exposes the
 * pipeline's health, breaker state and a manual flush.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/ingestion")
@RequiredArgsConstructor
public class IngestionController {
    
    private final IngestionService ingestionService;
    private final BatchFlusher batchFlusher;
    private final MetricsReporter metricsReporter;
    private final StoreCircuitBreakers circuitBreakers;
    
    /**
     * Submit one stream event.
     * 
     * POST /api/v1/ingestion/events
     * 
     * Request body: RawEvent (Jetstream JSON)
     * Response: number of records accepted into queues
     */
    @PostMapping("/events")
    public ResponseEntity<Map<String, Integer>> submitEvent(@Valid @RequestBody RawEvent event) {
        log.debug("Received event over HTTP from {}", event.getDid());
        
        int accepted = ingestionService.ingest(event);
        
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("accepted", accepted));
    }
    
    /**
     * Flush every queue now and wait for the results.
     */
    @PostMapping("/flush")
    public ResponseEntity<List<FlushResult>> flushAll() {
        log.info("Manual flush requested");
        return ResponseEntity.ok(batchFlusher.flushAll().join());
    }
    
    @GetMapping("/health")
    public ResponseEntity<IngestionHealthReport> health() {
        IngestionHealthReport report = metricsReporter.report();
        return ResponseEntity.status(report.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(report);
    }
    
    @GetMapping("/circuit-breakers")
    public ResponseEntity<List<CircuitBreakerStats>> circuitBreakers() {
        return ResponseEntity.ok(circuitBreakers.allStats());
    }
    
    @PostMapping("/circuit-breakers/reset")
    public ResponseEntity<List<CircuitBreakerStats>> resetCircuitBreakers() {
        log.info("Resetting all circuit breakers");
        circuitBreakers.resetAll();
        return ResponseEntity.ok(circuitBreakers.allStats());
    }
    
    @PostMapping("/circuit-breakers/{destination}/reset")
    public ResponseEntity<CircuitBreakerStats> resetCircuitBreaker(@PathVariable String destination) {
        log.info("Resetting circuit breaker {}", destination);
        circuitBreakers.reset(destination);
        return ResponseEntity.ok(circuitBreakers.stats(destination));
    }
}

package com.firehose.domain.service;

import com.firehose.config.IngestionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the pipeline's timers: periodic flush, resource monitor and health report.
 * 
 * Runs as a lifecycle phase that starts before and stops after the Kafka
 * listener containers, so on shutdown no new events arrive while the final
 * flush drains the queues within the grace period.
 */
@Slf4j
@Component
public class PipelineScheduler implements SmartLifecycle {
    
    static final int PHASE = Integer.MAX_VALUE - 1000;
    
    private final TaskScheduler taskScheduler;
    private final BatchFlusher batchFlusher;
    private final BackpressureController backpressureController;
    private final MetricsReporter metricsReporter;
    private final IngestionProperties properties;
    private final Clock clock;
    private final List<ScheduledFuture<?>> handles = new ArrayList<>();
    private volatile boolean running;
    
    public PipelineScheduler(@Qualifier("pipelineTaskScheduler") TaskScheduler taskScheduler,
                             BatchFlusher batchFlusher,
                             BackpressureController backpressureController,
                             MetricsReporter metricsReporter,
                             IngestionProperties properties,
                             Clock clock) {
        this.taskScheduler = taskScheduler;
        this.batchFlusher = batchFlusher;
        this.backpressureController = backpressureController;
        this.metricsReporter = metricsReporter;
        this.properties = properties;
        this.clock = clock;
    }
    
    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        Duration flushInterval = properties.getQueue().getFlushInterval();
        Duration checkInterval = properties.getBackpressure().getCheckInterval();
        Duration reportInterval = properties.getHealth().getReportInterval();
        
        handles.add(schedule("flush", batchFlusher::flushAll, flushInterval));
        handles.add(schedule("resource-monitor", backpressureController::check, checkInterval));
        handles.add(schedule("health-report", metricsReporter::logReport, reportInterval));
        running = true;
        
        log.info("Pipeline timers started: flush every {}, resource check every {}, report every {}",
                flushInterval, checkInterval, reportInterval);
    }
    
    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        handles.forEach(handle -> handle.cancel(false));
        handles.clear();
        
        Duration grace = properties.getShutdown().getGracePeriod();
        log.info("Pipeline timers cancelled, flushing remaining records (grace period {})", grace);
        if (batchFlusher.drain(grace)) {
            log.info("All queues flushed on shutdown");
        } else {
            log.warn("Shutdown grace period elapsed with records still queued");
        }
    }
    
    @Override
    public boolean isRunning() {
        return running;
    }
    
    @Override
    public int getPhase() {
        return PHASE;
    }
    
    private ScheduledFuture<?> schedule(String name, Runnable task, Duration interval) {
        return taskScheduler.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Pipeline timer {} failed: {}", name, e.getMessage(), e);
            }
        }, clock.instant().plus(interval), interval);
    }
}

package com.firehose.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Infrastructure beans shared by the pipeline components.
 * 
 * - flushExecutor: bounded pool running batch flushes off the ingest thread
 * - pipelineTaskScheduler: drives the flush, resource monitor and report timers
 * - clock: time source for cooldowns, breaker timing and metrics
 */
@Slf4j
@Configuration
public class PipelineConfig {
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean(name = "flushExecutor")
    public ThreadPoolTaskExecutor flushExecutor(IngestionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getQueue().getFlushThreads());
        executor.setMaxPoolSize(properties.getQueue().getFlushThreads());
        executor.setQueueCapacity(256);
        executor.setThreadNamePrefix("flush-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getShutdown().getGracePeriod().toSeconds());
        executor.initialize();
        
        log.info("Flush executor initialized with {} threads", properties.getQueue().getFlushThreads());
        return executor;
    }
    
    @Bean(name = "pipelineTaskScheduler")
    public ThreadPoolTaskScheduler pipelineTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("pipeline-timer-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}

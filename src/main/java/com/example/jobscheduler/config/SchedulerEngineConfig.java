package com.example.jobscheduler.config;

import com.example.jobscheduler.service.engine.SchedulerEngine;
import com.example.jobscheduler.service.engine.SpringSchedulerEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.ZoneId;

/**
 * Configuration for the scheduler engine.
 * <p>
 * The engine is a single explicit instance owned by the application context
 * and handed to the reconciliation controller. Its thread pool is not exposed
 * as a bean, so nothing else can schedule work on it.
 */
@Slf4j
@Configuration
public class SchedulerEngineConfig {

    @Bean(destroyMethod = "shutdown")
    public SchedulerEngine schedulerEngine(JobSchedulerProperties properties) {
        log.info("Creating scheduler engine with {} workers in zone {}", properties.getEnginePoolSize(), properties.getTimezone());

        var taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(properties.getEnginePoolSize());
        taskScheduler.setThreadNamePrefix("job-worker-");
        taskScheduler.setRemoveOnCancelPolicy(true);
        taskScheduler.setWaitForTasksToCompleteOnShutdown(true);
        taskScheduler.setAwaitTerminationSeconds(properties.getShutdownAwaitSeconds());
        taskScheduler.setErrorHandler(t -> log.error("Unhandled error in scheduler worker: {}", t.getMessage(), t));
        taskScheduler.initialize();

        return new SpringSchedulerEngine(taskScheduler, ZoneId.of(properties.getTimezone()));
    }
}

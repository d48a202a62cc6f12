package com.example.jobscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-scheduler")
public class JobSchedulerProperties {

    /**
     * Interval in milliseconds between reconciliation passes
     */
    @Min(100)
    private long pollIntervalMs = 10000;

    /**
     * Number of worker threads firing job callbacks
     */
    @Min(1)
    private int enginePoolSize = 10;

    /**
     * Zone used to evaluate schedules that do not name their own timezone
     */
    @NotBlank
    private String timezone = "America/New_York";

    /**
     * How long shutdown waits for in-flight jobs before abandoning them
     */
    @Min(0)
    private int shutdownAwaitSeconds = 60;

    /**
     * Whether RUNNING execution rows left by a previous process are failed at startup
     */
    private boolean zombieRecoveryEnabled = true;

    /**
     * Whether the scheduler loop is started with the application context
     */
    private boolean runnerEnabled = true;
}

package com.example.jobscheduler.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring scheduler health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Registered recurring jobs
 * - Reconciliation passes and skipped passes
 * - Job execution times and outcomes
 * - Zombie executions recovered at startup
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    private final AtomicLong registeredJobs = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("job_scheduler_registered_jobs", registeredJobs, AtomicLong::get)
                .description("Number of recurring jobs registered with the engine")
                .register(meterRegistry);
    }

    /**
     * Update the registered job gauge
     */
    public void setRegisteredJobs(int count) {
        registeredJobs.set(count);
    }

    /**
     * Record a reconciliation pass
     */
    public void recordReconciliationPass(boolean completed) {
        meterRegistry.counter("job_scheduler_reconciliation_passes",
                "completed", String.valueOf(completed)
        ).increment();
    }

    /**
     * Record a row skipped because it could not be parsed
     */
    public void recordMalformedRecord() {
        meterRegistry.counter("job_scheduler_malformed_records").increment();
    }

    /**
     * Create a timer for job execution
     */
    public Timer.Sample startJobExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record job execution time
     */
    public void recordJobExecution(Timer.Sample sample, String jobClass, boolean success) {
        sample.stop(Timer.builder("job_scheduler_execution_time")
                .tag("job_class", jobClass != null ? jobClass : "unknown")
                .tag("success", String.valueOf(success))
                .description("Job execution time")
                .register(meterRegistry));
    }

    /**
     * Record job failure
     */
    public void recordJobFailure(String jobClass, String errorType) {
        meterRegistry.counter("job_scheduler_failures",
                "job_class", jobClass != null ? jobClass : "unknown",
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    /**
     * Record executions failed by the startup recovery sweep
     */
    public void recordZombiesRecovered(int count) {
        meterRegistry.counter("job_scheduler_zombies_recovered").increment(count);
    }
}

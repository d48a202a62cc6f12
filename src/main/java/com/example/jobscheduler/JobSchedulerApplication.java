package com.example.jobscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Job Scheduler Service Application
 * <p>
 * Keeps an in-process cron engine synchronized with the job definitions
 * stored in the {@code scheduled_job} table.
 * <p>
 * Features:
 * - Periodic reconciliation of persisted jobs with live registrations
 * - One-shot runs requested by inserting unscheduled, enabled rows
 * - Zombie execution recovery at startup
 * - Registry-based dispatch of job classes to task implementations
 * <p>
 * {@link SpringApplication#run} returns only once the scheduler loop has ended
 * (for example through the {@code stop_scheduler.Stop} job), after which the
 * process exits so that the service supervisor can restart it.
 */
@SpringBootApplication
public class JobSchedulerApplication {

    public static void main(String[] args) {
        var context = SpringApplication.run(JobSchedulerApplication.class, args);
        System.exit(SpringApplication.exit(context));
    }
}

package com.example.jobscheduler.service.engine;

import com.example.jobscheduler.domain.model.JobSchedule;

import java.util.List;

/**
 * In-process time-based trigger engine.
 * <p>
 * Recurring registrations are keyed by the job id. Operations on an id that
 * is not registered throw {@link IllegalArgumentException}.
 */
public interface SchedulerEngine {

    /**
     * Register a recurring job.
     *
     * @param startSuspended register paused; the job does not fire until resumed
     */
    void addRecurring(String id, String name, JobSchedule schedule, Runnable callback, boolean startSuspended);

    /**
     * Run a callback once, as soon as the engine is started
     */
    void addOneShot(String name, Runnable callback);

    /**
     * Replace the display name and callback, keeping the schedule
     */
    void modify(String id, String name, Runnable callback);

    void reschedule(String id, JobSchedule schedule);

    void pause(String id);

    void resume(String id);

    void remove(String id);

    /**
     * Begin firing. Registrations made earlier are armed now.
     */
    void start();

    /**
     * Stop firing and wait for in-flight callbacks. Safe to call more than once.
     */
    void shutdown();

    /**
     * Snapshot of the recurring registrations
     */
    List<RegisteredJob> getRegisteredJobs();
}

package com.example.jobscheduler.service.reconciliation;

import com.example.jobscheduler.service.engine.RegisteredJob;

import java.util.List;

/**
 * Handle on the running scheduler given to jobs.
 */
public interface SchedulerControl {

    /**
     * Ask the control loop to end after its current pass. Safe from any thread.
     */
    void stop();

    List<RegisteredJob> getRegisteredJobs();

    ControllerState getState();
}

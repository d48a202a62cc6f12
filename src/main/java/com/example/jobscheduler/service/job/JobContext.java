package com.example.jobscheduler.service.job;

import com.example.jobscheduler.service.reconciliation.SchedulerControl;
import lombok.Builder;
import lombok.Getter;

import java.util.UUID;

/**
 * What a job gets to know about the run it was created for
 */
@Getter
@Builder
public class JobContext {

    private final SchedulerControl control;
    private final String jobId;
    private final String name;

    /**
     * Null if the execution row could not be written
     */
    private final UUID executionId;
}

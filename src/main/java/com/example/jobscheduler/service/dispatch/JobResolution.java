package com.example.jobscheduler.service.dispatch;

import com.example.jobscheduler.service.job.JobTask;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of resolving a job class into a runnable task.
 * Exactly one of task and failure is set.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class JobResolution {

    public enum Failure {
        UNKNOWN_JOB_CLASS,
        INVALID_OPTIONS,
        CONSTRUCTION_ERROR
    }

    private final JobTask task;
    private final Failure failure;
    private final String message;

    public static JobResolution resolved(JobTask task) {
        return new JobResolution(task, null, null);
    }

    public static JobResolution failed(Failure failure, String message) {
        return new JobResolution(null, failure, message);
    }

    public boolean isResolved() {
        return task != null;
    }
}

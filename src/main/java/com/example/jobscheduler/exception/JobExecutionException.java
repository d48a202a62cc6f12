package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception raised by a job whose run could not do its work
 */
@Getter
public class JobExecutionException extends RuntimeException {

    private final String jobName;

    public JobExecutionException(String jobName, String message) {
        super(String.format("Job %s failed: %s", jobName, message));
        this.jobName = jobName;
    }
}

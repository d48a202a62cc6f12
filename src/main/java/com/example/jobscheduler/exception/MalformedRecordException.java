package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for a scheduled_job row that cannot be parsed or validated
 */
@Getter
public class MalformedRecordException extends RuntimeException {

    private final String jobId;

    public MalformedRecordException(String jobId, String message) {
        super(String.format("Malformed job %s: %s", jobId, message));
        this.jobId = jobId;
    }

    public MalformedRecordException(String jobId, String message, Throwable cause) {
        super(String.format("Malformed job %s: %s", jobId, message), cause);
        this.jobId = jobId;
    }
}

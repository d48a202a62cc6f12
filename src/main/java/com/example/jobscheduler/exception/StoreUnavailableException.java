package com.example.jobscheduler.exception;

/**
 * Exception for a job store that cannot be read.
 * Fatal during startup; a refresh pass that hits it is skipped.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

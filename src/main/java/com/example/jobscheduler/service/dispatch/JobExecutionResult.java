package com.example.jobscheduler.service.dispatch;

import lombok.Builder;
import lombok.Data;

/**
 * Represents the result of a job execution.
 * <p>
 * Contains what is needed to complete the execution row
 * and record metrics.
 */
@Data
@Builder
public class JobExecutionResult {

    private boolean success;

    private String errorMessage;

    /**
     * Error classification for analysis, e.g. the exception type
     * or {@link JobResolution.Failure} name
     */
    private String errorType;

    /**
     * Stack trace if available
     */
    private String stackTrace;

    public static JobExecutionResult success() {
        return JobExecutionResult.builder().success(true).build();
    }

    public static JobExecutionResult failure(String errorMessage, String errorType) {
        return JobExecutionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .build();
    }

    /**
     * Create a failure result from an exception or error thrown by the job
     */
    public static JobExecutionResult failure(Throwable e) {
        return JobExecutionResult.builder()
                .success(false)
                .errorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getName())
                .errorType(e.getClass().getSimpleName())
                .stackTrace(truncateStackTrace(e))
                .build();
    }

    /**
     * Text stored in the execution row
     */
    public String describe() {
        if (success) {
            return "completed";
        }
        return stackTrace != null ? stackTrace : errorMessage;
    }

    /**
     * Truncate stack trace to keep execution rows small
     */
    private static String truncateStackTrace(Throwable e) {
        var sb = new StringBuilder();
        sb.append(e.getClass().getName()).append(": ").append(e.getMessage()).append("\n");

        var trace = e.getStackTrace();
        var maxLines = Math.min(trace.length, 20);
        for (var i = 0; i < maxLines; i++) {
            sb.append("\tat ").append(trace[i]).append("\n");
        }
        if (trace.length > maxLines) {
            sb.append("\t... ").append(trace.length - maxLines).append(" more\n");
        }

        var result = sb.toString();
        if (result.length() > 4000) {
            result = result.substring(0, 4000) + "...";
        }
        return result;
    }
}

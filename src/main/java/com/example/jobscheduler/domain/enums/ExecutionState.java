package com.example.jobscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * States of a single job execution.
 */
@Getter
@RequiredArgsConstructor
public enum ExecutionState {

    /**
     * The job is executing on a scheduler worker.
     * A row left in this state by a previous process is a zombie.
     */
    RUNNING("running", "Running", false),

    /**
     * The job ran to completion.
     */
    SUCCESS("success", "Success", true),

    /**
     * The job could not be resolved, raised an error, or was
     * interrupted by the end of the process that ran it.
     */
    FAILED("failed", "Failed", true);

    private final String code;
    private final String displayName;
    private final boolean terminal;

    /**
     * Find ExecutionState by its code value
     */
    public static ExecutionState fromCode(String code) {
        for (var state : values()) {
            if (state.getCode().equals(code)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown execution state code: " + code);
    }
}

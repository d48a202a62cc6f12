package com.example.jobscheduler.service.engine;

import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Read-only view of one recurring registration
 */
@Value
@Builder
public class RegisteredJob {

    String id;
    String name;
    String cronExpression;
    ZoneId zone;
    boolean paused;

    /**
     * Null when paused or when the expression never matches again
     */
    ZonedDateTime nextFireTime;
}

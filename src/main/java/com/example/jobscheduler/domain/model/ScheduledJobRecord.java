package com.example.jobscheduler.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;
import java.util.Objects;

/**
 * Parsed, immutable snapshot of one {@code scheduled_job} row.
 * <p>
 * Two snapshots of the same job are equal only if every field is equal;
 * any difference is a modification the controller has to act on.
 */
@Getter
@Builder
@ToString
public class ScheduledJobRecord {

    private final String id;
    private final String name;

    /**
     * Key of the task implementation, {@code namespace.TypeName}
     */
    private final String jobClass;

    /**
     * Null for jobs which are not recurring
     */
    private final JobSchedule schedule;

    private final boolean enabled;

    /**
     * Unmodifiable parameter bag handed to the task
     */
    private final Map<String, Object> opts;

    public boolean isRecurring() {
        return schedule != null;
    }

    /**
     * An enabled row without a schedule asks for a single immediate run
     */
    public boolean isOneShotRequest() {
        return schedule == null && enabled;
    }

    public boolean hasSameSchedule(ScheduledJobRecord other) {
        return Objects.equals(schedule, other.schedule);
    }

    /**
     * Whether the callback bound for this job would be the same:
     * same display name, same implementation and same parameters.
     */
    public boolean hasSameBinding(ScheduledJobRecord other) {
        return Objects.equals(name, other.name)
                && Objects.equals(jobClass, other.jobClass)
                && Objects.equals(opts, other.opts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScheduledJobRecord other)) {
            return false;
        }
        return enabled == other.enabled
                && Objects.equals(id, other.id)
                && hasSameBinding(other)
                && hasSameSchedule(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, jobClass, schedule, enabled, opts);
    }
}

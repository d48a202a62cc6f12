package com.example.jobscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Row of the {@code scheduled_job} table, as written by the administration tool.
 * <p>
 * The JSON columns are kept as text here. They are parsed into a
 * {@link com.example.jobscheduler.domain.model.ScheduledJobRecord} per row,
 * so that one malformed row does not prevent the others from loading.
 */
@Entity
@Table(name = "scheduled_job")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
public class ScheduledJob {

    /**
     * Stable identifier, also the registration key in the scheduler engine
     */
    @Id
    @Column(name = "id", updatable = false, nullable = false, length = 64)
    private String id;

    /**
     * Display name of the job
     */
    @Column(name = "name", nullable = false, length = 256)
    private String name;

    /**
     * Implementation to dispatch to, in the form {@code namespace.TypeName}
     */
    @Column(name = "job_class", nullable = false, length = 256)
    private String jobClass;

    /**
     * Optional cron-like schedule serialized as JSON, e.g. {"hour": "1", "minute": "15"}
     */
    @Column(name = "schedule", columnDefinition = "TEXT")
    private String schedule;

    /**
     * Recurring jobs which are not enabled stay registered but paused
     */
    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    /**
     * Parameters passed to the job at run time, serialized as a JSON object
     */
    @Column(name = "opts", columnDefinition = "TEXT")
    private String opts;
}

package com.example.jobscheduler.domain.entity;

import com.example.jobscheduler.domain.enums.ExecutionState;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Execution history entry.
 * Each firing of a job creates one row, RUNNING until the job finishes.
 */
@Entity
@Table(name = "job_execution", indexes = {
        @Index(name = "idx_job_execution_job_id", columnList = "job_id"),
        @Index(name = "idx_job_execution_state", columnList = "state"),
        @Index(name = "idx_job_execution_started_at", columnList = "started_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Identifier of the scheduled job; one-shot rows may already be gone
     */
    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Column(name = "job_name", length = 256)
    private String jobName;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 30)
    private ExecutionState state;

    /**
     * Instance that ran the job
     */
    @Column(name = "executor_instance", length = 100)
    private String executorInstance;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    /**
     * Error classification if the run failed
     */
    @Column(name = "error_type", length = 200)
    private String errorType;

    /**
     * Outcome summary or error message
     */
    @Column(name = "description", columnDefinition = "TEXT")
    private String description;
}

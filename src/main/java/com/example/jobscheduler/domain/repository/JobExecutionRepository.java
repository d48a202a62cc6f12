package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.JobExecution;
import com.example.jobscheduler.domain.enums.ExecutionState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for JobExecution entity
 */
@Repository
public interface JobExecutionRepository extends JpaRepository<JobExecution, UUID> {

    /**
     * Find all executions in a given state
     */
    List<JobExecution> findByState(ExecutionState state);

    /**
     * Find executions of a job, latest first
     */
    List<JobExecution> findByJobIdOrderByStartedAtDesc(String jobId);

    /**
     * Move a single execution from one state to another, in its own transaction.
     *
     * @return number of rows updated (0 if the row is no longer in the expected state)
     */
    @Modifying
    @Transactional
    @Query("""
            UPDATE JobExecution e
            SET e.state = :newState,
                e.description = :description,
                e.completedAt = :now
            WHERE e.id = :id
              AND e.state = :expectedState
            """)
    int transitionState(
            @Param("id") UUID id,
            @Param("expectedState") ExecutionState expectedState,
            @Param("newState") ExecutionState newState,
            @Param("description") String description,
            @Param("now") Instant now);
}

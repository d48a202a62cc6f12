package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.ScheduledJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Repository for ScheduledJob rows.
 * <p>
 * Rows are created and edited by the administration tool; the scheduler
 * only reads them and drops one-shot rows after firing them.
 */
@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, String> {

    /**
     * Delete a job row by id.
     *
     * @return number of rows deleted (0 if the row was already gone)
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM ScheduledJob j WHERE j.id = :id")
    int deleteJobById(@Param("id") String id);
}

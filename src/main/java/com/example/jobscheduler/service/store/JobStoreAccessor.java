package com.example.jobscheduler.service.store;

import com.example.jobscheduler.domain.entity.ScheduledJob;
import com.example.jobscheduler.domain.repository.ScheduledJobRepository;
import com.example.jobscheduler.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Access to the persisted job definitions.
 * <p>
 * Reads every row in one query and deletes one-shot rows once they have been
 * fired. Nothing else in the scheduler writes to {@code scheduled_job}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStoreAccessor {

    private final ScheduledJobRepository scheduledJobRepository;

    /**
     * Load all job rows.
     *
     * @return every row, JSON columns unparsed
     * @throws StoreUnavailableException if the store cannot be read
     */
    public List<ScheduledJob> loadAll() {
        try {
            return scheduledJobRepository.findAll();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to load scheduled jobs: " + e.getMessage(), e);
        }
    }

    /**
     * Delete a job row.
     *
     * @return true if the row is gone afterwards, false if the delete failed
     */
    public boolean delete(String id) {
        try {
            var deleted = scheduledJobRepository.deleteJobById(id);
            if (deleted == 0) {
                log.debug("Job {} was already deleted", id);
            }
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to delete job {}: {}", id, e.getMessage(), e);
            return false;
        }
    }
}

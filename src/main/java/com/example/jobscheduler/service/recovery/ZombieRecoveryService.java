package com.example.jobscheduler.service.recovery;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.enums.ExecutionState;
import com.example.jobscheduler.domain.repository.JobExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Fails executions left RUNNING by a process that died.
 * <p>
 * Runs once at startup, before any job is scheduled, so every RUNNING row
 * belongs to an earlier process. Each row is updated in its own transaction;
 * a row that cannot be updated is left for the next startup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ZombieRecoveryService {

    static final String ZOMBIE_DESCRIPTION = "marking zombie run as failed";

    private final JobExecutionRepository executionRepository;
    private final JobSchedulerProperties properties;
    private final MetricsConfig metricsConfig;

    /**
     * @return number of executions marked as failed
     */
    public int recover() {
        if (!properties.isZombieRecoveryEnabled()) {
            log.info("Zombie recovery disabled");
            return 0;
        }

        var now = Instant.now();
        var recovered = 0;
        try {
            var zombies = executionRepository.findByState(ExecutionState.RUNNING);
            for (var zombie : zombies) {
                try {
                    var updated = executionRepository.transitionState(
                            zombie.getId(), ExecutionState.RUNNING, ExecutionState.FAILED, ZOMBIE_DESCRIPTION, now);
                    if (updated == 1) {
                        log.warn("Marked zombie run {} of {} (started {}) as failed",
                                zombie.getId(), zombie.getJobName(), zombie.getStartedAt());
                        recovered++;
                    }
                } catch (DataAccessException e) {
                    log.error("Failed to mark zombie run {} of {} as failed: {}",
                            zombie.getId(), zombie.getJobName(), e.getMessage(), e);
                }
            }
        } catch (DataAccessException e) {
            log.error("Failed to look for zombie runs: {}", e.getMessage(), e);
        }

        if (recovered > 0) {
            log.info("Recovered {} zombie runs", recovered);
        }
        metricsConfig.recordZombiesRecovered(recovered);
        return recovered;
    }
}

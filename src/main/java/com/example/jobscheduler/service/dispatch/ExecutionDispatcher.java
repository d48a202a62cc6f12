package com.example.jobscheduler.service.dispatch;

import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.JobExecution;
import com.example.jobscheduler.domain.enums.ExecutionState;
import com.example.jobscheduler.domain.model.ScheduledJobRecord;
import com.example.jobscheduler.domain.repository.JobExecutionRepository;
import com.example.jobscheduler.service.job.JobContext;
import com.example.jobscheduler.service.job.JobTaskRegistry;
import com.example.jobscheduler.service.reconciliation.SchedulerControl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Runs one firing of a job.
 * <p>
 * Handles:
 * - Execution row bookkeeping (RUNNING, then SUCCESS or FAILED)
 * - Resolving the job class and binding its options
 * - Running the task with failures contained
 * - Timing logs and metrics
 * <p>
 * {@link #dispatch} only rethrows a {@link VirtualMachineError}, after the
 * execution row has been completed. A failing job must not affect the engine
 * or any other job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionDispatcher {

    private final JobTaskRegistry jobTaskRegistry;
    private final JobExecutionRepository executionRepository;
    private final MetricsConfig metricsConfig;

    @Value("${HOSTNAME:unknown}")
    private String hostname;

    private String instanceId;

    /**
     * Get unique instance ID for this scheduler process
     */
    private String getInstanceId() {
        if (instanceId == null) {
            try {
                var host = InetAddress.getLocalHost().getHostName();
                instanceId = host + "-" + ProcessHandle.current().pid();
            } catch (Exception e) {
                instanceId = hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
            }
        }
        return instanceId;
    }

    /**
     * Resolve and run a job once.
     *
     * @param record  snapshot of the job at the time it was registered
     * @param control scheduler handle passed on to the job
     */
    public void dispatch(ScheduledJobRecord record, SchedulerControl control) {
        var name = record.getName();
        var startTime = Instant.now();
        var timerSample = metricsConfig.startJobExecutionTimer();

        var execution = recordStart(record, startTime);
        var executionId = execution != null ? execution.getId() : null;

        JobExecutionResult result;
        VirtualMachineError fatal = null;
        try {
            result = execute(record, control, executionId);
        } catch (VirtualMachineError e) {
            fatal = e;
            result = JobExecutionResult.failure(e);
        } catch (Throwable e) {
            result = JobExecutionResult.failure(e);
        }

        var elapsed = Duration.between(startTime, Instant.now());
        if (result.isSuccess()) {
            log.info("Job started {}, elapsed {} ({})", startTime, elapsed, name);
        } else {
            log.error("Job {} failed after {}: {}", name, elapsed, result.getErrorMessage());
            if (result.getStackTrace() != null) {
                log.debug("Failure of job {}:\n{}", name, result.getStackTrace());
            }
            metricsConfig.recordJobFailure(record.getJobClass(), result.getErrorType());
        }
        metricsConfig.recordJobExecution(timerSample, record.getJobClass(), result.isSuccess());

        if (execution != null) {
            recordCompletion(execution, result, elapsed);
        }
        if (fatal != null) {
            throw fatal;
        }
    }

    private JobExecutionResult execute(ScheduledJobRecord record, SchedulerControl control, UUID executionId) throws Exception {
        var context = JobContext.builder()
                .control(control)
                .jobId(record.getId())
                .name(record.getName())
                .executionId(executionId)
                .build();

        var resolution = jobTaskRegistry.resolve(record.getJobClass(), record.getOpts(), context);
        if (!resolution.isResolved()) {
            return JobExecutionResult.failure(resolution.getMessage(), resolution.getFailure().name());
        }

        resolution.getTask().run();
        return JobExecutionResult.success();
    }

    /**
     * Write the RUNNING row; bookkeeping failures never stop the job
     */
    private JobExecution recordStart(ScheduledJobRecord record, Instant startTime) {
        try {
            return executionRepository.save(JobExecution.builder()
                    .jobId(record.getId())
                    .jobName(record.getName())
                    .state(ExecutionState.RUNNING)
                    .executorInstance(getInstanceId())
                    .startedAt(startTime)
                    .build());
        } catch (DataAccessException e) {
            log.warn("Could not record start of job {}: {}", record.getName(), e.getMessage());
            return null;
        }
    }

    private void recordCompletion(JobExecution execution, JobExecutionResult result, Duration elapsed) {
        execution.setState(result.isSuccess() ? ExecutionState.SUCCESS : ExecutionState.FAILED);
        execution.setCompletedAt(Instant.now());
        execution.setDurationMs(elapsed.toMillis());
        execution.setErrorType(result.getErrorType());
        execution.setDescription(result.describe());
        try {
            executionRepository.save(execution);
        } catch (DataAccessException e) {
            log.warn("Could not record completion of job {}: {}", execution.getJobName(), e.getMessage());
        }
    }
}

package com.example.jobscheduler.service.reconciliation;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.ScheduledJob;
import com.example.jobscheduler.domain.model.ScheduledJobRecord;
import com.example.jobscheduler.exception.MalformedRecordException;
import com.example.jobscheduler.exception.StoreUnavailableException;
import com.example.jobscheduler.mapper.ScheduledJobRecordMapper;
import com.example.jobscheduler.service.dispatch.ExecutionDispatcher;
import com.example.jobscheduler.service.engine.RegisteredJob;
import com.example.jobscheduler.service.engine.SchedulerEngine;
import com.example.jobscheduler.service.store.JobStoreAccessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.boot.availability.ReadinessState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Control loop keeping the scheduler engine in line with the {@code scheduled_job} table.
 * <p>
 * Every poll interval the whole table is read and each row is compared with
 * the snapshot the engine was last given for it:
 * - a new row with a schedule is registered, paused if disabled
 * - an enabled row without a schedule is run once and its row deleted
 * - a row whose schedule was removed is unregistered, and run once if enabled
 * - a changed row only gets the engine calls for the fields that changed
 * - a registered job whose row is gone is unregistered
 * <p>
 * A row that cannot be parsed is skipped for the pass and leaves any existing
 * registration alone. The registrations are only touched from the thread
 * calling {@link #run()}.
 * <p>
 * {@link #run()} blocks the application runner, so Spring Boot never reports
 * readiness by itself. The controller publishes it instead: accepting traffic
 * once the engine is started, refusing it when draining begins.
 */
@Slf4j
@Service
public class ReconciliationController implements SchedulerControl {

    private final SchedulerEngine engine;
    private final JobStoreAccessor store;
    private final ScheduledJobRecordMapper mapper;
    private final ExecutionDispatcher dispatcher;
    private final MetricsConfig metricsConfig;
    private final ApplicationEventPublisher eventPublisher;
    private final long pollIntervalMs;

    private final Map<String, JobHandle> handles = new HashMap<>();

    /**
     * One-shot rows fired in an earlier pass whose delete failed
     */
    private final Map<String, ScheduledJobRecord> firedOneShots = new HashMap<>();

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile ControllerState state = ControllerState.STOPPED;

    public ReconciliationController(SchedulerEngine engine,
                                    JobStoreAccessor store,
                                    ScheduledJobRecordMapper mapper,
                                    ExecutionDispatcher dispatcher,
                                    MetricsConfig metricsConfig,
                                    ApplicationEventPublisher eventPublisher,
                                    JobSchedulerProperties properties) {
        this.engine = engine;
        this.store = store;
        this.mapper = mapper;
        this.dispatcher = dispatcher;
        this.metricsConfig = metricsConfig;
        this.eventPublisher = eventPublisher;
        this.pollIntervalMs = properties.getPollIntervalMs();
    }

    /**
     * Load all jobs, start the engine and poll until {@link #stop()} is called,
     * then shut the engine down. Blocks the calling thread.
     *
     * @throws StoreUnavailableException if the jobs cannot be loaded at startup
     */
    public void run() {
        if (state != ControllerState.STOPPED) {
            throw new IllegalStateException("Scheduler is already " + state);
        }

        var loadStart = Instant.now();
        loadJobs();

        state = ControllerState.RUNNING;
        try {
            engine.start();
            log.info("registered {} jobs in {}", handles.size(), Duration.between(loadStart, Instant.now()));
            AvailabilityChangeEvent.publish(eventPublisher, this, ReadinessState.ACCEPTING_TRAFFIC);

            while (!awaitStop()) {
                refreshJobs();
            }
        } finally {
            state = ControllerState.DRAINING;
            AvailabilityChangeEvent.publish(eventPublisher, this, ReadinessState.REFUSING_TRAFFIC);
            log.info("Stopping scheduler, waiting for running jobs");
            engine.shutdown();
            state = ControllerState.STOPPED;
            log.info("Scheduler stopped");
        }
    }

    @Override
    public void stop() {
        if (stopSignal.getCount() > 0) {
            log.info("Scheduler stop requested");
            stopSignal.countDown();
        }
    }

    @Override
    public List<RegisteredJob> getRegisteredJobs() {
        return engine.getRegisteredJobs();
    }

    @Override
    public ControllerState getState() {
        return state;
    }

    /**
     * Initial load. Unlike a refresh, a store failure here is not survivable.
     */
    public void loadJobs() {
        reconcile(store.loadAll());
    }

    /**
     * One reconciliation pass. A store failure skips the pass and keeps the current registrations.
     */
    public void refreshJobs() {
        List<ScheduledJob> rows;
        try {
            rows = store.loadAll();
        } catch (StoreUnavailableException e) {
            log.error("Failed to refresh jobs, keeping current registrations: {}", e.getMessage(), e);
            metricsConfig.recordReconciliationPass(false);
            return;
        }
        reconcile(rows);
    }

    /**
     * Wait one poll interval.
     *
     * @return true if the loop should end
     */
    private boolean awaitStop() {
        try {
            return stopSignal.await(pollIntervalMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scheduler interrupted");
            stop();
            return true;
        }
    }

    private void reconcile(List<ScheduledJob> rows) {
        var seen = new HashSet<String>();

        for (var row : rows) {
            // Seen even when malformed, so a bad edit does not unregister the job
            seen.add(row.getId());

            ScheduledJobRecord record;
            try {
                record = mapper.toRecord(row);
            } catch (MalformedRecordException e) {
                log.error("Skipping job {} ({}): {}", row.getId(), row.getName(), e.getMessage());
                metricsConfig.recordMalformedRecord();
                continue;
            }

            try {
                reconcileRecord(record);
            } catch (RuntimeException e) {
                log.error("Failed to reconcile job {} ({}): {}", record.getId(), record.getName(), e.getMessage(), e);
            }
        }

        for (var id : new ArrayList<>(handles.keySet())) {
            if (!seen.contains(id)) {
                removeHandle(id);
            }
        }
        firedOneShots.keySet().retainAll(seen);

        metricsConfig.setRegisteredJobs(handles.size());
        metricsConfig.recordReconciliationPass(true);
    }

    private void reconcileRecord(ScheduledJobRecord record) {
        var handle = handles.get(record.getId());

        if (handle == null) {
            if (record.isRecurring()) {
                register(record);
            } else if (record.isEnabled()) {
                runOnce(record, "Unscheduled run of {}");
            }
            return;
        }

        var previous = handle.getSnapshot();
        if (!record.isRecurring()) {
            removeHandle(record.getId());
            if (record.isEnabled()) {
                runOnce(record, "Manual run of {}");
            }
            return;
        }

        if (record.equals(previous)) {
            return;
        }

        var id = record.getId();
        if (!record.hasSameBinding(previous)) {
            engine.modify(id, record.getName(), callbackFor(record));
            log.info("Modified {} registration", record.getName());
        }
        if (!record.hasSameSchedule(previous)) {
            engine.reschedule(id, record.getSchedule());
            log.info("Rescheduled {} to {}", record.getName(), record.getSchedule().toCronExpression());
        }
        if (previous.isEnabled() && !record.isEnabled()) {
            engine.pause(id);
            log.info("Paused {}", record.getName());
        } else if (!previous.isEnabled() && record.isEnabled()) {
            engine.resume(id);
            log.info("Resumed {}", record.getName());
        }
        handles.put(id, new JobHandle(id, record));
    }

    private void register(ScheduledJobRecord record) {
        engine.addRecurring(record.getId(), record.getName(), record.getSchedule(), callbackFor(record), !record.isEnabled());
        handles.put(record.getId(), new JobHandle(record.getId(), record));
        log.info("Registered {}{}", record.getName(), record.isEnabled() ? "" : " (paused)");
    }

    private void removeHandle(String id) {
        var handle = handles.remove(id);
        try {
            engine.remove(id);
            log.info("Removed {} schedule", handle.getSnapshot().getName());
        } catch (IllegalArgumentException e) {
            log.warn("Job {} was not registered with the engine: {}", id, e.getMessage());
        }
    }

    /**
     * Fire a one-shot row and delete it, so it runs exactly once
     */
    private void runOnce(ScheduledJobRecord record, String message) {
        var id = record.getId();

        // Already fired, only the delete is outstanding
        if (record.equals(firedOneShots.get(id))) {
            if (store.delete(id)) {
                firedOneShots.remove(id);
                log.info("Job {} dropped", record.getName());
            }
            return;
        }

        log.info(message, record.getName());
        engine.addOneShot(record.getName(), callbackFor(record));

        if (store.delete(id)) {
            firedOneShots.remove(id);
            log.info("Job {} dropped", record.getName());
        } else {
            firedOneShots.put(id, record);
            log.warn("Job {} could not be dropped, will retry the delete without running it again", record.getName());
        }
    }

    private Runnable callbackFor(ScheduledJobRecord record) {
        return () -> dispatcher.dispatch(record, this);
    }
}

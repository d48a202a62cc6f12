package com.example.jobscheduler.service.engine;

import com.example.jobscheduler.domain.model.JobSchedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link SchedulerEngine} backed by Spring's {@link ThreadPoolTaskScheduler}.
 * <p>
 * Each recurring registration owns at most one armed {@link CronTrigger}
 * future. Pausing or removing a job cancels that future; resuming arms a new
 * one. A job never runs concurrently with itself: a firing that finds the
 * previous run of the same job still active is skipped.
 * <p>
 * Mutating operations are serialized on the engine. Reading the registrations
 * does not take the lock, so a running job may report on the engine while
 * {@link #shutdown()} waits for it.
 */
@Slf4j
public class SpringSchedulerEngine implements SchedulerEngine {

    private final ThreadPoolTaskScheduler taskScheduler;
    private final ZoneId defaultZone;

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    private final List<Runnable> pendingOneShots = new ArrayList<>();

    private final CountDownLatch terminated = new CountDownLatch(1);

    private boolean started;
    private boolean shutdown;

    public SpringSchedulerEngine(ThreadPoolTaskScheduler taskScheduler, ZoneId defaultZone) {
        this.taskScheduler = taskScheduler;
        this.defaultZone = defaultZone;
    }

    @Override
    public synchronized void addRecurring(String id, String name, JobSchedule schedule, Runnable callback, boolean startSuspended) {
        checkNotShutdown();
        if (registrations.containsKey(id)) {
            throw new IllegalArgumentException("Job " + id + " is already registered");
        }

        var registration = new Registration(id, name, callback);
        registration.setSchedule(schedule);
        registration.paused = startSuspended;
        registrations.put(id, registration);

        if (started && !startSuspended) {
            registration.arm();
        }
        log.debug("Added job {} ({}) with cron '{}' in {}{}", id, name, registration.cron, registration.zone,
                startSuspended ? ", paused" : "");
    }

    @Override
    public synchronized void addOneShot(String name, Runnable callback) {
        checkNotShutdown();
        Runnable task = () -> runOnce(name, callback);
        if (started) {
            taskScheduler.execute(task);
        } else {
            pendingOneShots.add(task);
        }
    }

    @Override
    public synchronized void modify(String id, String name, Runnable callback) {
        var registration = lookup(id);
        registration.name = name;
        registration.callback = callback;
    }

    @Override
    public synchronized void reschedule(String id, JobSchedule schedule) {
        var registration = lookup(id);
        registration.disarm();
        registration.setSchedule(schedule);
        if (started && !registration.paused) {
            registration.arm();
        }
    }

    @Override
    public synchronized void pause(String id) {
        var registration = lookup(id);
        registration.paused = true;
        registration.disarm();
    }

    @Override
    public synchronized void resume(String id) {
        var registration = lookup(id);
        if (!registration.paused) {
            return;
        }
        registration.paused = false;
        if (started) {
            registration.arm();
        }
    }

    @Override
    public synchronized void remove(String id) {
        var registration = registrations.remove(id);
        if (registration == null) {
            throw new IllegalArgumentException("No job registered with id " + id);
        }
        registration.disarm();
    }

    @Override
    public synchronized void start() {
        checkNotShutdown();
        if (started) {
            return;
        }
        started = true;

        for (var registration : registrations.values()) {
            if (!registration.paused) {
                registration.arm();
            }
        }
        pendingOneShots.forEach(taskScheduler::execute);
        pendingOneShots.clear();

        log.info("Scheduler engine started with {} recurring jobs", registrations.size());
    }

    /**
     * Stop firing and wait for running jobs. Every caller blocks until the
     * worker pool has terminated, not only the first one.
     */
    @Override
    public void shutdown() {
        boolean alreadyShutdown;
        synchronized (this) {
            alreadyShutdown = shutdown;
            if (!alreadyShutdown) {
                shutdown = true;
                // Cancel first: the executor would otherwise still run delayed tasks after shutdown
                registrations.values().forEach(Registration::disarm);
                pendingOneShots.clear();
            }
        }
        if (alreadyShutdown) {
            awaitTermination();
            return;
        }

        log.info("Shutting down scheduler engine, waiting for running jobs");
        try {
            taskScheduler.shutdown();
        } finally {
            terminated.countDown();
        }
        log.info("Scheduler engine stopped");
    }

    private void awaitTermination() {
        try {
            terminated.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the scheduler engine to stop");
        }
    }

    @Override
    public List<RegisteredJob> getRegisteredJobs() {
        return registrations.values().stream()
                .map(Registration::snapshot)
                .sorted(Comparator.comparing(RegisteredJob::getName, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    private Registration lookup(String id) {
        var registration = registrations.get(id);
        if (registration == null) {
            throw new IllegalArgumentException("No job registered with id " + id);
        }
        return registration;
    }

    private void checkNotShutdown() {
        if (shutdown) {
            throw new IllegalStateException("Scheduler engine is shut down");
        }
    }

    private void runOnce(String name, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Job \"{}\" raised an exception", name, e);
        }
    }

    private final class Registration {

        private final String id;
        private final AtomicBoolean running = new AtomicBoolean(false);

        private volatile String name;
        private volatile Runnable callback;
        private volatile String cron;
        private volatile CronExpression expression;
        private volatile ZoneId zone;
        private volatile boolean paused;

        private ScheduledFuture<?> future;

        private Registration(String id, String name, Runnable callback) {
            this.id = id;
            this.name = name;
            this.callback = callback;
        }

        private void setSchedule(JobSchedule schedule) {
            var cronExpression = schedule.toCronExpression();
            this.expression = CronExpression.parse(cronExpression);
            this.cron = cronExpression;
            this.zone = schedule.zoneOr(defaultZone);
        }

        private void arm() {
            future = taskScheduler.schedule(this::fire, new CronTrigger(cron, zone));
            if (future == null) {
                log.warn("Job {} ({}) has no future fire time for '{}'", id, name, cron);
            }
        }

        private void disarm() {
            if (future != null) {
                future.cancel(false);
                future = null;
            }
        }

        private void fire() {
            if (!running.compareAndSet(false, true)) {
                log.warn("Execution of job \"{}\" skipped: maximum number of running instances reached (1)", name);
                return;
            }
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("Job \"{}\" raised an exception", name, e);
            } finally {
                running.set(false);
            }
        }

        private RegisteredJob snapshot() {
            var isPaused = paused;
            var currentZone = zone;
            return RegisteredJob.builder()
                    .id(id)
                    .name(name)
                    .cronExpression(cron)
                    .zone(currentZone)
                    .paused(isPaused)
                    .nextFireTime(isPaused ? null : expression.next(ZonedDateTime.now(currentZone)))
                    .build();
        }
    }
}

package com.example.jobscheduler.service;

import com.example.jobscheduler.service.reconciliation.ReconciliationController;
import com.example.jobscheduler.service.recovery.ZombieRecoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

/**
 * Starts the scheduler once the application context is ready.
 * <p>
 * Fails leftover RUNNING executions, then runs the control loop on the main
 * thread until it is stopped. Closing the context (SIGTERM) stops the loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "job-scheduler", name = "runner-enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerRunner implements ApplicationRunner, ApplicationListener<ContextClosedEvent> {

    private final ZombieRecoveryService zombieRecoveryService;
    private final ReconciliationController controller;

    @Override
    public void run(ApplicationArguments args) {
        zombieRecoveryService.recover();

        log.info("Starting scheduler");
        controller.run();
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        controller.stop();
    }
}

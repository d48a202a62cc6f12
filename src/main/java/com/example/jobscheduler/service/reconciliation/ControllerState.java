package com.example.jobscheduler.service.reconciliation;

/**
 * Lifecycle of the reconciliation controller:
 * STOPPED, then RUNNING while polling, DRAINING while the engine shuts down,
 * and STOPPED again.
 */
public enum ControllerState {
    STOPPED,
    RUNNING,
    DRAINING
}

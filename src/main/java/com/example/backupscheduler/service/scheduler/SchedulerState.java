package com.example.backupscheduler.service.scheduler;

/**
 * Lifecycle of the scheduler loop: STOPPED, STARTING, RUNNING, STOPPING, back to STOPPED
 */
public enum SchedulerState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING
}

package com.example.backupscheduler.exception;

/**
 * The scheduler loop could not be started
 */
public class SchedulerStartException extends RuntimeException {

    public SchedulerStartException(String message, Throwable cause) {
        super(message, cause);
    }
}

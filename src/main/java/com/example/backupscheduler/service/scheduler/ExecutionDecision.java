package com.example.backupscheduler.service.scheduler;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of evaluating one schedule at one instant
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExecutionDecision {

    public static final String REASON_DISABLED = "disabled";
    public static final String REASON_NOT_YET_TIME = "not yet time";
    public static final String REASON_RESOURCE_NOT_RUNNING = "resource not running";
    public static final String REASON_READY = "ready for backup";
    public static final String REASON_STATE_UNAVAILABLE_PREFIX = "resource state unavailable: ";

    private final boolean execute;
    private final String reason;

    public static ExecutionDecision ready() {
        return new ExecutionDecision(true, REASON_READY);
    }

    public static ExecutionDecision skip(String reason) {
        return new ExecutionDecision(false, reason);
    }
}

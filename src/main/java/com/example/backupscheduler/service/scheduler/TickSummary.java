package com.example.backupscheduler.service.scheduler;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What one scheduler tick did
 */
@Value
@Builder
public class TickSummary {

    Instant tickAt;
    int due;
    int executed;
    int skipped;

    /**
     * Schedules whose processing failed with an error that could not even be recorded as a skip
     */
    int failed;

    /**
     * Schedules left untouched because stop was requested mid-tick
     */
    int notStarted;
}

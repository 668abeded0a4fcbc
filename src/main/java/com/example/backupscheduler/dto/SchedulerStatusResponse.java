package com.example.backupscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Scheduler status: loop state, stored schedule counts and the next due backup
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatusResponse {

    private boolean running;
    private String state;
    private long totalSchedules;
    private long enabledSchedules;
    private int cacheSize;

    /**
     * Earliest due marker among enabled schedules, null when none is enabled
     */
    private Instant nextExecutionAt;
    private Instant lastTickAt;
    private long tickIntervalMs;
}

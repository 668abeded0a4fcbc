package com.example.backupscheduler.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for monitoring backup scheduler health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Schedule counts (from the schedule cache)
 * - Executed and skipped schedule attempts
 * - Tick duration
 * - Storage retries and retention deletions
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    private final AtomicLong totalSchedules = new AtomicLong(0);
    private final AtomicLong enabledSchedules = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("backup_scheduler_schedules", totalSchedules, AtomicLong::get)
                .tag("scope", "all")
                .description("Number of cached backup schedules")
                .register(meterRegistry);

        Gauge.builder("backup_scheduler_schedules", enabledSchedules, AtomicLong::get)
                .tag("scope", "enabled")
                .description("Number of cached backup schedules")
                .register(meterRegistry);
    }

    /**
     * Refresh schedule gauges after the cache was (re)loaded
     */
    public void updateScheduleGauges(long total, long enabled) {
        totalSchedules.set(total);
        enabledSchedules.set(enabled);
    }

    public Timer.Sample startTickTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTick(Timer.Sample sample, boolean success) {
        sample.stop(Timer.builder("backup_scheduler_tick_time")
                .tag("success", String.valueOf(success))
                .description("Scheduler tick duration")
                .register(meterRegistry));
    }

    public void recordExecuted() {
        meterRegistry.counter("backup_scheduler_executed").increment();
    }

    /**
     * Record a skipped attempt, tagged with a short reason category
     */
    public void recordSkipped(String reason) {
        meterRegistry.counter("backup_scheduler_skipped",
                "reason", reason != null ? reason : "unknown"
        ).increment();
    }

    public void recordStorageRetry(String operation, int attemptNumber) {
        meterRegistry.counter("backup_scheduler_storage_retries",
                "operation", operation,
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordStorageRetriesExhausted(String operation) {
        meterRegistry.counter("backup_scheduler_storage_retries_exhausted",
                "operation", operation
        ).increment();
    }

    public void recordRetentionDeleted(int deleted, int failed) {
        meterRegistry.counter("backup_scheduler_retention_deleted").increment(deleted);
        if (failed > 0) {
            meterRegistry.counter("backup_scheduler_retention_failures").increment(failed);
        }
    }
}

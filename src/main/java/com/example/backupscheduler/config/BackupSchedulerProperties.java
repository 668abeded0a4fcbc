package com.example.backupscheduler.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the backup scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "backup-scheduler")
public class BackupSchedulerProperties {

    /**
     * Interval in milliseconds between two scheduler ticks
     */
    @Min(1000)
    private long tickIntervalMs = 600_000;

    /**
     * Delay before the next tick after a tick failed unexpectedly (capped by the tick interval)
     */
    @Min(1000)
    private long errorRetryDelayMs = 60_000;

    /**
     * Start the scheduler loop together with the application context
     */
    private boolean autoStart = true;

    /**
     * Total attempts of a storage unit-of-work before giving up
     */
    @Min(1)
    private int storageMaxRetries = 3;

    /**
     * Base delay of the exponential backoff between storage attempts
     */
    @Min(0)
    private long storageBackoffBaseMs = 100;

    /**
     * Upper bound for a single resource-state or catalog call made by the loop
     */
    @Min(1)
    private int collaboratorTimeoutSeconds = 30;

    /**
     * Upper bound for a single backup creation call made by the loop
     */
    @Min(1)
    private int backupTimeoutMinutes = 30;

    /**
     * How long stop() waits for an in-flight tick before cancelling it
     */
    @Min(1)
    private int stopTimeoutSeconds = 30;

    /**
     * Threads available for collaborator calls issued by the loop
     */
    @Min(1)
    private int collaboratorPoolSize = 4;

    /**
     * Maximum time a tick lock is held if the holding instance dies
     */
    @Min(1)
    private int tickLockAtMostForMinutes = 60;

    public Duration storageBackoffBase() {
        return Duration.ofMillis(storageBackoffBaseMs);
    }
}

package com.example.backupscheduler.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for schedule data.
 * Immutable, so the schedule cache can hand out the same instance to any thread.
 */
@Value
@Builder(toBuilder = true)
public class BackupScheduleResponse {

    UUID id;
    String resourceId;
    Integer intervalHours;
    Integer maxBackups;
    boolean enabled;
    boolean onlyWhenActive;
    Instant lastTriggeredAt;
    Instant nextTriggerAt;
    Instant createdAt;
    Instant updatedAt;
}

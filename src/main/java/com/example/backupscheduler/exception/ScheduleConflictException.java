package com.example.backupscheduler.exception;

import lombok.Getter;

/**
 * Exception for a second schedule on the same resource
 */
@Getter
public class ScheduleConflictException extends RuntimeException {

    private final String resourceId;

    public ScheduleConflictException(String resourceId) {
        super(String.format("Resource %s already has a backup schedule", resourceId));
        this.resourceId = resourceId;
    }

    public ScheduleConflictException(String resourceId, Throwable cause) {
        super(String.format("Resource %s already has a backup schedule", resourceId), cause);
        this.resourceId = resourceId;
    }
}

package com.example.backupscheduler.exception;

import lombok.Getter;

/**
 * Exception for a resource without a backup schedule
 */
@Getter
public class ScheduleNotFoundException extends RuntimeException {

    private final String resourceId;

    public ScheduleNotFoundException(String resourceId) {
        super("Backup schedule not found for resource: " + resourceId);
        this.resourceId = resourceId;
    }
}

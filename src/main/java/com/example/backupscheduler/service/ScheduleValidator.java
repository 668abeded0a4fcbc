package com.example.backupscheduler.service;

import com.example.backupscheduler.domain.entity.BackupSchedule;
import com.example.backupscheduler.dto.CreateScheduleRequest;
import com.example.backupscheduler.dto.UpdateScheduleRequest;
import com.example.backupscheduler.exception.ScheduleValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounds checks for schedule settings, applied before anything is read from or written to storage.
 * Request bean validation covers the HTTP path; this covers every caller of the service.
 */
@Component
public class ScheduleValidator {

    public static final int MAX_EVENT_PAGE_SIZE = 100;

    public void validateResourceId(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new ScheduleValidationException(List.of("resourceId: is required"));
        }
        if (resourceId.length() > 100) {
            throw new ScheduleValidationException(List.of("resourceId: must be at most 100 characters"));
        }
    }

    public void validateCreate(CreateScheduleRequest request) {
        if (request == null) {
            throw new ScheduleValidationException(List.of("request: is required"));
        }
        var errors = new ArrayList<String>();
        if (request.getIntervalHours() == null) {
            errors.add("intervalHours: is required");
        } else {
            checkInterval(request.getIntervalHours(), errors);
        }
        if (request.getMaxBackups() == null) {
            errors.add("maxBackups: is required");
        } else {
            checkMaxBackups(request.getMaxBackups(), errors);
        }
        throwIfAny(errors);
    }

    public void validateUpdate(UpdateScheduleRequest request) {
        if (request == null) {
            throw new ScheduleValidationException(List.of("request: is required"));
        }
        var errors = new ArrayList<String>();
        if (request.getIntervalHours() != null) {
            checkInterval(request.getIntervalHours(), errors);
        }
        if (request.getMaxBackups() != null) {
            checkMaxBackups(request.getMaxBackups(), errors);
        }
        throwIfAny(errors);
    }

    public void validatePage(int page, int size) {
        var errors = new ArrayList<String>();
        if (page < 0) {
            errors.add("page: must be greater than or equal to 0");
        }
        if (size < 1 || size > MAX_EVENT_PAGE_SIZE) {
            errors.add("size: must be between 1 and " + MAX_EVENT_PAGE_SIZE);
        }
        throwIfAny(errors);
    }

    private void checkInterval(int intervalHours, List<String> errors) {
        if (intervalHours < BackupSchedule.MIN_INTERVAL_HOURS || intervalHours > BackupSchedule.MAX_INTERVAL_HOURS) {
            errors.add(String.format("intervalHours: must be between %d and %d", BackupSchedule.MIN_INTERVAL_HOURS, BackupSchedule.MAX_INTERVAL_HOURS));
        }
    }

    private void checkMaxBackups(int maxBackups, List<String> errors) {
        if (maxBackups < BackupSchedule.MIN_MAX_BACKUPS || maxBackups > BackupSchedule.MAX_MAX_BACKUPS) {
            errors.add(String.format("maxBackups: must be between %d and %d", BackupSchedule.MIN_MAX_BACKUPS, BackupSchedule.MAX_MAX_BACKUPS));
        }
    }

    private void throwIfAny(List<String> errors) {
        if (!errors.isEmpty()) {
            throw new ScheduleValidationException(errors);
        }
    }
}

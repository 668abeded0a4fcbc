package com.example.backupscheduler.exception;

import lombok.Getter;

import java.util.List;

/**
 * Exception for schedule settings outside their allowed bounds.
 * Carries one "field: message" entry per offending field.
 */
@Getter
public class ScheduleValidationException extends RuntimeException {

    private final List<String> errors;

    public ScheduleValidationException(List<String> errors) {
        super("Invalid backup schedule: " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }
}

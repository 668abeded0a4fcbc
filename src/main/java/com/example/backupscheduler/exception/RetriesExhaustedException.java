package com.example.backupscheduler.exception;

import lombok.Getter;

/**
 * Exception for a storage operation that kept failing transiently until no attempts were left
 */
@Getter
public class RetriesExhaustedException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public RetriesExhaustedException(String operation, int attempts, Throwable lastError) {
        super(String.format("Storage operation '%s' failed after %d attempts: %s", operation, attempts,
                lastError != null ? lastError.getMessage() : "unknown error"), lastError);
        this.operation = operation;
        this.attempts = attempts;
    }
}

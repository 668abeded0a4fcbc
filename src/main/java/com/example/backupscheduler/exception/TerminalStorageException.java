package com.example.backupscheduler.exception;

import lombok.Getter;

/**
 * Permanent storage failure, such as a constraint violation. Never retried.
 */
@Getter
public class TerminalStorageException extends RuntimeException {

    private final String operation;

    public TerminalStorageException(String operation, Throwable cause) {
        super(String.format("Storage operation '%s' failed: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }
}

package com.example.backupscheduler.exception;

/**
 * Transient storage failure that is safe to retry in a fresh transaction.
 * Thrown by code that detects such a condition itself; driver and Spring
 * exceptions of the same nature are recognised by the storage error classifier.
 */
public class RetryableStorageException extends RuntimeException {

    public RetryableStorageException(String message) {
        super(message);
    }

    public RetryableStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.example.backupscheduler.exception;

import lombok.Getter;

/**
 * Exception for a managed server that does not exist
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceId;

    public ResourceNotFoundException(String resourceId) {
        super("Resource not found: " + resourceId);
        this.resourceId = resourceId;
    }
}

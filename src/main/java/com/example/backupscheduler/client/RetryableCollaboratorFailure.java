package com.example.backupscheduler.client;

import com.example.backupscheduler.exception.ExternalCollaboratorException;

import java.util.function.Predicate;

/**
 * Resilience4j retry predicate: only collaborator failures flagged retryable
 * (timeouts, connection errors, 5xx, 408, 429) are attempted again.
 */
public class RetryableCollaboratorFailure implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof ExternalCollaboratorException e) {
            return e.isRetryable();
        }
        return false;
    }
}

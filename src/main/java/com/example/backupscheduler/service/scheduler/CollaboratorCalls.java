package com.example.backupscheduler.service.scheduler;

import com.example.backupscheduler.exception.ExternalCollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs collaborator calls of the scheduler loop on the collaborator pool and
 * waits for them with an upper bound.
 * <p>
 * A call that outlives its timeout, or whose waiting thread is interrupted,
 * is cancelled with interruption and reported as {@link ExternalCollaboratorException}.
 */
@Slf4j
@Component
public class CollaboratorCalls {

    private final ExecutorService collaboratorExecutor;

    public CollaboratorCalls(@Qualifier("collaboratorExecutor") ExecutorService collaboratorExecutor) {
        this.collaboratorExecutor = collaboratorExecutor;
    }

    public <T> T call(String serviceName, String description, Supplier<T> call, Duration timeout) {
        Future<T> future;
        try {
            future = collaboratorExecutor.submit(call::get);
        } catch (RejectedExecutionException e) {
            throw new ExternalCollaboratorException(serviceName, "Could not dispatch " + description, e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {}s", description, timeout.toSeconds());
            throw new ExternalCollaboratorException(serviceName, description + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalCollaboratorException(serviceName, description + " was interrupted", e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new ExternalCollaboratorException(serviceName, description + " failed", cause != null ? cause : e);
        }
    }
}

package com.example.backupscheduler.service.storage;

import com.example.backupscheduler.config.BackupSchedulerProperties;
import com.example.backupscheduler.config.MetricsConfig;
import com.example.backupscheduler.exception.RetriesExhaustedException;
import com.example.backupscheduler.exception.TerminalStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.function.Function;

/**
 * Runs a storage read-modify-write as one transaction and retries it on
 * transient storage failures.
 * <p>
 * Each attempt gets a fresh transaction: the operation must re-read whatever
 * it modifies instead of reusing entities loaded by an earlier attempt.
 * <ul>
 *     <li>retryable storage error: rollback, back off {@code base * 2^attempt}, try again</li>
 *     <li>terminal storage error: rollback, {@link TerminalStorageException}</li>
 *     <li>any other exception: rollback, rethrown unchanged</li>
 *     <li>attempts used up: {@link RetriesExhaustedException}</li>
 * </ul>
 * Called while a transaction is already open on the thread, the operation joins
 * it, runs once and lets every exception through so the outermost runner
 * decides about retries.
 */
@Slf4j
@Component
public class TransactionRunner {

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final BackupSchedulerProperties properties;
    private final MetricsConfig metrics;

    public TransactionRunner(PlatformTransactionManager transactionManager, BackupSchedulerProperties properties, MetricsConfig metrics) {
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);

        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.readTemplate.setReadOnly(true);

        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Run a writing operation with the configured retry policy
     */
    public <T> T runInTransaction(String operationName, Function<TransactionStatus, T> operation) {
        return runInTransaction(operationName, operation, properties.getStorageMaxRetries(), properties.storageBackoffBase());
    }

    public <T> T runInTransaction(String operationName, Function<TransactionStatus, T> operation, int maxRetries, Duration backoffBase) {
        return execute(writeTemplate, operationName, operation, maxRetries, backoffBase);
    }

    /**
     * Run a read-only operation with the configured retry policy
     */
    public <T> T readInTransaction(String operationName, Function<TransactionStatus, T> operation) {
        return execute(readTemplate, operationName, operation, properties.getStorageMaxRetries(), properties.storageBackoffBase());
    }

    private <T> T execute(TransactionTemplate template, String operationName, Function<TransactionStatus, T> operation,
                          int maxRetries, Duration backoffBase) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, was " + maxRetries);
        }

        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            log.debug("Storage operation '{}' joins the surrounding transaction", operationName);
            return template.execute(operation::apply);
        }

        RuntimeException lastError = null;
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                return template.execute(operation::apply);
            } catch (RuntimeException e) {
                var classification = StorageErrorClassifier.classify(e);

                if (classification == StorageErrorClassifier.Classification.NOT_STORAGE) {
                    throw e;
                }

                if (classification == StorageErrorClassifier.Classification.TERMINAL) {
                    log.error("Storage operation '{}' failed with non-retryable error, rolled back: {}", operationName, e.getMessage());
                    throw new TerminalStorageException(operationName, e);
                }

                lastError = e;
                metrics.recordStorageRetry(operationName, attempt + 1);
                log.warn("Storage operation '{}' rolled back after retryable error on attempt {}/{}: {}",
                        operationName, attempt + 1, maxRetries, e.getMessage());

                if (attempt < maxRetries - 1) {
                    backOff(operationName, backoffBase.multipliedBy(1L << attempt), attempt + 1, e);
                }
            }
        }

        metrics.recordStorageRetriesExhausted(operationName);
        log.error("Storage operation '{}' gave up after {} attempts", operationName, maxRetries);
        throw new RetriesExhaustedException(operationName, maxRetries, lastError);
    }

    private void backOff(String operationName, Duration delay, int attemptsSoFar, RuntimeException lastError) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetriesExhaustedException(operationName, attemptsSoFar, lastError);
        }
    }
}

package com.example.backupscheduler.service.storage;

import com.example.backupscheduler.exception.RetryableStorageException;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.PessimisticLockException;
import jakarta.persistence.QueryTimeoutException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionSystemException;

/**
 * Splits failures of a storage unit-of-work into retryable, terminal and
 * non-storage errors.
 * <p>
 * Retryable: lock and deadlock failures, query timeouts, optimistic locking
 * conflicts, lost or unavailable connections.
 * Terminal: constraint violations and every other data access failure.
 */
public final class StorageErrorClassifier {

    public enum Classification {
        RETRYABLE,
        TERMINAL,
        NOT_STORAGE
    }

    private StorageErrorClassifier() {
    }

    public static Classification classify(Throwable error) {
        if (error == null) {
            return Classification.NOT_STORAGE;
        }
        if (error instanceof RetryableStorageException) {
            return Classification.RETRYABLE;
        }
        // integrity violations are never transient, whatever the driver reports
        if (error instanceof DataIntegrityViolationException) {
            return Classification.TERMINAL;
        }
        if (error instanceof TransientDataAccessException
                || error instanceof RecoverableDataAccessException
                || error instanceof DataAccessResourceFailureException
                || error instanceof CannotCreateTransactionException
                || error instanceof OptimisticLockException
                || error instanceof PessimisticLockException
                || error instanceof LockTimeoutException
                || error instanceof QueryTimeoutException) {
            return Classification.RETRYABLE;
        }
        if (error instanceof DataAccessException
                || error instanceof TransactionSystemException
                || error instanceof PersistenceException) {
            return Classification.TERMINAL;
        }
        return Classification.NOT_STORAGE;
    }

    public static boolean isConstraintViolation(Throwable error) {
        var current = error;
        while (current != null) {
            if (current instanceof DataIntegrityViolationException
                    || current instanceof org.hibernate.exception.ConstraintViolationException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}

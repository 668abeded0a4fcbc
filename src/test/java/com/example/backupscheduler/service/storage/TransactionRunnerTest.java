package com.example.backupscheduler.service.storage;

import com.example.backupscheduler.config.BackupSchedulerProperties;
import com.example.backupscheduler.config.MetricsConfig;
import com.example.backupscheduler.exception.RetriesExhaustedException;
import com.example.backupscheduler.exception.TerminalStorageException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TransactionRunner Tests")
class TransactionRunnerTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    private SimpleMeterRegistry meterRegistry;
    private TransactionRunner transactionRunner;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        var properties = new BackupSchedulerProperties();
        properties.setStorageBackoffBaseMs(0);

        lenient().when(transactionManager.getTransaction(any())).thenAnswer(invocation -> new SimpleTransactionStatus());

        transactionRunner = new TransactionRunner(transactionManager, properties, new MetricsConfig(meterRegistry));
    }

    @Nested
    @DisplayName("Retry Tests")
    class RetryTests {

        @Test
        @DisplayName("Should commit once on first success")
        void shouldCommitOnFirstSuccess() {
            var result = transactionRunner.runInTransaction("op", status -> "done", 3, Duration.ZERO);

            assertThat(result).isEqualTo("done");
            verify(transactionManager, times(1)).commit(any());
            verify(transactionManager, never()).rollback(any());
        }

        @Test
        @DisplayName("Should roll back and retry transient failures until success")
        void shouldRetryTransientFailures() {
            // Given
            var attempts = new AtomicInteger();

            // When
            var result = transactionRunner.runInTransaction("op", status -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new CannotAcquireLockException("deadlock detected");
                }
                return attempts.get();
            }, 3, Duration.ZERO);

            // Then
            assertThat(result).isEqualTo(3);
            verify(transactionManager, times(2)).rollback(any());
            verify(transactionManager, times(1)).commit(any());
            assertThat(meterRegistry.find("backup_scheduler_storage_retries").counters()).hasSize(2);
        }

        @Test
        @DisplayName("Should give up after max attempts")
        void shouldGiveUpAfterMaxAttempts() {
            // Given
            var attempts = new AtomicInteger();

            // When / Then
            assertThatThrownBy(() -> transactionRunner.runInTransaction("recordScheduledBackup", status -> {
                attempts.incrementAndGet();
                throw new CannotAcquireLockException("deadlock detected");
            }, 3, Duration.ZERO))
                    .isInstanceOf(RetriesExhaustedException.class)
                    .hasMessageContaining("recordScheduledBackup")
                    .satisfies(e -> assertThat(((RetriesExhaustedException) e).getAttempts()).isEqualTo(3));

            assertThat(attempts).hasValue(3);
            verify(transactionManager, times(3)).rollback(any());
            verify(transactionManager, never()).commit(any());
            assertThat(meterRegistry.counter("backup_scheduler_storage_retries_exhausted", "operation", "recordScheduledBackup").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should wait between attempts with exponential backoff")
        void shouldBackOffBetweenAttempts() {
            var attempts = new AtomicInteger();
            var started = System.nanoTime();

            assertThatThrownBy(() -> transactionRunner.runInTransaction("op", status -> {
                attempts.incrementAndGet();
                throw new CannotAcquireLockException("busy");
            }, 3, Duration.ofMillis(20)))
                    .isInstanceOf(RetriesExhaustedException.class);

            // 20ms + 40ms, no wait after the last attempt
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(60));
            assertThat(attempts).hasValue(3);
        }
    }

    @Nested
    @DisplayName("Non Retryable Tests")
    class NonRetryableTests {

        @Test
        @DisplayName("Should not retry constraint violations")
        void shouldNotRetryConstraintViolations() {
            var attempts = new AtomicInteger();

            assertThatThrownBy(() -> transactionRunner.runInTransaction("createSchedule", status -> {
                attempts.incrementAndGet();
                throw new DataIntegrityViolationException("duplicate key");
            }, 3, Duration.ZERO))
                    .isInstanceOf(TerminalStorageException.class)
                    .hasCauseInstanceOf(DataIntegrityViolationException.class);

            assertThat(attempts).hasValue(1);
            verify(transactionManager, times(1)).rollback(any());
        }

        @Test
        @DisplayName("Should rethrow non storage errors unchanged after rollback")
        void shouldRethrowNonStorageErrors() {
            var attempts = new AtomicInteger();

            assertThatThrownBy(() -> transactionRunner.runInTransaction("op", status -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("domain failure");
            }, 3, Duration.ZERO))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("domain failure");

            assertThat(attempts).hasValue(1);
            verify(transactionManager).rollback(any());
        }

        @Test
        @DisplayName("Should reject fewer than one attempt")
        void shouldRejectInvalidMaxRetries() {
            assertThatThrownBy(() -> transactionRunner.runInTransaction("op", status -> "x", 0, Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}

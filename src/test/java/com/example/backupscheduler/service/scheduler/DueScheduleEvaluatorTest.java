package com.example.backupscheduler.service.scheduler;

import com.example.backupscheduler.domain.entity.BackupSchedule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DueScheduleEvaluator Tests")
class DueScheduleEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final DueScheduleEvaluator evaluator = new DueScheduleEvaluator();

    private BackupSchedule schedule(boolean enabled, Instant nextTriggerAt, boolean onlyWhenActive) {
        return BackupSchedule.builder()
                .resourceId("srv-1")
                .intervalHours(6)
                .maxBackups(5)
                .enabled(enabled)
                .onlyWhenActive(onlyWhenActive)
                .nextTriggerAt(nextTriggerAt)
                .build();
    }

    private static Predicate<String> failIfCalled() {
        return resourceId -> {
            throw new AssertionError("server state must not be looked up");
        };
    }

    @Nested
    @DisplayName("Skip Tests")
    class SkipTests {

        @Test
        @DisplayName("Disabled schedule should be skipped before anything else")
        void disabledScheduleShouldBeSkipped() {
            var decision = evaluator.shouldExecute(schedule(false, NOW.minusSeconds(60), true), NOW, failIfCalled());

            assertThat(decision.isExecute()).isFalse();
            assertThat(decision.getReason()).isEqualTo(ExecutionDecision.REASON_DISABLED);
        }

        @Test
        @DisplayName("Schedule due in the future should not run yet")
        void futureScheduleShouldNotRun() {
            var decision = evaluator.shouldExecute(schedule(true, NOW.plus(Duration.ofMinutes(1)), true), NOW, failIfCalled());

            assertThat(decision.isExecute()).isFalse();
            assertThat(decision.getReason()).isEqualTo("not yet time");
        }

        @Test
        @DisplayName("Schedule without due marker should not run")
        void scheduleWithoutDueMarkerShouldNotRun() {
            var decision = evaluator.shouldExecute(schedule(true, null, false), NOW, failIfCalled());

            assertThat(decision.getReason()).isEqualTo(ExecutionDecision.REASON_NOT_YET_TIME);
        }

        @Test
        @DisplayName("Stopped server should be skipped when restricted to running servers")
        void stoppedServerShouldBeSkipped() {
            var decision = evaluator.shouldExecute(schedule(true, NOW, true), NOW, resourceId -> false);

            assertThat(decision.isExecute()).isFalse();
            assertThat(decision.getReason()).isEqualTo("resource not running");
        }

        @Test
        @DisplayName("Failed state lookup should be reported as skip reason")
        void failedStateLookupShouldBeSkipReason() {
            var decision = evaluator.shouldExecute(schedule(true, NOW, true), NOW, resourceId -> {
                throw new IllegalStateException("connection refused");
            });

            assertThat(decision.isExecute()).isFalse();
            assertThat(decision.getReason()).isEqualTo("resource state unavailable: connection refused");
        }
    }

    @Nested
    @DisplayName("Ready Tests")
    class ReadyTests {

        @Test
        @DisplayName("Due schedule of running server should be ready")
        void dueScheduleOfRunningServerShouldBeReady() {
            var lookups = new AtomicInteger();

            var decision = evaluator.shouldExecute(schedule(true, NOW.minusSeconds(1), true), NOW, resourceId -> {
                lookups.incrementAndGet();
                return true;
            });

            assertThat(decision.isExecute()).isTrue();
            assertThat(decision.getReason()).isEqualTo("ready for backup");
            assertThat(lookups).hasValue(1);
        }

        @Test
        @DisplayName("Unrestricted schedule should be ready without state lookup")
        void unrestrictedScheduleShouldSkipLookup() {
            var decision = evaluator.shouldExecute(schedule(true, NOW, false), NOW, failIfCalled());

            assertThat(decision.isExecute()).isTrue();
        }
    }
}

package com.example.backupscheduler.domain.entity;

import com.example.backupscheduler.domain.enums.ScheduleAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScheduleEvent Entity Tests")
class ScheduleEventTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    @DisplayName("Lifecycle event should carry configs and actor")
    void lifecycleEventShouldCarryConfigsAndActor() {
        var event = ScheduleEvent.lifecycle("srv-1", ScheduleAction.UPDATED, "Schedule updated",
                Map.of("intervalHours", 6), Map.of("intervalHours", 12), 42L, NOW);

        assertThat(event.getResourceId()).isEqualTo("srv-1");
        assertThat(event.getAction()).isEqualTo(ScheduleAction.UPDATED);
        assertThat(event.getOldConfig()).containsEntry("intervalHours", 6);
        assertThat(event.getNewConfig()).containsEntry("intervalHours", 12);
        assertThat(event.getActorUserId()).isEqualTo(42L);
        assertThat(event.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Attempt event should have no configs and no actor")
    void attemptEventShouldHaveNoActor() {
        var event = ScheduleEvent.attempt("srv-1", ScheduleAction.SKIPPED, "resource not running", NOW);

        assertThat(event.getReason()).isEqualTo("resource not running");
        assertThat(event.getOldConfig()).isNull();
        assertThat(event.getNewConfig()).isNull();
        assertThat(event.getActorUserId()).isNull();
    }

    @Test
    @DisplayName("Should truncate overly long reasons")
    void shouldTruncateLongReasons() {
        var reason = "x".repeat(400);

        var event = ScheduleEvent.attempt("srv-1", ScheduleAction.SKIPPED, reason, NOW);

        assertThat(event.getReason()).hasSize(ScheduleEvent.MAX_REASON_LENGTH).endsWith("...");
        assertThat(ScheduleEvent.truncateReason("short")).isEqualTo("short");
        assertThat(ScheduleEvent.truncateReason(null)).isNull();
    }

    @Test
    @DisplayName("Factories should reject actions of the other kind")
    void factoriesShouldRejectMismatchedActions() {
        assertThatThrownBy(() -> ScheduleEvent.attempt("srv-1", ScheduleAction.DELETED, "Schedule deleted", NOW))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DELETED");

        assertThatThrownBy(() -> ScheduleEvent.lifecycle("srv-1", ScheduleAction.EXECUTED, "Backup created", null, null, null, NOW))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("EXECUTED");
    }

    @Test
    @DisplayName("Should refuse to persist an event without timestamp")
    void shouldRefuseEventWithoutTimestamp() {
        var event = ScheduleEvent.attempt("srv-1", ScheduleAction.SKIPPED, "resource not running", null);

        assertThatThrownBy(event::onCreate).isInstanceOf(IllegalStateException.class);
    }
}

package com.example.backupscheduler.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ScheduleAction Enum Tests")
class ScheduleActionTest {

    @Test
    @DisplayName("Attempt actions should be identified correctly")
    void attemptActionsShouldBeIdentified() {
        assertThat(ScheduleAction.EXECUTED.isAttempt()).isTrue();
        assertThat(ScheduleAction.SKIPPED.isAttempt()).isTrue();

        assertThat(ScheduleAction.CREATED.isAttempt()).isFalse();
        assertThat(ScheduleAction.UPDATED.isAttempt()).isFalse();
        assertThat(ScheduleAction.DELETED.isAttempt()).isFalse();
    }
}

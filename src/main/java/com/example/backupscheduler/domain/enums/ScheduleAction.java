package com.example.backupscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Action recorded by a schedule event.
 * Lifecycle actions come from API calls, attempt actions from the scheduler loop.
 */
@Getter
@RequiredArgsConstructor
public enum ScheduleAction {

    CREATED(false),
    UPDATED(false),
    DELETED(false),

    /**
     * The loop created a backup for a due schedule
     */
    EXECUTED(true),

    /**
     * The loop looked at a due schedule but did not create a backup
     */
    SKIPPED(true);

    /**
     * Whether the action is written by the scheduler loop rather than by a user request
     */
    private final boolean attempt;
}

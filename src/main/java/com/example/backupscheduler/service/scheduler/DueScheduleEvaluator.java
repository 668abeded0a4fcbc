package com.example.backupscheduler.service.scheduler;

import com.example.backupscheduler.domain.entity.BackupSchedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.function.Predicate;

/**
 * Decides whether a schedule should produce a backup now.
 * <p>
 * Checks in order, first match wins: disabled, not yet due, server not
 * running (only for schedules restricted to running servers), ready.
 * Has no side effects apart from the server state lookup.
 */
@Slf4j
@Component
public class DueScheduleEvaluator {

    public ExecutionDecision shouldExecute(BackupSchedule schedule, Instant now, Predicate<String> isResourceActive) {
        if (!schedule.isEnabled()) {
            return ExecutionDecision.skip(ExecutionDecision.REASON_DISABLED);
        }

        var nextTriggerAt = schedule.getNextTriggerAt();
        if (nextTriggerAt == null || nextTriggerAt.isAfter(now)) {
            return ExecutionDecision.skip(ExecutionDecision.REASON_NOT_YET_TIME);
        }

        if (schedule.isOnlyWhenActive()) {
            boolean active;
            try {
                active = isResourceActive.test(schedule.getResourceId());
            } catch (RuntimeException e) {
                log.warn("Could not determine state of server {}: {}", schedule.getResourceId(), e.getMessage());
                return ExecutionDecision.skip(ExecutionDecision.REASON_STATE_UNAVAILABLE_PREFIX + e.getMessage());
            }
            if (!active) {
                return ExecutionDecision.skip(ExecutionDecision.REASON_RESOURCE_NOT_RUNNING);
            }
        }

        return ExecutionDecision.ready();
    }
}

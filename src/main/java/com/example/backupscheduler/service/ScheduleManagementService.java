package com.example.backupscheduler.service;

import com.example.backupscheduler.client.ResourceStateClient;
import com.example.backupscheduler.config.BackupSchedulerProperties;
import com.example.backupscheduler.domain.entity.BackupSchedule;
import com.example.backupscheduler.domain.entity.ScheduleEvent;
import com.example.backupscheduler.domain.enums.ScheduleAction;
import com.example.backupscheduler.dto.BackupScheduleResponse;
import com.example.backupscheduler.dto.CreateScheduleRequest;
import com.example.backupscheduler.dto.ScheduleEventResponse;
import com.example.backupscheduler.dto.SchedulerStatusResponse;
import com.example.backupscheduler.dto.UpdateScheduleRequest;
import com.example.backupscheduler.event.ResourceDeletedEvent;
import com.example.backupscheduler.exception.ResourceNotFoundException;
import com.example.backupscheduler.exception.ScheduleConflictException;
import com.example.backupscheduler.exception.ScheduleNotFoundException;
import com.example.backupscheduler.mapper.ScheduleMapper;
import com.example.backupscheduler.service.audit.AuditActionPublisher;
import com.example.backupscheduler.service.scheduler.BackupSchedulerLoop;
import com.example.backupscheduler.service.scheduler.ScheduleCache;
import com.example.backupscheduler.service.storage.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Service for managing backup schedules.
 * <p>
 * Handles:
 * - Schedule CRUD with bounds validation
 * - Event history queries
 * - Scheduler status and start/stop
 * - Removal of schedules whose server was deleted
 * <p>
 * Every write goes through the {@link ScheduleStore}, so each one is a retried
 * unit-of-work that records exactly one schedule event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleManagementService {

    private final ScheduleStore scheduleStore;
    private final ScheduleCache scheduleCache;
    private final ScheduleValidator validator;
    private final ResourceStateClient resourceStateClient;
    private final AuditActionPublisher auditPublisher;
    private final BackupSchedulerLoop schedulerLoop;
    private final ScheduleMapper scheduleMapper;
    private final BackupSchedulerProperties properties;
    private final Clock clock;

    // === Schedule CRUD ===

    /**
     * Create the backup schedule of a server. The first backup is due one interval from now.
     *
     * @throws com.example.backupscheduler.exception.ScheduleValidationException if a setting is out of bounds
     * @throws ScheduleConflictException if the server already has a schedule
     * @throws ResourceNotFoundException if the server does not exist
     */
    public BackupScheduleResponse createSchedule(String resourceId, CreateScheduleRequest request, Long actorUserId) {
        validator.validateResourceId(resourceId);
        validator.validateCreate(request);

        if (scheduleStore.get(resourceId).isPresent()) {
            throw new ScheduleConflictException(resourceId);
        }
        if (!resourceStateClient.resourceExists(resourceId)) {
            throw new ResourceNotFoundException(resourceId);
        }

        var now = clock.instant();
        var intervalHours = request.getIntervalHours();
        var enabled = !Boolean.FALSE.equals(request.getEnabled());
        var onlyWhenActive = !Boolean.FALSE.equals(request.getOnlyWhenActive());

        var saved = scheduleStore.create(resourceId,
                () -> BackupSchedule.builder()
                        .resourceId(resourceId)
                        .intervalHours(intervalHours)
                        .maxBackups(request.getMaxBackups())
                        .enabled(enabled)
                        .onlyWhenActive(onlyWhenActive)
                        .nextTriggerAt(now.plus(Duration.ofHours(intervalHours)))
                        .build(),
                schedule -> ScheduleEvent.lifecycle(resourceId, ScheduleAction.CREATED, "Schedule created",
                        null, schedule.configSnapshot(), actorUserId, now));

        scheduleCache.invalidate(resourceId);
        auditPublisher.publish(actorUserId, AuditActionPublisher.SCHEDULE_CREATED, resourceId, saved.configSnapshot());

        log.info("Created backup schedule for server {}: every {}h, keep {}, first backup at {}",
                resourceId, saved.getIntervalHours(), saved.getMaxBackups(), saved.getNextTriggerAt());

        return scheduleMapper.toResponse(saved);
    }

    /**
     * Apply the provided fields. A changed interval moves the due marker to one
     * interval after the last backup, or after now if there was none.
     */
    public BackupScheduleResponse updateSchedule(String resourceId, UpdateScheduleRequest request, Long actorUserId) {
        validator.validateResourceId(resourceId);
        validator.validateUpdate(request);

        var now = clock.instant();

        var saved = scheduleStore.update(resourceId, schedule -> {
            var oldConfig = schedule.configSnapshot();

            var intervalChanged = request.getIntervalHours() != null
                    && !Objects.equals(request.getIntervalHours(), schedule.getIntervalHours());
            if (request.getIntervalHours() != null) {
                schedule.setIntervalHours(request.getIntervalHours());
            }
            if (request.getMaxBackups() != null) {
                schedule.setMaxBackups(request.getMaxBackups());
            }
            if (request.getEnabled() != null) {
                schedule.setEnabled(request.getEnabled());
            }
            if (request.getOnlyWhenActive() != null) {
                schedule.setOnlyWhenActive(request.getOnlyWhenActive());
            }
            if (intervalChanged) {
                schedule.rescheduleFrom(now);
            }

            return ScheduleEvent.lifecycle(resourceId, ScheduleAction.UPDATED, "Schedule updated",
                    oldConfig, schedule.configSnapshot(), actorUserId, now);
        });

        scheduleCache.invalidate(resourceId);
        auditPublisher.publish(actorUserId, AuditActionPublisher.SCHEDULE_UPDATED, resourceId, saved.configSnapshot());

        log.info("Updated backup schedule for server {}, next backup at {}", resourceId, saved.getNextTriggerAt());

        return scheduleMapper.toResponse(saved);
    }

    /**
     * @throws ScheduleNotFoundException if the server has no schedule
     */
    public void deleteSchedule(String resourceId, Long actorUserId) {
        validator.validateResourceId(resourceId);

        var now = clock.instant();
        var deleted = scheduleStore.delete(resourceId, schedule -> ScheduleEvent.lifecycle(resourceId, ScheduleAction.DELETED,
                "Schedule deleted", schedule.configSnapshot(), null, actorUserId, now));

        scheduleCache.invalidate(resourceId);
        auditPublisher.publish(actorUserId, AuditActionPublisher.SCHEDULE_DELETED, resourceId, deleted.configSnapshot());

        log.info("Deleted backup schedule for server {}", resourceId);
    }

    public BackupScheduleResponse getSchedule(String resourceId) {
        validator.validateResourceId(resourceId);

        return scheduleStore.get(resourceId)
                .map(scheduleMapper::toResponse)
                .orElseThrow(() -> new ScheduleNotFoundException(resourceId));
    }

    public List<BackupScheduleResponse> listSchedules(boolean enabledOnly) {
        return scheduleMapper.toResponseList(scheduleStore.listAll(enabledOnly));
    }

    /**
     * Event history of a server, newest first. Events outlive the schedule they belong to.
     */
    public Page<ScheduleEventResponse> listEvents(String resourceId, int page, int size) {
        validator.validateResourceId(resourceId);
        validator.validatePage(page, size);

        return scheduleStore.listEvents(resourceId, PageRequest.of(page, size))
                .map(scheduleMapper::toEventResponse);
    }

    // === Resource cascade ===

    /**
     * Remove the schedule of a deleted server. Servers without a schedule are ignored.
     *
     * @return true if a schedule was removed
     */
    public boolean handleResourceDeleted(String resourceId) {
        validator.validateResourceId(resourceId);

        var now = clock.instant();
        var deleted = scheduleStore.deleteIfPresent(resourceId, schedule -> ScheduleEvent.lifecycle(resourceId, ScheduleAction.DELETED,
                "Resource deleted", schedule.configSnapshot(), null, null, now));

        if (deleted.isEmpty()) {
            log.debug("Server {} was deleted and had no backup schedule", resourceId);
            return false;
        }

        scheduleCache.invalidate(resourceId);
        auditPublisher.publish(null, AuditActionPublisher.SCHEDULE_DELETED, resourceId,
                Map.of("reason", "resource deleted"));

        log.info("Removed backup schedule of deleted server {}", resourceId);
        return true;
    }

    @EventListener
    public void onResourceDeleted(ResourceDeletedEvent event) {
        handleResourceDeleted(event.getResourceId());
    }

    // === Scheduler control ===

    /**
     * Schedule counts come from the store, the next execution from the cache
     */
    public SchedulerStatusResponse getStatus() {
        var counts = scheduleStore.countSchedules();

        return SchedulerStatusResponse.builder()
                .running(schedulerLoop.isRunning())
                .state(schedulerLoop.getState().name())
                .totalSchedules(counts.getTotal())
                .enabledSchedules(counts.getEnabled())
                .cacheSize(scheduleCache.size())
                .nextExecutionAt(scheduleCache.earliestNextTrigger().orElse(null))
                .lastTickAt(schedulerLoop.getLastTickAt())
                .tickIntervalMs(properties.getTickIntervalMs())
                .build();
    }

    public SchedulerStatusResponse startScheduler() {
        schedulerLoop.start();
        return getStatus();
    }

    public SchedulerStatusResponse stopScheduler() {
        schedulerLoop.stop();
        return getStatus();
    }
}

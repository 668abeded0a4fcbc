package com.example.backupscheduler.service.storage;

import com.example.backupscheduler.domain.entity.BackupSchedule;
import com.example.backupscheduler.domain.entity.ScheduleEvent;
import com.example.backupscheduler.domain.enums.ScheduleAction;
import com.example.backupscheduler.domain.repository.BackupScheduleRepository;
import com.example.backupscheduler.domain.repository.ScheduleEventRepository;
import com.example.backupscheduler.exception.ScheduleConflictException;
import com.example.backupscheduler.exception.ScheduleNotFoundException;
import com.example.backupscheduler.exception.TerminalStorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Durable backup schedules and their event log.
 * <p>
 * Every call is one unit-of-work of the {@link TransactionRunner}; every
 * mutation writes its schedule change and exactly one event in the same
 * transaction. Entities and events are built inside the unit-of-work so a
 * retried attempt never reuses state from a rolled back one. Returned
 * entities are detached.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleStore {

    private final BackupScheduleRepository scheduleRepository;
    private final ScheduleEventRepository eventRepository;
    private final TransactionRunner transactionRunner;

    /**
     * Insert a new schedule together with its creation event.
     *
     * @throws ScheduleConflictException if the resource already has a schedule
     */
    public BackupSchedule create(String resourceId, Supplier<BackupSchedule> scheduleFactory,
                                 Function<BackupSchedule, ScheduleEvent> eventFactory) {
        try {
            return transactionRunner.runInTransaction("createSchedule", status -> {
                if (scheduleRepository.existsByResourceId(resourceId)) {
                    throw new ScheduleConflictException(resourceId);
                }
                var saved = scheduleRepository.saveAndFlush(scheduleFactory.get());
                eventRepository.save(eventFactory.apply(saved));
                return saved;
            });
        } catch (TerminalStorageException e) {
            // concurrent insert won the race for the unique resource constraint
            if (StorageErrorClassifier.isConstraintViolation(e.getCause())) {
                throw new ScheduleConflictException(resourceId, e);
            }
            throw e;
        }
    }

    public Optional<BackupSchedule> get(String resourceId) {
        return transactionRunner.readInTransaction("getSchedule", status -> scheduleRepository.findByResourceId(resourceId));
    }

    /**
     * Apply a mutation to the stored schedule and append the event it returns.
     *
     * @throws ScheduleNotFoundException if the resource has no schedule
     */
    public BackupSchedule update(String resourceId, Function<BackupSchedule, ScheduleEvent> mutation) {
        return update("updateSchedule", resourceId, mutation);
    }

    public BackupSchedule update(String operationName, String resourceId, Function<BackupSchedule, ScheduleEvent> mutation) {
        return transactionRunner.runInTransaction(operationName, status -> {
            var schedule = scheduleRepository.findByResourceId(resourceId)
                    .orElseThrow(() -> new ScheduleNotFoundException(resourceId));
            var event = Objects.requireNonNull(mutation.apply(schedule), "mutation must produce an event");
            var saved = scheduleRepository.saveAndFlush(schedule);
            eventRepository.save(event);
            return saved;
        });
    }

    /**
     * @throws ScheduleNotFoundException if the resource has no schedule
     */
    public BackupSchedule delete(String resourceId, Function<BackupSchedule, ScheduleEvent> eventFactory) {
        return deleteIfPresent(resourceId, eventFactory).orElseThrow(() -> new ScheduleNotFoundException(resourceId));
    }

    /**
     * Delete the schedule of a resource if there is one, writing the deletion event with it
     */
    public Optional<BackupSchedule> deleteIfPresent(String resourceId, Function<BackupSchedule, ScheduleEvent> eventFactory) {
        return transactionRunner.runInTransaction("deleteSchedule", status -> {
            var existing = scheduleRepository.findByResourceId(resourceId);
            existing.ifPresent(schedule -> {
                scheduleRepository.delete(schedule);
                eventRepository.save(eventFactory.apply(schedule));
                scheduleRepository.flush();
            });
            return existing;
        });
    }

    /**
     * Append a loop attempt event without touching the schedule
     */
    public ScheduleEvent recordAttempt(String resourceId, ScheduleAction action, String reason, Instant at) {
        return transactionRunner.runInTransaction("recordScheduleEvent",
                status -> eventRepository.save(ScheduleEvent.attempt(resourceId, action, reason, at)));
    }

    /**
     * Enabled schedules due at {@code now}, oldest due first
     */
    public List<BackupSchedule> listDue(Instant now) {
        return transactionRunner.readInTransaction("listDueSchedules", status -> scheduleRepository.findDueSchedules(now));
    }

    public List<BackupSchedule> listAll(boolean enabledOnly) {
        return transactionRunner.readInTransaction("listSchedules", status -> enabledOnly
                ? scheduleRepository.findByEnabledTrueOrderByResourceIdAsc()
                : scheduleRepository.findAllByOrderByResourceIdAsc());
    }

    public ScheduleCounts countSchedules() {
        return transactionRunner.readInTransaction("countSchedules",
                status -> new ScheduleCounts(scheduleRepository.count(), scheduleRepository.countByEnabledTrue()));
    }

    public Page<ScheduleEvent> listEvents(String resourceId, Pageable pageable) {
        return transactionRunner.readInTransaction("listScheduleEvents",
                status -> eventRepository.findByResourceIdOrderByCreatedAtDescIdDesc(resourceId, pageable));
    }
}

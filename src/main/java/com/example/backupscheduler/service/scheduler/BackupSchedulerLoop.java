package com.example.backupscheduler.service.scheduler;

import com.example.backupscheduler.client.BackupCatalogClient;
import com.example.backupscheduler.client.ClientModels.BackupHandle;
import com.example.backupscheduler.client.ResourceStateClient;
import com.example.backupscheduler.config.BackupSchedulerProperties;
import com.example.backupscheduler.config.MetricsConfig;
import com.example.backupscheduler.domain.entity.BackupSchedule;
import com.example.backupscheduler.domain.entity.ScheduleEvent;
import com.example.backupscheduler.domain.enums.ScheduleAction;
import com.example.backupscheduler.exception.RetriesExhaustedException;
import com.example.backupscheduler.exception.ScheduleNotFoundException;
import com.example.backupscheduler.exception.SchedulerStartException;
import com.example.backupscheduler.exception.TerminalStorageException;
import com.example.backupscheduler.service.alert.SlackAlertService;
import com.example.backupscheduler.service.storage.ScheduleStore;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single loop that turns due schedules into backups.
 * <p>
 * Lifecycle: STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED. Bound to the
 * application context through {@link SmartLifecycle}, and also started and
 * stopped explicitly through the scheduler API.
 * <p>
 * Flow of one tick:
 * 1. Read due schedules from the store, oldest due first
 * 2. Evaluate each one; not ready means a skipped event with the reason
 * 3. Ready means create a backup (bounded wait), then persist the new due
 *    marker with an executed event, then enforce retention
 * 4. Reload the schedule cache
 * <p>
 * Timestamps move only after the backup exists and the update committed. A
 * failure on one schedule is recorded or logged and never aborts the tick.
 * <p>
 * Each start creates a {@link LoopRun}. The tick checks the stop signal of its
 * own run, so a tick left over from a stopped run never starts another schedule.
 * The state stays STOPPING until the loop thread of that run has exited.
 */
@Slf4j
@Service
public class BackupSchedulerLoop implements SmartLifecycle {

    static final String TICK_LOCK_NAME = "backupSchedulerTick";

    private static final String BACKUP_SERVICE = "Backup Service";
    private static final String SERVER_MANAGER = "Server Manager";

    private final ScheduleStore scheduleStore;
    private final ScheduleCache scheduleCache;
    private final DueScheduleEvaluator evaluator;
    private final RetentionEnforcer retentionEnforcer;
    private final ResourceStateClient resourceStateClient;
    private final BackupCatalogClient backupCatalogClient;
    private final CollaboratorCalls collaboratorCalls;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metrics;
    private final LockingTaskExecutor lockingTaskExecutor;
    private final ExecutorService loopExecutor;
    private final BackupSchedulerProperties properties;
    private final Clock clock;

    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.STOPPED);

    private volatile LoopRun currentRun;
    private volatile Instant lastTickAt;

    public BackupSchedulerLoop(ScheduleStore scheduleStore, ScheduleCache scheduleCache, DueScheduleEvaluator evaluator,
                               RetentionEnforcer retentionEnforcer, ResourceStateClient resourceStateClient,
                               BackupCatalogClient backupCatalogClient, CollaboratorCalls collaboratorCalls,
                               SlackAlertService slackAlertService, MetricsConfig metrics, LockingTaskExecutor lockingTaskExecutor,
                               @Qualifier("schedulerLoopExecutor") ExecutorService loopExecutor,
                               BackupSchedulerProperties properties, Clock clock) {
        this.scheduleStore = scheduleStore;
        this.scheduleCache = scheduleCache;
        this.evaluator = evaluator;
        this.retentionEnforcer = retentionEnforcer;
        this.resourceStateClient = resourceStateClient;
        this.backupCatalogClient = backupCatalogClient;
        this.collaboratorCalls = collaboratorCalls;
        this.slackAlertService = slackAlertService;
        this.metrics = metrics;
        this.lockingTaskExecutor = lockingTaskExecutor;
        this.loopExecutor = loopExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    // === Lifecycle ===

    /**
     * Load the cache and launch the loop. A second call while not stopped is ignored.
     *
     * @throws SchedulerStartException if the loop task cannot be submitted
     */
    @Override
    public void start() {
        if (!state.compareAndSet(SchedulerState.STOPPED, SchedulerState.STARTING)) {
            log.warn("Backup scheduler start requested while {}, ignoring", state.get());
            return;
        }

        log.info("Starting backup scheduler, tick interval {}ms", properties.getTickIntervalMs());

        if (!scheduleCache.load()) {
            log.warn("Backup scheduler starting without a loaded schedule cache, it will be filled by the first tick");
        }

        var run = new LoopRun();
        try {
            run.future = loopExecutor.submit(() -> runLoop(run));
        } catch (RejectedExecutionException e) {
            state.set(SchedulerState.STOPPED);
            throw new SchedulerStartException("Backup scheduler loop could not be started", e);
        }
        currentRun = run;

        state.set(SchedulerState.RUNNING);
        log.info("Backup scheduler started");
    }

    /**
     * Stop the loop and wait for it. No new schedule is started once stop was requested;
     * an in-flight tick gets the configured grace period and is interrupted afterwards.
     * If the loop thread still has not exited after a second grace period, the state
     * stays STOPPING and the loop thread completes the stop when it exits.
     */
    @Override
    public void stop() {
        if (!state.compareAndSet(SchedulerState.RUNNING, SchedulerState.STOPPING)) {
            log.debug("Backup scheduler stop requested while {}, nothing to do", state.get());
            return;
        }

        log.info("Stopping backup scheduler");

        var run = currentRun;
        if (run == null) {
            completeStop();
            return;
        }

        run.stopSignal.countDown();

        var timeoutSeconds = properties.getStopTimeoutSeconds();
        var exited = awaitExit(run, timeoutSeconds);
        if (!exited) {
            log.warn("Backup scheduler loop did not finish within {}s, interrupting it", timeoutSeconds);
            run.future.cancel(true);
            exited = awaitExit(run, timeoutSeconds);
        }

        if (!exited && run.handOff.compareAndSet(false, true)) {
            log.warn("Backup scheduler loop is still finishing, it completes the stop when it exits");
            return;
        }
        completeStop();
    }

    private boolean awaitExit(LoopRun run, int timeoutSeconds) {
        try {
            return run.exited.await(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.future.cancel(true);
            return false;
        }
    }

    private void completeStop() {
        currentRun = null;
        scheduleCache.clear();
        state.set(SchedulerState.STOPPED);
        log.info("Backup scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return state.get() == SchedulerState.RUNNING;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStart();
    }

    public SchedulerState getState() {
        return state.get();
    }

    public Instant getLastTickAt() {
        return lastTickAt;
    }

    // === Loop ===

    private void runLoop(LoopRun run) {
        log.info("Backup scheduler loop running");
        try {
            boolean stopRequested = false;
            while (!stopRequested) {
                var tickFailed = false;
                try {
                    runLockedTick(run.stopSignal);
                } catch (Exception e) {
                    tickFailed = true;
                    log.error("Unexpected error in backup scheduler tick: {}", e.getMessage(), e);
                }

                var waitMs = tickFailed
                        ? Math.min(properties.getErrorRetryDelayMs(), properties.getTickIntervalMs())
                        : properties.getTickIntervalMs();
                stopRequested = run.stopSignal.await(waitMs, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Backup scheduler loop interrupted");
        } finally {
            log.info("Backup scheduler loop exited");
            run.exited.countDown();
            // stop() gave up waiting and handed the rest of the stop over to this thread
            if (!run.handOff.compareAndSet(false, true)) {
                completeStop();
            }
        }
    }

    private void runLockedTick(CountDownLatch stopSignal) {
        var lockConfiguration = new LockConfiguration(clock.instant(), TICK_LOCK_NAME,
                Duration.ofMinutes(properties.getTickLockAtMostForMinutes()), Duration.ZERO);

        lockingTaskExecutor.executeWithLock((Runnable) () -> runTick(clock.instant(), stopSignal), lockConfiguration);
    }

    /**
     * Process every schedule due at {@code now}.
     *
     * @return counts of what happened during the tick
     */
    public TickSummary runTick(Instant now) {
        return runTick(now, null);
    }

    private TickSummary runTick(Instant now, CountDownLatch stopSignal) {
        var sample = metrics.startTickTimer();
        var success = false;
        var executed = 0;
        var skipped = 0;
        var failed = 0;
        var notStarted = 0;
        List<BackupSchedule> due = List.of();

        try {
            due = scheduleStore.listDue(now);

            if (due.isEmpty()) {
                log.debug("No backup schedules due at {}", now);
            } else {
                log.info("Found {} backup schedules due at {}", due.size(), now);
            }

            for (int i = 0; i < due.size(); i++) {
                if (isStopRequested(stopSignal)) {
                    notStarted = due.size() - i;
                    log.info("Stop requested, leaving {} due schedules for the next run", notStarted);
                    break;
                }

                switch (processSchedule(due.get(i), now)) {
                    case EXECUTED -> executed++;
                    case SKIPPED -> skipped++;
                    case FAILED -> failed++;
                }
            }
            success = true;
        } finally {
            lastTickAt = now;
            scheduleCache.load();
            metrics.recordTick(sample, success);
        }

        if (!due.isEmpty()) {
            log.info("Backup scheduler tick finished: {} due, {} executed, {} skipped, {} failed", due.size(), executed, skipped, failed);
        }

        return TickSummary.builder()
                .tickAt(now)
                .due(due.size())
                .executed(executed)
                .skipped(skipped)
                .failed(failed)
                .notStarted(notStarted)
                .build();
    }

    private static boolean isStopRequested(CountDownLatch stopSignal) {
        return Thread.currentThread().isInterrupted() || (stopSignal != null && stopSignal.getCount() == 0);
    }

    private enum Outcome {
        EXECUTED,
        SKIPPED,
        FAILED
    }

    private Outcome processSchedule(BackupSchedule schedule, Instant now) {
        var resourceId = schedule.getResourceId();
        BackupHandle created = null;

        try {
            var decision = evaluator.shouldExecute(schedule, now, this::lookupResourceActive);
            if (!decision.isExecute()) {
                log.info("Skipping scheduled backup of server {}: {}", resourceId, decision.getReason());
                recordSkip(resourceId, decision.getReason(), skipCategory(decision.getReason()), now);
                return Outcome.SKIPPED;
            }

            BackupHandle backup;
            try {
                backup = collaboratorCalls.call(BACKUP_SERVICE, "Backup creation for server " + resourceId,
                        () -> backupCatalogClient.createBackup(resourceId), Duration.ofMinutes(properties.getBackupTimeoutMinutes()));
            } catch (RuntimeException e) {
                log.error("Scheduled backup of server {} failed: {}", resourceId, e.getMessage());
                recordSkip(resourceId, "backup creation failed: " + e.getMessage(), "backup_failed", now);
                return Outcome.SKIPPED;
            }
            created = backup;

            var updated = scheduleStore.update("recordScheduledBackup", resourceId, stored -> {
                stored.markTriggered(now);
                return ScheduleEvent.attempt(resourceId, ScheduleAction.EXECUTED, "Backup created: " + backup.getId(), now);
            });
            metrics.recordExecuted();
            log.info("Scheduled backup {} created for server {}, next backup at {}", backup.getId(), resourceId, updated.getNextTriggerAt());

            enforceRetention(resourceId, updated.getMaxBackups());
            return Outcome.EXECUTED;
        } catch (RetriesExhaustedException e) {
            log.error("Giving up on schedule of server {} for this tick: {}", resourceId, e.getMessage());
            slackAlertService.sendStorageRetriesExhaustedAlert(resourceId, e.getOperation(), e.getMessage());
            recordUnrecordedBackup(resourceId, created, e, now);
            return Outcome.FAILED;
        } catch (TerminalStorageException e) {
            log.error("Storage failure on schedule of server {}: {}", resourceId, e.getMessage(), e);
            slackAlertService.sendStorageFailureAlert(resourceId, e.getOperation(), e.getMessage());
            recordUnrecordedBackup(resourceId, created, e, now);
            return Outcome.FAILED;
        } catch (ScheduleNotFoundException e) {
            log.warn("Schedule of server {} was deleted while its backup was running", resourceId);
            recordUnrecordedBackup(resourceId, created, e, now);
            return Outcome.FAILED;
        } catch (RuntimeException e) {
            log.error("Unexpected error processing schedule of server {}: {}", resourceId, e.getMessage(), e);
            recordUnrecordedBackup(resourceId, created, e, now);
            return Outcome.FAILED;
        } finally {
            scheduleCache.invalidate(resourceId);
        }
    }

    private boolean lookupResourceActive(String resourceId) {
        return collaboratorCalls.call(SERVER_MANAGER, "Status lookup of server " + resourceId,
                () -> resourceStateClient.isResourceActive(resourceId), Duration.ofSeconds(properties.getCollaboratorTimeoutSeconds()));
    }

    private void recordSkip(String resourceId, String reason, String category, Instant now) {
        scheduleStore.recordAttempt(resourceId, ScheduleAction.SKIPPED, reason, now);
        metrics.recordSkipped(category);
    }

    /**
     * The backup exists but the schedule update did not commit. Writes the skipped
     * event for the attempt; a second storage failure here is only logged.
     */
    private void recordUnrecordedBackup(String resourceId, BackupHandle backup, RuntimeException error, Instant now) {
        if (backup == null) {
            return;
        }
        try {
            recordSkip(resourceId, "backup " + backup.getId() + " created but not recorded: " + error.getMessage(), "record_failed", now);
        } catch (RuntimeException recordError) {
            log.error("Could not write skipped event for server {} after backup {}: {}", resourceId, backup.getId(), recordError.getMessage());
        }
    }

    private void enforceRetention(String resourceId, int maxBackups) {
        try {
            var result = retentionEnforcer.enforce(resourceId, maxBackups);
            if (!result.getDeleted().isEmpty() || result.getFailed() > 0) {
                log.info("Retention for server {}: kept {}, deleted {}, failed {}", resourceId, result.getKept(), result.getDeleted().size(), result.getFailed());
            }
        } catch (RuntimeException e) {
            log.error("Retention enforcement failed for server {}: {}", resourceId, e.getMessage(), e);
        }
    }

    private static String skipCategory(String reason) {
        if (ExecutionDecision.REASON_DISABLED.equals(reason)) {
            return "disabled";
        }
        if (ExecutionDecision.REASON_NOT_YET_TIME.equals(reason)) {
            return "not_yet_time";
        }
        if (ExecutionDecision.REASON_RESOURCE_NOT_RUNNING.equals(reason)) {
            return "resource_not_running";
        }
        return "resource_state_unavailable";
    }

    /**
     * One started loop: its stop signal, its exit marker and the stop hand-off flag
     */
    private static final class LoopRun {
        private final CountDownLatch stopSignal = new CountDownLatch(1);
        private final CountDownLatch exited = new CountDownLatch(1);
        private final AtomicBoolean handOff = new AtomicBoolean(false);
        private volatile Future<?> future;
    }
}

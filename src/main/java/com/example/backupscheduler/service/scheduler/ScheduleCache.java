package com.example.backupscheduler.service.scheduler;

import com.example.backupscheduler.config.MetricsConfig;
import com.example.backupscheduler.dto.BackupScheduleResponse;
import com.example.backupscheduler.mapper.ScheduleMapper;
import com.example.backupscheduler.service.storage.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory mirror of all schedules, keyed by resource id.
 * <p>
 * Feeds status reporting and metrics gauges only. The scheduler loop reads due
 * schedules from the store, never from here. Entries are immutable snapshots.
 * A failed refresh is logged and leaves the previous content in place.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleCache {

    private final ScheduleStore scheduleStore;
    private final ScheduleMapper scheduleMapper;
    private final MetricsConfig metrics;

    private final ConcurrentHashMap<String, BackupScheduleResponse> entries = new ConcurrentHashMap<>();

    /**
     * Repopulate the cache from the store
     *
     * @return false if the store could not be read
     */
    public boolean load() {
        try {
            var fresh = new HashMap<String, BackupScheduleResponse>();
            for (var schedule : scheduleStore.listAll(false)) {
                fresh.put(schedule.getResourceId(), scheduleMapper.toResponse(schedule));
            }

            entries.keySet().retainAll(fresh.keySet());
            entries.putAll(fresh);
            refreshGauges();

            log.debug("Loaded {} backup schedules into cache", fresh.size());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to load backup schedules into cache: {}", e.getMessage(), e);
            return false;
        }
    }

    /**
     * Drop the entry of a resource and re-read it from the store.
     * A resource without a stored schedule stays absent.
     */
    public void invalidate(String resourceId) {
        entries.remove(resourceId);
        try {
            scheduleStore.get(resourceId)
                    .map(scheduleMapper::toResponse)
                    .ifPresent(response -> entries.put(resourceId, response));
        } catch (RuntimeException e) {
            log.warn("Failed to refresh cached schedule of resource {}: {}", resourceId, e.getMessage());
        }
        refreshGauges();
    }

    public Optional<BackupScheduleResponse> get(String resourceId) {
        return Optional.ofNullable(entries.get(resourceId));
    }

    public int size() {
        return entries.size();
    }

    public long enabledCount() {
        return entries.values().stream().filter(BackupScheduleResponse::isEnabled).count();
    }

    /**
     * Earliest due marker among enabled schedules
     */
    public Optional<Instant> earliestNextTrigger() {
        return entries.values().stream()
                .filter(BackupScheduleResponse::isEnabled)
                .map(BackupScheduleResponse::getNextTriggerAt)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder());
    }

    public void clear() {
        entries.clear();
        refreshGauges();
    }

    private void refreshGauges() {
        metrics.updateScheduleGauges(entries.size(), enabledCount());
    }
}

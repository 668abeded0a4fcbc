package com.example.backupscheduler.service.scheduler;

import com.example.backupscheduler.client.BackupCatalogClient;
import com.example.backupscheduler.client.ClientModels.BackupHandle;
import com.example.backupscheduler.config.BackupSchedulerProperties;
import com.example.backupscheduler.config.MetricsConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Keeps the newest {@code maxBackups} completed backups of a server and deletes the rest.
 * <p>
 * Only completed backups count. Excess backups are deleted one by one, oldest
 * first; a failed deletion is logged and the remaining ones are still attempted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionEnforcer {

    private static final String SERVICE_NAME = "Backup Service";

    private final BackupCatalogClient backupCatalogClient;
    private final CollaboratorCalls collaboratorCalls;
    private final BackupSchedulerProperties properties;
    private final MetricsConfig metrics;

    public RetentionResult enforce(String resourceId, int maxBackups) {
        var timeout = Duration.ofSeconds(properties.getCollaboratorTimeoutSeconds());

        List<BackupHandle> listed;
        try {
            listed = collaboratorCalls.call(SERVICE_NAME, "Listing backups of server " + resourceId,
                    () -> backupCatalogClient.listCompletedBackups(resourceId), timeout);
        } catch (RuntimeException e) {
            log.error("Retention skipped for server {}, could not list backups: {}", resourceId, e.getMessage());
            return RetentionResult.builder().kept(0).deleted(List.of()).failed(1).build();
        }

        // the catalog promises completed backups newest first; do not rely on it when deleting
        var completed = (listed != null ? listed : List.<BackupHandle>of()).stream()
                .filter(Objects::nonNull)
                .filter(BackupHandle::isCompleted)
                .sorted(Comparator.comparing(BackupHandle::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .toList();

        if (completed.size() <= maxBackups) {
            log.debug("Server {} has {} completed backups, limit {}, nothing to delete", resourceId, completed.size(), maxBackups);
            return RetentionResult.nothingToDo(completed.size());
        }

        var excess = new ArrayList<>(completed.subList(maxBackups, completed.size()));
        // oldest first
        Collections.reverse(excess);

        log.info("Server {} has {} completed backups, limit {}, deleting {}", resourceId, completed.size(), maxBackups, excess.size());

        var deleted = new ArrayList<String>();
        var failed = 0;
        for (var backup : excess) {
            try {
                collaboratorCalls.call(SERVICE_NAME, "Deleting backup " + backup.getId(), () -> {
                    backupCatalogClient.deleteBackup(backup);
                    return null;
                }, timeout);
                deleted.add(backup.getId());
                log.info("Deleted old backup {} of server {} (created {})", backup.getId(), resourceId, backup.getCreatedAt());
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to delete old backup {} of server {}: {}", backup.getId(), resourceId, e.getMessage());
            }
        }

        metrics.recordRetentionDeleted(deleted.size(), failed);

        return RetentionResult.builder()
                .kept(completed.size() - deleted.size())
                .deleted(List.copyOf(deleted))
                .failed(failed)
                .build();
    }
}

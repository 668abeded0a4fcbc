package com.example.backupscheduler.client;

import com.example.backupscheduler.client.ClientModels.BackupHandle;

import java.util.List;

/**
 * Backup artifacts of managed servers, owned by the backup service.
 */
public interface BackupCatalogClient {

    /**
     * Create a scheduled backup and wait for it to finish.
     */
    BackupHandle createBackup(String resourceId);

    /**
     * Completed backups of a server, newest first.
     */
    List<BackupHandle> listCompletedBackups(String resourceId);

    void deleteBackup(BackupHandle backup);
}

package com.example.backupscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Backup Scheduler Service Application
 * <p>
 * Periodically triggers backups of managed game servers and enforces
 * per-server retention of completed backups.
 * <p>
 * Features:
 * - Store-backed backup schedules with an append-only event log
 * - Transactional persistence that retries transient storage failures
 * - Single cooperative scheduler loop with explicit start/stop
 * - Retention cleanup after every successful scheduled backup
 * - Slack alerting when storage retries are exhausted
 */
@SpringBootApplication
public class BackupSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BackupSchedulerApplication.class, args);
    }
}

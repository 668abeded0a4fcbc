package com.example.backupscheduler.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Automatic backup policy of one managed server.
 * <p>
 * {@code nextTriggerAt} is the authoritative due marker read by the scheduler loop.
 * It only moves forward after a backup was created and the update committed.
 */
@Entity
@EntityListeners(AuditingEntityListener.class)
@Table(name = "backup_schedules",
        uniqueConstraints = @UniqueConstraint(name = "uk_backup_schedule_resource", columnNames = "resource_id"),
        indexes = {
                @Index(name = "idx_backup_schedule_next_trigger", columnList = "next_trigger_at"),
                @Index(name = "idx_backup_schedule_enabled_next", columnList = "enabled, next_trigger_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BackupSchedule {

    public static final int MIN_INTERVAL_HOURS = 1;
    public static final int MAX_INTERVAL_HOURS = 168;
    public static final int MIN_MAX_BACKUPS = 1;
    public static final int MAX_MAX_BACKUPS = 30;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Identifier of the server this schedule belongs to
     */
    @Column(name = "resource_id", nullable = false, updatable = false, length = 100)
    private String resourceId;

    @Column(name = "interval_hours", nullable = false)
    private Integer intervalHours;

    /**
     * How many completed backups retention keeps
     */
    @Column(name = "max_backups", nullable = false)
    private Integer maxBackups;

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    /**
     * Only back up while the server is running
     */
    @Column(name = "only_when_active", nullable = false)
    @Builder.Default
    private boolean onlyWhenActive = true;

    @Column(name = "last_triggered_at")
    private Instant lastTriggeredAt;

    @Column(name = "next_trigger_at")
    private Instant nextTriggerAt;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    // === Helper Methods ===

    public Duration interval() {
        return Duration.ofHours(intervalHours);
    }

    /**
     * Record a successful scheduled backup and move the due marker one interval ahead
     */
    public void markTriggered(Instant triggeredAt) {
        this.lastTriggeredAt = triggeredAt;
        this.nextTriggerAt = triggeredAt.plus(interval());
    }

    /**
     * Recompute the due marker after the interval changed.
     * Counts from the last backup, or from {@code now} if there never was one.
     */
    public void rescheduleFrom(Instant now) {
        var base = lastTriggeredAt != null ? lastTriggeredAt : now;
        this.nextTriggerAt = base.plus(interval());
    }

    /**
     * Snapshot of the user-editable configuration, stored with schedule events
     */
    public Map<String, Object> configSnapshot() {
        var snapshot = new LinkedHashMap<String, Object>();
        snapshot.put("intervalHours", intervalHours);
        snapshot.put("maxBackups", maxBackups);
        snapshot.put("enabled", enabled);
        snapshot.put("onlyWhenActive", onlyWhenActive);
        return snapshot;
    }
}

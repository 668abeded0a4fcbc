package com.example.backupscheduler.domain.entity;

import com.example.backupscheduler.domain.enums.ScheduleAction;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only audit record of a schedule lifecycle action or loop attempt.
 * Never updated after insert. The id grows with insert order and breaks ties
 * between events written at the same instant.
 */
@Entity
@Table(name = "backup_schedule_events", indexes = {
        @Index(name = "idx_schedule_event_resource_created", columnList = "resource_id, created_at"),
        @Index(name = "idx_schedule_event_action", columnList = "action")
})
@Getter
@Setter(AccessLevel.PROTECTED)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleEvent {

    public static final int MAX_REASON_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "resource_id", nullable = false, updatable = false, length = 100)
    private String resourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 20)
    private ScheduleAction action;

    @Column(name = "reason", updatable = false, length = MAX_REASON_LENGTH)
    private String reason;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "old_config", updatable = false)
    private Map<String, Object> oldConfig;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "new_config", updatable = false)
    private Map<String, Object> newConfig;

    /**
     * User that triggered the action, null for the scheduler itself
     */
    @Column(name = "actor_user_id", updatable = false)
    private Long actorUserId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            throw new IllegalStateException("Schedule event of " + resourceId + " has no timestamp");
        }
        this.reason = truncateReason(this.reason);
    }

    public static ScheduleEvent lifecycle(String resourceId, ScheduleAction action, String reason,
                                          Map<String, Object> oldConfig, Map<String, Object> newConfig, Long actorUserId, Instant at) {
        if (action.isAttempt()) {
            throw new IllegalArgumentException("Not a lifecycle action: " + action);
        }
        return ScheduleEvent.builder()
                .resourceId(resourceId)
                .action(action)
                .reason(truncateReason(reason))
                .oldConfig(oldConfig)
                .newConfig(newConfig)
                .actorUserId(actorUserId)
                .createdAt(at)
                .build();
    }

    /**
     * Event written by the scheduler loop for one due schedule
     */
    public static ScheduleEvent attempt(String resourceId, ScheduleAction action, String reason, Instant at) {
        if (!action.isAttempt()) {
            throw new IllegalArgumentException("Not an attempt action: " + action);
        }
        return ScheduleEvent.builder()
                .resourceId(resourceId)
                .action(action)
                .reason(truncateReason(reason))
                .createdAt(at)
                .build();
    }

    static String truncateReason(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH - 3) + "...";
    }
}

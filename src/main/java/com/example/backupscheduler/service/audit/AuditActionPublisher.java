package com.example.backupscheduler.service.audit;

import com.example.backupscheduler.client.AuditSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Fire-and-forget forwarding of schedule changes to the audit sink.
 * A failing sink never affects the schedule operation that emitted the action.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditActionPublisher {

    public static final String SCHEDULE_CREATED = "backup_schedule_created";
    public static final String SCHEDULE_UPDATED = "backup_schedule_updated";
    public static final String SCHEDULE_DELETED = "backup_schedule_deleted";

    private final AuditSink auditSink;

    @Async
    public void publish(Long actorUserId, String action, String resourceId, Map<String, Object> details) {
        try {
            auditSink.emit(actorUserId, action, resourceId, details);
            log.debug("Audit action {} emitted for server {}", action, resourceId);
        } catch (Exception e) {
            log.warn("Failed to emit audit action {} for server {}: {}", action, resourceId, e.getMessage());
        }
    }
}

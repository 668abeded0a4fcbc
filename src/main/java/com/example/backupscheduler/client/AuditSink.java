package com.example.backupscheduler.client;

import java.util.Map;

/**
 * Destination of user-facing audit actions.
 */
public interface AuditSink {

    void emit(Long actorUserId, String action, String resourceId, Map<String, Object> details);
}

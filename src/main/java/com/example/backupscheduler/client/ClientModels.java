package com.example.backupscheduler.client;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Request/Response DTOs for collaborator service clients
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Server Manager Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ServerStatusResponse {
        private String serverId;
        private String status;
        private Map<String, Object> processInfo;

        @JsonIgnore
        public boolean isRunning() {
            return "running".equalsIgnoreCase(status);
        }
    }

    // === Backup Service Models ===

    @Getter
    @RequiredArgsConstructor
    public enum BackupStatus {
        CREATING("creating"),
        COMPLETED("completed"),
        FAILED("failed");

        @JsonValue
        private final String code;
    }

    /**
     * Read-only view of a backup owned by the backup service
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BackupHandle {
        private String id;
        private String resourceId;
        private String name;
        private BackupStatus status;
        private Instant createdAt;
        private Long sizeBytes;

        @JsonIgnore
        public boolean isCompleted() {
            return status == BackupStatus.COMPLETED;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateBackupRequest {
        private String name;
        private String description;
        private String backupType;
    }

    // === Audit Service Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuditActionRequest {
        private Long userId;
        private String action;
        private String resourceType;
        private String resourceId;
        private Map<String, Object> details;
    }
}

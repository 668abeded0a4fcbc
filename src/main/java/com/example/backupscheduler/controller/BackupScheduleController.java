package com.example.backupscheduler.controller;

import com.example.backupscheduler.dto.ApiResponse;
import com.example.backupscheduler.dto.BackupScheduleResponse;
import com.example.backupscheduler.dto.CreateScheduleRequest;
import com.example.backupscheduler.dto.ScheduleEventResponse;
import com.example.backupscheduler.dto.UpdateScheduleRequest;
import com.example.backupscheduler.event.ResourceDeletedEvent;
import com.example.backupscheduler.service.ScheduleManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for backup schedules.
 * <p>
 * Provides endpoints for:
 * - Creating, reading, updating and deleting the schedule of a server
 * - Reading the schedule event history of a server
 * - Notifying that a server was deleted
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/backup-schedules")
@Tag(name = "Backup Schedules", description = "APIs for managing automatic server backups")
public class BackupScheduleController {

    static final String ACTOR_HEADER = "X-User-Id";

    private final ScheduleManagementService scheduleManagementService;
    private final ApplicationEventPublisher eventPublisher;

    @PostMapping("/resources/{resourceId}")
    @Operation(summary = "Create a backup schedule", description = "Create the automatic backup schedule of a server")
    public ResponseEntity<ApiResponse<BackupScheduleResponse>> createSchedule(
            @Parameter(description = "Server ID") @PathVariable String resourceId,
            @Valid @RequestBody CreateScheduleRequest request,
            @Parameter(description = "Acting user") @RequestHeader(value = ACTOR_HEADER, required = false) Long actorUserId) {
        log.info("API: Create backup schedule for server {} by user {}", resourceId, actorUserId);

        var response = scheduleManagementService.createSchedule(resourceId, request, actorUserId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Backup schedule created"));
    }

    @GetMapping("/resources/{resourceId}")
    @Operation(summary = "Get a backup schedule", description = "Get the backup schedule of a server")
    public ResponseEntity<ApiResponse<BackupScheduleResponse>> getSchedule(@Parameter(description = "Server ID") @PathVariable String resourceId) {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.getSchedule(resourceId)));
    }

    @PutMapping("/resources/{resourceId}")
    @Operation(summary = "Update a backup schedule", description = "Change the provided settings of a backup schedule")
    public ResponseEntity<ApiResponse<BackupScheduleResponse>> updateSchedule(
            @Parameter(description = "Server ID") @PathVariable String resourceId,
            @Valid @RequestBody UpdateScheduleRequest request,
            @Parameter(description = "Acting user") @RequestHeader(value = ACTOR_HEADER, required = false) Long actorUserId) {
        log.info("API: Update backup schedule for server {} by user {}", resourceId, actorUserId);

        var response = scheduleManagementService.updateSchedule(resourceId, request, actorUserId);
        return ResponseEntity.ok(ApiResponse.success(response, "Backup schedule updated"));
    }

    @DeleteMapping("/resources/{resourceId}")
    @Operation(summary = "Delete a backup schedule", description = "Stop automatic backups of a server")
    public ResponseEntity<ApiResponse<Void>> deleteSchedule(
            @Parameter(description = "Server ID") @PathVariable String resourceId,
            @Parameter(description = "Acting user") @RequestHeader(value = ACTOR_HEADER, required = false) Long actorUserId) {
        log.info("API: Delete backup schedule for server {} by user {}", resourceId, actorUserId);

        scheduleManagementService.deleteSchedule(resourceId, actorUserId);
        return ResponseEntity.ok(ApiResponse.success(null, "Backup schedule deleted"));
    }

    @GetMapping("/resources/{resourceId}/events")
    @Operation(summary = "Get schedule events", description = "Schedule lifecycle and backup attempt history of a server, newest first")
    public ResponseEntity<ApiResponse<Page<ScheduleEventResponse>>> getEvents(
            @Parameter(description = "Server ID") @PathVariable String resourceId,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.listEvents(resourceId, page, size)));
    }

    @PostMapping("/resources/{resourceId}/resource-deleted")
    @Operation(summary = "Notify server deletion", description = "Remove the backup schedule of a server that no longer exists")
    public ResponseEntity<ApiResponse<Void>> resourceDeleted(@Parameter(description = "Server ID") @PathVariable String resourceId) {
        log.info("API: Server {} deleted", resourceId);

        eventPublisher.publishEvent(new ResourceDeletedEvent(resourceId));
        return ResponseEntity.ok(ApiResponse.success(null, "Server deletion processed"));
    }

    @GetMapping
    @Operation(summary = "List backup schedules", description = "List all backup schedules, ordered by server")
    public ResponseEntity<ApiResponse<List<BackupScheduleResponse>>> listSchedules(
            @Parameter(description = "Only enabled schedules") @RequestParam(defaultValue = "false") boolean enabledOnly) {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.listSchedules(enabledOnly)));
    }
}

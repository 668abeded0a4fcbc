package com.example.backupscheduler.controller;

import com.example.backupscheduler.dto.ApiResponse;
import com.example.backupscheduler.dto.SchedulerStatusResponse;
import com.example.backupscheduler.service.ScheduleManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/backup-scheduler")
@Tag(name = "Backup Scheduler", description = "Status and control of the backup scheduler loop")
public class SchedulerController {

    private final ScheduleManagementService scheduleManagementService;

    @GetMapping("/status")
    @Operation(summary = "Scheduler status", description = "Loop state, schedule counts and next due backup")
    public ResponseEntity<ApiResponse<SchedulerStatusResponse>> getStatus() {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.getStatus()));
    }

    @PostMapping("/start")
    @Operation(summary = "Start the scheduler", description = "Start the loop; ignored if it is not stopped")
    public ResponseEntity<ApiResponse<SchedulerStatusResponse>> start() {
        log.info("API: Start backup scheduler");

        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.startScheduler(), "Backup scheduler started"));
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop the scheduler", description = "Stop the loop and wait for the running tick")
    public ResponseEntity<ApiResponse<SchedulerStatusResponse>> stop() {
        log.info("API: Stop backup scheduler");

        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.stopScheduler(), "Backup scheduler stopped"));
    }
}

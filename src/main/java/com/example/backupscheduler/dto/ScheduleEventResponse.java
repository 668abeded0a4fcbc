package com.example.backupscheduler.dto;

import com.example.backupscheduler.domain.enums.ScheduleAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleEventResponse {

    private Long id;
    private String resourceId;
    private ScheduleAction action;
    private String reason;
    private Map<String, Object> oldConfig;
    private Map<String, Object> newConfig;
    private Long actorUserId;
    private Instant createdAt;
}

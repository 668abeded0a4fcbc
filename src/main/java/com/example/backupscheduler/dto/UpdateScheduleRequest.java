package com.example.backupscheduler.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a partial schedule update. Null fields stay unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateScheduleRequest {

    @Min(value = 1, message = "must be between 1 and 168")
    @Max(value = 168, message = "must be between 1 and 168")
    private Integer intervalHours;

    @Min(value = 1, message = "must be between 1 and 30")
    @Max(value = 30, message = "must be between 1 and 30")
    private Integer maxBackups;

    private Boolean enabled;

    private Boolean onlyWhenActive;
}

package com.example.backupscheduler.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a backup schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateScheduleRequest {

    /**
     * Hours between two automatic backups
     */
    @NotNull(message = "Interval hours is required")
    @Min(value = 1, message = "must be between 1 and 168")
    @Max(value = 168, message = "must be between 1 and 168")
    private Integer intervalHours;

    /**
     * Number of completed backups to keep
     */
    @NotNull(message = "Max backups is required")
    @Min(value = 1, message = "must be between 1 and 30")
    @Max(value = 30, message = "must be between 1 and 30")
    private Integer maxBackups;

    @Builder.Default
    private Boolean enabled = true;

    /**
     * Skip the backup while the server is stopped
     */
    @Builder.Default
    private Boolean onlyWhenActive = true;
}

package com.example.backupscheduler.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Backup service connection properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.backup-service")
public class BackupServiceProperties {
    @NotBlank
    private String baseUrl;

    /**
     * Backup creation compresses a whole server directory, so it gets its own, longer timeout
     */
    private int createTimeoutSeconds = 1800;
    private int timeoutSeconds = 30;
}

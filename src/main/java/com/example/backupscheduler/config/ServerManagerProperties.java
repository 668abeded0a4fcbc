package com.example.backupscheduler.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Server management service connection properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.server-manager")
public class ServerManagerProperties {
    @NotBlank
    private String baseUrl;
    private int timeoutSeconds = 10;
}

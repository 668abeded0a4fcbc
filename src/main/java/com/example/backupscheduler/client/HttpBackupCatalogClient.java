package com.example.backupscheduler.client;

import com.example.backupscheduler.client.ClientModels.BackupHandle;
import com.example.backupscheduler.client.ClientModels.CreateBackupRequest;
import com.example.backupscheduler.config.BackupServiceProperties;
import com.example.backupscheduler.exception.ExternalCollaboratorException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Client for the backup service.
 * <p>
 * Backup creation is not idempotent, so it is guarded by the circuit breaker
 * only and never retried automatically. Listing and deleting also retry.
 */
@Slf4j
@Component
public class HttpBackupCatalogClient implements BackupCatalogClient {

    private static final String SERVICE_NAME = "Backup Service";
    private static final DateTimeFormatter NAME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneId.systemDefault());
    private static final ParameterizedTypeReference<List<BackupHandle>> BACKUP_LIST = new ParameterizedTypeReference<>() {
    };

    private final WebClient webClient;
    private final Clock clock;
    private final Duration createTimeout;
    private final Duration timeout;

    public HttpBackupCatalogClient(@Qualifier("backupServiceWebClient") WebClient webClient, BackupServiceProperties properties, Clock clock) {
        this.webClient = webClient;
        this.clock = clock;
        this.createTimeout = Duration.ofSeconds(properties.getCreateTimeoutSeconds());
        this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
    }

    @Override
    @CircuitBreaker(name = "backupService", fallbackMethod = "createBackupFallback")
    public BackupHandle createBackup(String resourceId) {
        var request = CreateBackupRequest.builder()
                .name("Scheduled backup - " + NAME_FORMATTER.format(clock.instant()))
                .description("Automatically created scheduled backup")
                .backupType("scheduled")
                .build();

        log.info("Calling Backup Service to create scheduled backup for server: {}", resourceId);

        try {
            var handle = webClient.post()
                    .uri("/api/v1/servers/{serverId}/backups", resourceId)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalCollaboratorException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(BackupHandle.class)
                    .timeout(createTimeout)
                    .block();

            if (handle == null || handle.getId() == null) {
                throw new ExternalCollaboratorException(SERVICE_NAME, "Backup creation returned no backup for server " + resourceId);
            }
            return handle;
        } catch (ExternalCollaboratorException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to create backup for server {}: {}", resourceId, e.getMessage());
            throw new ExternalCollaboratorException(SERVICE_NAME, e);
        }
    }

    /**
     * Fallback method when circuit breaker is open
     */
    @SuppressWarnings("unused")
    private BackupHandle createBackupFallback(String resourceId, Exception e) {
        if (e instanceof ExternalCollaboratorException collaboratorException) {
            throw collaboratorException;
        }
        log.warn("Circuit breaker open for Backup Service, server: {}, error: {}", resourceId, e.getMessage());
        throw new ExternalCollaboratorException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }

    @Override
    @CircuitBreaker(name = "backupService")
    @Retry(name = "backupService")
    public List<BackupHandle> listCompletedBackups(String resourceId) {
        log.debug("Listing completed backups for server: {}", resourceId);

        try {
            var backups = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/api/v1/servers/{serverId}/backups")
                            .queryParam("status", "completed")
                            .build(resourceId))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalCollaboratorException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(BACKUP_LIST)
                    .timeout(timeout)
                    .block();

            return backups != null ? backups : List.of();
        } catch (ExternalCollaboratorException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to list backups for server {}: {}", resourceId, e.getMessage());
            throw new ExternalCollaboratorException(SERVICE_NAME, e);
        }
    }

    @Override
    @CircuitBreaker(name = "backupService")
    @Retry(name = "backupService")
    public void deleteBackup(BackupHandle backup) {
        log.info("Deleting backup {} of server {}", backup.getId(), backup.getResourceId());

        try {
            webClient.delete()
                    .uri("/api/v1/backups/{backupId}", backup.getId())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalCollaboratorException(SERVICE_NAME, response.statusCode().value(), body))))
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
        } catch (ExternalCollaboratorException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to delete backup {}: {}", backup.getId(), e.getMessage());
            throw new ExternalCollaboratorException(SERVICE_NAME, e);
        }
    }
}

package com.example.backupscheduler.client;

import com.example.backupscheduler.client.ClientModels.AuditActionRequest;
import com.example.backupscheduler.config.AuditServiceProperties;
import com.example.backupscheduler.exception.ExternalCollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Sends audit actions to the audit service.
 */
@Slf4j
@Component
public class HttpAuditSink implements AuditSink {

    private static final String SERVICE_NAME = "Audit Service";

    private final WebClient webClient;
    private final AuditServiceProperties properties;

    public HttpAuditSink(@Qualifier("auditServiceWebClient") WebClient webClient, AuditServiceProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public void emit(Long actorUserId, String action, String resourceId, Map<String, Object> details) {
        if (!properties.isEnabled()) {
            log.debug("Audit forwarding disabled, dropping action {} for server {}", action, resourceId);
            return;
        }

        var request = AuditActionRequest.builder()
                .userId(actorUserId)
                .action(action)
                .resourceType("backup_schedule")
                .resourceId(resourceId)
                .details(details)
                .build();

        try {
            webClient.post()
                    .uri("/api/v1/audit/actions")
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalCollaboratorException(SERVICE_NAME, response.statusCode().value(), body))))
                    .toBodilessEntity()
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (ExternalCollaboratorException e) {
            throw e;
        } catch (Exception e) {
            throw new ExternalCollaboratorException(SERVICE_NAME, e);
        }
    }
}

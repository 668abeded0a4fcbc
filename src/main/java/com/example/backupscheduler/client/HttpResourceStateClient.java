package com.example.backupscheduler.client;

import com.example.backupscheduler.client.ClientModels.ServerStatusResponse;
import com.example.backupscheduler.config.ServerManagerProperties;
import com.example.backupscheduler.exception.ExternalCollaboratorException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for the server management service.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - Retry with exponential backoff (lookups are idempotent)
 * - WebClient with a per-call timeout
 */
@Slf4j
@Component
public class HttpResourceStateClient implements ResourceStateClient {

    private static final String SERVICE_NAME = "Server Manager";

    private final WebClient webClient;
    private final Duration timeout;

    public HttpResourceStateClient(@Qualifier("serverManagerWebClient") WebClient webClient, ServerManagerProperties properties) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
    }

    @Override
    @CircuitBreaker(name = "serverManager")
    @Retry(name = "serverManager")
    public boolean isResourceActive(String resourceId) {
        log.debug("Getting server status for: {}", resourceId);

        try {
            var response = webClient.get()
                    .uri("/api/v1/servers/{serverId}/status", resourceId)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalCollaboratorException(SERVICE_NAME, clientResponse.statusCode().value(), body))))
                    .bodyToMono(ServerStatusResponse.class)
                    .timeout(timeout)
                    .block();

            if (response == null) {
                throw new ExternalCollaboratorException(SERVICE_NAME, "Empty status response for server " + resourceId);
            }
            return response.isRunning();
        } catch (ExternalCollaboratorException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to get status of server {}: {}", resourceId, e.getMessage());
            throw new ExternalCollaboratorException(SERVICE_NAME, e);
        }
    }

    @Override
    @CircuitBreaker(name = "serverManager")
    @Retry(name = "serverManager")
    public boolean resourceExists(String resourceId) {
        log.debug("Checking existence of server: {}", resourceId);

        try {
            var status = webClient.get()
                    .uri("/api/v1/servers/{serverId}", resourceId)
                    .exchangeToMono(clientResponse -> {
                        if (clientResponse.statusCode().is2xxSuccessful()) {
                            return clientResponse.releaseBody().thenReturn(HttpStatus.OK.value());
                        }
                        if (clientResponse.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                            return clientResponse.releaseBody().thenReturn(HttpStatus.NOT_FOUND.value());
                        }
                        return clientResponse.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.<Integer>error(
                                        new ExternalCollaboratorException(SERVICE_NAME, clientResponse.statusCode().value(), body)));
                    })
                    .timeout(timeout)
                    .block();

            return status != null && status == HttpStatus.OK.value();
        } catch (ExternalCollaboratorException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to check existence of server {}: {}", resourceId, e.getMessage());
            throw new ExternalCollaboratorException(SERVICE_NAME, e);
        }
    }
}

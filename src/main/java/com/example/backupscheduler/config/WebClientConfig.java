package com.example.backupscheduler.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for collaborator calls.
 * <p>
 * One WebClient per collaborator service, each with its own connect and
 * read timeouts, request/response logging and error logging.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final ServerManagerProperties serverManagerProperties;
    private final BackupServiceProperties backupServiceProperties;
    private final AuditServiceProperties auditServiceProperties;

    /**
     * WebClient for server state lookups
     */
    @Bean(name = "serverManagerWebClient")
    public WebClient serverManagerWebClient(WebClient.Builder builder) {
        return createWebClient(builder, serverManagerProperties.getBaseUrl(), serverManagerProperties.getTimeoutSeconds(), "ServerManager");
    }

    /**
     * WebClient for the backup catalog. The read timeout has to cover a full backup creation.
     */
    @Bean(name = "backupServiceWebClient")
    public WebClient backupServiceWebClient(WebClient.Builder builder) {
        var timeout = Math.max(backupServiceProperties.getCreateTimeoutSeconds(), backupServiceProperties.getTimeoutSeconds());
        return createWebClient(builder, backupServiceProperties.getBaseUrl(), timeout, "BackupService");
    }

    @Bean(name = "auditServiceWebClient")
    public WebClient auditServiceWebClient(WebClient.Builder builder) {
        return createWebClient(builder, auditServiceProperties.getBaseUrl(), auditServiceProperties.getTimeoutSeconds(), "AuditService");
    }

    private WebClient createWebClient(WebClient.Builder builder, String baseUrl, int timeoutSeconds, String serviceName) {
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutSeconds * 1000L, 30_000L))
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("X-Service-Name", "backup-scheduler")
                .filter(logRequest(serviceName))
                .filter(logErrorResponse(serviceName))
                .build();
    }

    private ExchangeFilterFunction logRequest(String serviceName) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[{}] Request: {} {}", serviceName, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logErrorResponse(String serviceName) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                log.warn("[{}] Error response: {}", serviceName, clientResponse.statusCode());
            } else {
                log.debug("[{}] Response status: {}", serviceName, clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}

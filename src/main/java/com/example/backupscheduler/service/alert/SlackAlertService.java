package com.example.backupscheduler.service.alert;

import com.example.backupscheduler.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Sends alerts to Slack when the scheduler cannot persist its work.
 * <p>
 * Storage failures on the loop path never stop the loop. They surface only in
 * the logs and through these alerts.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:backup-scheduler}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Storage retries ran out while the loop was persisting the outcome of a scheduled backup.
     */
    @Async
    public void sendStorageRetriesExhaustedAlert(String resourceId, String operation, String errorMessage) {
        if (!slackProperties.isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Storage retries exhausted for server {} but no alert was sent.", resourceId);
            return;
        }

        try {
            var payload = buildStoragePayload(":rotating_light:", "*Backup Scheduler Storage Retries Exhausted*", "danger",
                    resourceId, operation, errorMessage);
            var response = slack.send(slackProperties.getWebhookUrl(), payload);

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for exhausted storage retries of server {}", resourceId);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for server {}: {}", resourceId, e.getMessage(), e);
        }
    }

    /**
     * Non-retryable storage failure on the loop path.
     */
    @Async
    public void sendStorageFailureAlert(String resourceId, String operation, String errorMessage) {
        if (!slackProperties.isConfigured()) {
            log.warn("Slack alerting disabled. Storage failure alert for server {} not sent", resourceId);
            return;
        }

        try {
            var payload = buildStoragePayload(":warning:", "*Backup Scheduler Storage Failure*", "warning",
                    resourceId, operation, errorMessage);
            slack.send(slackProperties.getWebhookUrl(), payload);
        } catch (Exception e) {
            log.error("Error sending Slack storage failure alert: {}", e.getMessage(), e);
        }
    }

    private Payload buildStoragePayload(String icon, String title, String color, String resourceId, String operation, String errorMessage) {
        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(icon)
                .text(icon + " " + title)
                .attachments(List.of(
                        Attachment.builder()
                                .color(color)
                                .title("Server " + resourceId)
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/api/v1/backup-schedules/resources/" + resourceId)
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Server")
                                                .value(resourceId)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Operation")
                                                .value(operation)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Error")
                                                .value("```" + truncate(errorMessage, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | Check the database and the schedule's event log")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}

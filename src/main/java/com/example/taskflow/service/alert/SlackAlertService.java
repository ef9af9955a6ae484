package com.example.taskflow.service.alert;

import com.example.taskflow.config.SlackProperties;
import com.example.taskflow.domain.model.ScheduledTask;
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
 * Service for sending alerts to Slack when scheduled work fails.
 * <p>
 * Alerts are fire-and-forget; a Slack outage is logged and never
 * affects the job that triggered the alert.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:taskflow-backend}")
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
     * Send task failure alert.
     * Runs asynchronously to not block the scheduler thread.
     */
    @Async
    public void sendTaskFailureAlert(ScheduledTask task, String errorMessage) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Task {} failed but no alert was sent.", task.getTaskId());
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":rotating_light:")
                    .text(":rotating_light: *Scheduled Task Failed*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("danger")
                                    .title("Task: " + task.getTaskType().getDisplayName())
                                    .fields(Arrays.asList(
                                            Field.builder()
                                                    .title("Task ID")
                                                    .value(task.getTaskId())
                                                    .valueShortEnough(true)
                                                    .build(),
                                            Field.builder()
                                                    .title("Schedule")
                                                    .value(task.getTrigger())
                                                    .valueShortEnough(true)
                                                    .build(),
                                            Field.builder()
                                                    .title("Runs")
                                                    .value(String.valueOf(task.getRunCount()))
                                                    .valueShortEnough(true)
                                                    .build(),
                                            Field.builder()
                                                    .title("Error")
                                                    .value("```" + truncate(errorMessage, 400) + "```")
                                                    .valueShortEnough(false)
                                                    .build()
                                    ))
                                    .footer(applicationName)
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for failed task {}", task.getTaskId());
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for task {}: {}", task.getTaskId(), e.getMessage(), e);
        }
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
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

package com.example.taskflow.service.handler;

import com.example.taskflow.config.MetricsConfig;
import com.example.taskflow.domain.model.ScheduledTask;
import com.example.taskflow.dto.UserSummary;
import com.example.taskflow.service.UserPreferencesService;
import com.example.taskflow.service.notification.PushNotificationService;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;

/**
 * Base for handlers that push an activity summary.
 * <p>
 * Expected parameters (all optional):
 * - userId, token: push the user's own summary to this device, gated by the user's preference
 * - topic: topic for the generic reminder when no user is set
 * - title, body: override the generic reminder text
 */
@Slf4j
abstract class SummaryTaskHandler implements TaskHandler {

    private final PushNotificationService pushNotificationService;
    private final UserPreferencesService userPreferencesService;
    private final MetricsConfig metricsConfig;

    SummaryTaskHandler(PushNotificationService pushNotificationService,
                       UserPreferencesService userPreferencesService,
                       MetricsConfig metricsConfig) {
        this.pushNotificationService = pushNotificationService;
        this.userPreferencesService = userPreferencesService;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Preference category that gates the personal push
     */
    protected abstract String category();

    protected abstract String defaultTopic();

    protected abstract String title();

    /**
     * Phrase naming the window, e.g. "today"
     */
    protected abstract String windowLabel();

    protected abstract UserSummary summarize(String userId);

    @Override
    public TaskExecutionResult execute(ScheduledTask task) {
        var userId = task.getStringParameter("userId", null);
        var token = task.getStringParameter("token", null);

        try {
            if (userId != null && token != null) {
                return sendPersonalSummary(task, userId, token);
            }

            var topic = task.getStringParameter("topic", defaultTopic());
            var messageId = pushNotificationService.sendToTopic(
                    topic,
                    task.getStringParameter("title", title()),
                    task.getStringParameter("body", String.format("Your %s is ready", title().toLowerCase(Locale.ROOT))),
                    Map.of("type", category(), "task_id", task.getTaskId()));
            log.info("Task {} sent {} to topic {}", task.getTaskId(), category(), topic);
            return TaskExecutionResult.success(Map.of("messageId", messageId, "topic", topic));
        } catch (Exception e) {
            log.error("Task {} failed to send {}: {}", task.getTaskId(), category(), e.getMessage());
            return TaskExecutionResult.failure(e);
        }
    }

    private TaskExecutionResult sendPersonalSummary(ScheduledTask task, String userId, String token) {
        if (!userPreferencesService.shouldSend(userId, category())) {
            log.info("Task {} skipped: user {} opted out of {}", task.getTaskId(), userId, category());
            metricsConfig.recordNotificationSuppressed(category());
            return TaskExecutionResult.suppressed("Notification suppressed by user preferences");
        }

        var summary = summarize(userId);
        var totals = summary.getSummary();
        var body = String.format(Locale.ROOT, "You completed %d tasks across %d projects %s. Productivity score: %.1f",
                totals.getTasksCompleted(), totals.getProjectsActive(), windowLabel(), totals.getProductivityScore());

        var messageId = pushNotificationService.sendToUser(token, title(), body, Map.of(
                "type", category(),
                "task_id", task.getTaskId(),
                "tasks_completed", String.valueOf(totals.getTasksCompleted())));
        log.info("Task {} sent {} to user {}", task.getTaskId(), category(), userId);
        return TaskExecutionResult.success(Map.of("messageId", messageId, "userId", userId));
    }
}

package com.example.taskflow.service.handler;

import com.example.taskflow.config.MetricsConfig;
import com.example.taskflow.domain.enums.TaskType;
import com.example.taskflow.domain.model.ScheduledTask;
import com.example.taskflow.dto.UserSummary;
import com.example.taskflow.scheduling.TriggerSpec;
import com.example.taskflow.service.AnalyticsService;
import com.example.taskflow.service.UserPreferencesService;
import com.example.taskflow.service.notification.PushNotificationService;
import org.springframework.stereotype.Component;

/**
 * Handler for daily_summary tasks.
 * <p>
 * Fires every day at parameters.hour:parameters.minute (default 09:00)
 * in parameters.timezone (default UTC).
 */
@Component
public class DailySummaryHandler extends SummaryTaskHandler {

    private final AnalyticsService analyticsService;

    public DailySummaryHandler(PushNotificationService pushNotificationService,
                               UserPreferencesService userPreferencesService,
                               AnalyticsService analyticsService,
                               MetricsConfig metricsConfig) {
        super(pushNotificationService, userPreferencesService, metricsConfig);
        this.analyticsService = analyticsService;
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.DAILY_SUMMARY;
    }

    @Override
    public TriggerSpec buildTrigger(ScheduledTask task) {
        return TriggerSpec.DailyAt.of(
                task.getIntParameter("hour", 9),
                task.getIntParameter("minute", 0),
                task.getStringParameter("timezone", null));
    }

    @Override
    protected String category() {
        return "daily_summary";
    }

    @Override
    protected String defaultTopic() {
        return "daily-summary";
    }

    @Override
    protected String title() {
        return "Daily Summary";
    }

    @Override
    protected String windowLabel() {
        return "today";
    }

    @Override
    protected UserSummary summarize(String userId) {
        return analyticsService.generateDailySummary(userId);
    }
}

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
 * Handler for weekly_report tasks.
 * <p>
 * Fires on parameters.dayOfWeek (default Monday) at parameters.hour:parameters.minute
 * (default 09:00) in parameters.timezone (default UTC).
 */
@Component
public class WeeklyReportHandler extends SummaryTaskHandler {

    private final AnalyticsService analyticsService;

    public WeeklyReportHandler(PushNotificationService pushNotificationService,
                               UserPreferencesService userPreferencesService,
                               AnalyticsService analyticsService,
                               MetricsConfig metricsConfig) {
        super(pushNotificationService, userPreferencesService, metricsConfig);
        this.analyticsService = analyticsService;
    }

    @Override
    public TaskType getTaskType() {
        return TaskType.WEEKLY_REPORT;
    }

    @Override
    public TriggerSpec buildTrigger(ScheduledTask task) {
        return TriggerSpec.WeeklyAt.of(
                task.getStringParameter("dayOfWeek", "mon"),
                task.getIntParameter("hour", 9),
                task.getIntParameter("minute", 0),
                task.getStringParameter("timezone", null));
    }

    @Override
    protected String category() {
        return "weekly_summary";
    }

    @Override
    protected String defaultTopic() {
        return "weekly-report";
    }

    @Override
    protected String title() {
        return "Weekly Report";
    }

    @Override
    protected String windowLabel() {
        return "this week";
    }

    @Override
    protected UserSummary summarize(String userId) {
        return analyticsService.generateWeeklyReport(userId);
    }
}

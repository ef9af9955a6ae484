package com.example.taskflow.service.handler;

import com.example.taskflow.config.MetricsConfig;
import com.example.taskflow.domain.enums.TaskType;
import com.example.taskflow.domain.model.ScheduledTask;
import com.example.taskflow.exception.InvalidTriggerException;
import com.example.taskflow.scheduling.TriggerSpec;
import com.example.taskflow.service.AnalyticsService;
import com.example.taskflow.service.UserPreferencesService;
import com.example.taskflow.service.notification.PushNotificationService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WeeklyReportHandler Tests")
class WeeklyReportHandlerTest {

    @Mock
    private PushNotificationService pushNotificationService;

    @Mock
    private UserPreferencesService userPreferencesService;

    @Mock
    private AnalyticsService analyticsService;

    private WeeklyReportHandler handler;

    @BeforeEach
    void setUp() {
        handler = new WeeklyReportHandler(pushNotificationService, userPreferencesService, analyticsService,
                new MetricsConfig(new SimpleMeterRegistry()));
    }

    private static ScheduledTask task(Map<String, Object> parameters) {
        return ScheduledTask.builder()
                .taskId("scheduled_task_4")
                .taskType(TaskType.WEEKLY_REPORT)
                .parameters(new HashMap<>(parameters))
                .build();
    }

    @Test
    @DisplayName("Should default to Monday 09:00 UTC")
    void shouldDefaultToMondayMorning() {
        assertThat(handler.buildTrigger(task(Map.of())))
                .isEqualTo(new TriggerSpec.WeeklyAt(DayOfWeek.MONDAY, 9, 0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should accept numeric weekday")
    void shouldAcceptNumericWeekday() {
        var trigger = (TriggerSpec.WeeklyAt) handler.buildTrigger(task(Map.of("dayOfWeek", "4", "hour", 17)));

        assertThat(trigger.weekday()).isEqualTo(DayOfWeek.FRIDAY);
        assertThat(trigger.hour()).isEqualTo(17);
    }

    @Test
    @DisplayName("Should reject unknown weekday")
    void shouldRejectUnknownWeekday() {
        assertThatThrownBy(() -> handler.buildTrigger(task(Map.of("dayOfWeek", "someday"))))
                .isInstanceOf(InvalidTriggerException.class);
    }

    @Test
    @DisplayName("Should push weekly reminder to the default topic")
    void shouldPushToDefaultTopic() {
        when(pushNotificationService.sendToTopic(eq("weekly-report"), eq("Weekly Report"), anyString(), anyMap()))
                .thenReturn("msg-7");

        var result = handler.execute(task(Map.of()));

        assertThat(result.isSuccess()).isTrue();
        verify(pushNotificationService).sendToTopic(eq("weekly-report"), eq("Weekly Report"), eq("Your weekly report is ready"), anyMap());
        verifyNoInteractions(analyticsService);
    }

    @Test
    @DisplayName("Should gate personal report on the weekly_summary preference")
    void shouldGateOnWeeklySummaryPreference() {
        when(userPreferencesService.shouldSend("u2", "weekly_summary")).thenReturn(false);

        var result = handler.execute(task(Map.of("userId", "u2", "token", "device-2")));

        assertThat(result.isSuppressed()).isTrue();
        verifyNoInteractions(pushNotificationService, analyticsService);
    }
}

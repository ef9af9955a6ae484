package com.example.taskflow.service.handler;

import com.example.taskflow.domain.enums.TaskType;
import com.example.taskflow.domain.model.ScheduledTask;
import com.example.taskflow.exception.DeliveryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import com.example.taskflow.service.notification.PushNotificationService;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CustomTaskHandler Tests")
class CustomTaskHandlerTest {

    @Mock
    private PushNotificationService pushNotificationService;

    @InjectMocks
    private CustomTaskHandler handler;

    private static ScheduledTask task(String schedule, Map<String, Object> parameters) {
        return ScheduledTask.builder()
                .taskId("scheduled_task_9")
                .taskType(TaskType.CUSTOM)
                .schedule(schedule)
                .parameters(new HashMap<>(parameters))
                .build();
    }

    @Test
    @DisplayName("Should require a schedule")
    void shouldRequireSchedule() {
        assertThatThrownBy(() -> handler.validate(task(null, Map.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Schedule is required");
    }

    @Test
    @DisplayName("Should send default reminder to task-reminders")
    void shouldSendDefaultReminder() {
        when(pushNotificationService.sendToTopic(eq("task-reminders"), anyString(), anyString(), anyMap())).thenReturn("msg-3");

        var result = handler.execute(task("0 9 * * *", Map.of()));

        assertThat(result.isSuccess()).isTrue();
        verify(pushNotificationService).sendToTopic(eq("task-reminders"), eq("Task Reminder"),
                eq("You have tasks that need attention"), anyMap());
    }

    @Test
    @DisplayName("Should use the task's own topic and text")
    void shouldUseOwnTopicAndText() {
        when(pushNotificationService.sendToTopic(eq("team-ops"), eq("Standup"), eq("Standup in 5 minutes"), anyMap())).thenReturn("msg-4");

        var result = handler.execute(task("55 9 * * MON-FRI",
                Map.of("topic", "team-ops", "title", "Standup", "body", "Standup in 5 minutes")));

        assertThat(result.getResponseData()).containsEntry("messageId", "msg-4").containsEntry("topic", "team-ops");
    }

    @Test
    @DisplayName("Should report delivery failures without throwing")
    void shouldReportDeliveryFailure() {
        when(pushNotificationService.sendToTopic(anyString(), anyString(), anyString(), anyMap()))
                .thenThrow(new DeliveryException("Failed to send topic notification: quota exceeded"));

        var result = handler.execute(task("0 9 * * *", Map.of()));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorType()).isEqualTo("DeliveryException");
        assertThat(result.getErrorMessage()).contains("quota exceeded");
    }
}

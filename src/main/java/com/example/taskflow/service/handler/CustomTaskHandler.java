package com.example.taskflow.service.handler;

import com.example.taskflow.domain.enums.TaskType;
import com.example.taskflow.domain.model.ScheduledTask;
import com.example.taskflow.scheduling.TriggerSpec;
import com.example.taskflow.service.notification.PushNotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Handler for custom tasks.
 * <p>
 * Fires on the task's cron schedule (five or six fields) in parameters.timezone.
 * <p>
 * Expected parameters (all optional):
 * - topic: target topic (default task-reminders)
 * - title, body: reminder text
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CustomTaskHandler implements TaskHandler {

    static final String DEFAULT_TOPIC = "task-reminders";
    static final String DEFAULT_TITLE = "Task Reminder";
    static final String DEFAULT_BODY = "You have tasks that need attention";

    private final PushNotificationService pushNotificationService;

    @Override
    public TaskType getTaskType() {
        return TaskType.CUSTOM;
    }

    @Override
    public void validate(ScheduledTask task) {
        if (task.getSchedule() == null || task.getSchedule().isBlank()) {
            throw new IllegalArgumentException("Schedule is required for custom tasks");
        }
    }

    @Override
    public TriggerSpec buildTrigger(ScheduledTask task) {
        return TriggerSpec.Cron.of(task.getSchedule(), task.getStringParameter("timezone", null));
    }

    @Override
    public TaskExecutionResult execute(ScheduledTask task) {
        var topic = task.getStringParameter("topic", DEFAULT_TOPIC);
        try {
            var messageId = pushNotificationService.sendToTopic(
                    topic,
                    task.getStringParameter("title", DEFAULT_TITLE),
                    task.getStringParameter("body", DEFAULT_BODY),
                    Map.of("type", "custom", "task_id", task.getTaskId()));
            log.info("Task {} sent reminder to topic {}", task.getTaskId(), topic);
            return TaskExecutionResult.success(Map.of("messageId", messageId, "topic", topic));
        } catch (Exception e) {
            log.error("Task {} failed to send reminder to topic {}: {}", task.getTaskId(), topic, e.getMessage());
            return TaskExecutionResult.failure(e);
        }
    }
}

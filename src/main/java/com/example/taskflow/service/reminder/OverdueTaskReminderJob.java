package com.example.taskflow.service.reminder;

import com.example.taskflow.config.SchedulerProperties;
import com.example.taskflow.scheduling.JobRegistry;
import com.example.taskflow.scheduling.TriggerSpec;
import com.example.taskflow.service.notification.PushNotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Periodic reminder about overdue tasks, pushed to a topic.
 * <p>
 * Registered with the job registry once the application is ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OverdueTaskReminderJob {

    public static final String JOB_ID = "overdue_task_check";

    static final String TITLE = "Task Reminder";
    static final String BODY = "You have tasks that need attention";

    private final JobRegistry jobRegistry;
    private final PushNotificationService pushNotificationService;
    private final SchedulerProperties schedulerProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void register() {
        var config = schedulerProperties.getOverdueReminder();
        if (!config.isEnabled()) {
            log.info("Overdue task reminder is disabled");
            return;
        }
        if (jobRegistry.contains(JOB_ID)) {
            return;
        }
        jobRegistry.add(JOB_ID, new TriggerSpec.Interval(config.getIntervalMinutes()), this::sendReminder);
        log.info("Overdue task reminder scheduled every {} minutes to topic {}", config.getIntervalMinutes(), config.getTopic());
    }

    /**
     * Push the reminder. Failures are logged; the next firing still happens.
     */
    public void sendReminder() {
        var topic = schedulerProperties.getOverdueReminder().getTopic();
        log.info("Checking for overdue tasks...");
        try {
            var messageId = pushNotificationService.sendToTopic(topic, TITLE, BODY, null);
            log.info("Sent overdue task reminder {} to topic {}", messageId, topic);
        } catch (Exception e) {
            log.error("Error sending overdue task reminder to topic {}: {}", topic, e.getMessage());
        }
    }
}

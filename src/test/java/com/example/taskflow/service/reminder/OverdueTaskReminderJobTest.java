package com.example.taskflow.service.reminder;

import com.example.taskflow.config.SchedulerProperties;
import com.example.taskflow.exception.DeliveryException;
import com.example.taskflow.scheduling.JobRegistry;
import com.example.taskflow.scheduling.TriggerSpec;
import com.example.taskflow.service.notification.PushNotificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OverdueTaskReminderJob Tests")
class OverdueTaskReminderJobTest {

    @Mock
    private JobRegistry jobRegistry;

    @Mock
    private PushNotificationService pushNotificationService;

    private SchedulerProperties schedulerProperties;
    private OverdueTaskReminderJob job;

    @BeforeEach
    void setUp() {
        schedulerProperties = new SchedulerProperties();
        job = new OverdueTaskReminderJob(jobRegistry, pushNotificationService, schedulerProperties);
    }

    @Test
    @DisplayName("Should register a 30 minute interval job by default")
    void shouldRegisterIntervalJob() {
        job.register();

        var callback = ArgumentCaptor.forClass(Runnable.class);
        verify(jobRegistry).add(eq(OverdueTaskReminderJob.JOB_ID), eq(new TriggerSpec.Interval(30)), callback.capture());

        when(pushNotificationService.sendToTopic("task-reminders", OverdueTaskReminderJob.TITLE, OverdueTaskReminderJob.BODY, null))
                .thenReturn("msg-1");
        callback.getValue().run();
        verify(pushNotificationService).sendToTopic("task-reminders", OverdueTaskReminderJob.TITLE, OverdueTaskReminderJob.BODY, null);
    }

    @Test
    @DisplayName("Should not register twice")
    void shouldNotRegisterTwice() {
        when(jobRegistry.contains(OverdueTaskReminderJob.JOB_ID)).thenReturn(true);

        job.register();

        verify(jobRegistry, never()).add(any(), any(), any());
    }

    @Test
    @DisplayName("Should stay off when disabled")
    void shouldStayOffWhenDisabled() {
        schedulerProperties.getOverdueReminder().setEnabled(false);

        job.register();

        verifyNoInteractions(jobRegistry);
    }

    @Test
    @DisplayName("Should swallow delivery failures so later firings still run")
    void shouldSurviveDeliveryFailure() {
        when(pushNotificationService.sendToTopic(eq("task-reminders"), any(), any(), isNull()))
                .thenThrow(new DeliveryException("Failed to send topic notification"));

        assertThatCode(() -> job.sendReminder()).doesNotThrowAnyException();
    }
}

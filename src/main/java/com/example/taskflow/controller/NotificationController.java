package com.example.taskflow.controller;

import com.example.taskflow.config.MetricsConfig;
import com.example.taskflow.dto.BulkNotificationRequest;
import com.example.taskflow.dto.BulkSendResult;
import com.example.taskflow.dto.NotificationResponse;
import com.example.taskflow.dto.SendNotificationRequest;
import com.example.taskflow.dto.TaskAssignmentRequest;
import com.example.taskflow.dto.TopicNotificationRequest;
import com.example.taskflow.service.UserPreferencesService;
import com.example.taskflow.service.notification.PushNotificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API controller for push notifications.
 * <p>
 * Provides endpoints for:
 * - Single device and topic pushes
 * - Task assignment pushes, gated by the assignee's preferences
 * - Bulk pushes to many devices
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
@Tag(name = "Notifications", description = "APIs for sending push notifications")
public class NotificationController {

    static final String DEFAULT_USER_ID = "default_user";
    static final String SUPPRESSED_MESSAGE = "Notification suppressed by user preferences";

    private final PushNotificationService pushNotificationService;
    private final UserPreferencesService userPreferencesService;
    private final MetricsConfig metricsConfig;

    @PostMapping("/send-notification")
    @Operation(summary = "Send to device", description = "Send a push notification to one device token")
    public NotificationResponse sendNotification(@Valid @RequestBody SendNotificationRequest request) {
        log.info("API: Send notification");
        var messageId = pushNotificationService.sendToUser(request.getToken(), request.getTitle(), request.getBody(), request.getData());
        return NotificationResponse.sent(messageId);
    }

    @PostMapping("/send-topic-notification")
    @Operation(summary = "Send to topic", description = "Send a push notification to every subscriber of a topic")
    public NotificationResponse sendTopicNotification(@Valid @RequestBody TopicNotificationRequest request) {
        log.info("API: Send notification to topic {}", request.getTopic());
        var messageId = pushNotificationService.sendToTopic(request.getTopic(), request.getTitle(), request.getBody(), request.getData());
        return NotificationResponse.sent(messageId);
    }

    @PostMapping("/notify-task-assignment")
    @Operation(summary = "Notify task assignment",
            description = "Tell an assignee about a new task unless they turned task assignment notifications off")
    public NotificationResponse notifyTaskAssignment(@Valid @RequestBody TaskAssignmentRequest request,
                                                     @AuthenticationPrincipal Jwt principal) {
        var userId = resolveUserId(request.getUserId(), principal);
        if (!userPreferencesService.shouldSend(userId, "task_assignment")) {
            log.info("API: Task assignment notification for user {} suppressed by preferences", userId);
            metricsConfig.recordNotificationSuppressed("task_assignment");
            return NotificationResponse.suppressed(SUPPRESSED_MESSAGE);
        }

        log.info("API: Task assignment notification for user {}", userId);
        var messageId = pushNotificationService.sendTaskAssignment(
                request.getAssigneeToken(), request.getTaskTitle(), request.getProjectName(), request.getDueDate());
        return NotificationResponse.sent(messageId);
    }

    @PostMapping("/send-bulk-notifications")
    @Operation(summary = "Send to many devices", description = "Send one notification to many device tokens in batches of 500")
    public BulkSendResult sendBulkNotifications(@Valid @RequestBody BulkNotificationRequest request) {
        log.info("API: Bulk notification to {} tokens", request.getTokens().size());
        return pushNotificationService.sendBulk(request.getTokens(), request.getTitle(), request.getBody(), request.getData());
    }

    private static String resolveUserId(String requested, Jwt principal) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        if (principal != null && principal.getSubject() != null) {
            return principal.getSubject();
        }
        return DEFAULT_USER_ID;
    }
}

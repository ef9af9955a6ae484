package com.example.taskflow.service.notification;

import com.example.taskflow.config.FirebaseProperties;
import com.example.taskflow.config.MetricsConfig;
import com.example.taskflow.dto.BulkSendResult;
import com.example.taskflow.exception.DeliveryException;
import com.google.api.core.ApiFuture;
import com.google.firebase.messaging.BatchResponse;
import com.google.firebase.messaging.FirebaseMessagingException;
import com.google.firebase.messaging.Message;
import com.google.firebase.messaging.MessagingErrorCode;
import com.google.firebase.messaging.MulticastMessage;
import com.google.firebase.messaging.Notification;
import com.google.firebase.messaging.SendResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends push notifications through Firebase Cloud Messaging.
 * <p>
 * Every gateway call is bounded by {@code firebase.send-timeout-seconds}.
 * Gateway errors, rejected tokens and timeouts surface as {@link DeliveryException};
 * nothing is retried here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PushNotificationService {

    /**
     * Most tokens FCM accepts in one multicast call
     */
    public static final int MAX_BATCH_SIZE = 500;

    static final String BATCH_FAILED = "BATCH_FAILED";
    static final String INVALID_TOKEN = MessagingErrorCode.INVALID_ARGUMENT.name();

    private final FirebaseMessagingProvider messagingProvider;
    private final FirebaseProperties properties;
    private final MetricsConfig metricsConfig;

    /**
     * Send a notification to one device
     *
     * @return the gateway's message id
     */
    public String sendToUser(String token, String title, String body, Map<String, String> data) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Device token is required");
        }
        var message = Message.builder()
                .setToken(token)
                .setNotification(notification(title, body))
                .putAllData(safeData(data))
                .build();

        try {
            var messageId = await(messagingProvider.ensureInitialized().sendAsync(message), "Failed to send notification");
            metricsConfig.recordNotifications("user", true, 1);
            log.info("Sent notification {} to device", messageId);
            return messageId;
        } catch (DeliveryException e) {
            metricsConfig.recordNotifications("user", false, 1);
            log.error("Notification to device failed: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Send a notification to every device subscribed to a topic
     */
    public String sendToTopic(String topic, String title, String body, Map<String, String> data) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Topic is required");
        }
        var message = Message.builder()
                .setTopic(topic)
                .setNotification(notification(title, body))
                .putAllData(safeData(data))
                .build();

        try {
            var messageId = await(messagingProvider.ensureInitialized().sendAsync(message), "Failed to send topic notification");
            metricsConfig.recordNotifications("topic", true, 1);
            log.info("Sent notification {} to topic {}", messageId, topic);
            return messageId;
        } catch (DeliveryException e) {
            metricsConfig.recordNotifications("topic", false, 1);
            log.error("Notification to topic {} failed: {}", topic, e.getMessage());
            throw e;
        }
    }

    /**
     * Send the same notification to many devices, {@value #MAX_BATCH_SIZE} tokens per gateway call.
     * <p>
     * Null or blank tokens are counted as {@code INVALID_ARGUMENT} failures without a gateway call.
     * A batch that fails as a whole counts all of its tokens as failed and the remaining batches
     * are still sent, so the counts always add up to the number of submitted tokens.
     */
    public BulkSendResult sendBulk(List<String> tokens, String title, String body, Map<String, String> data) {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("Tokens are required");
        }
        var payload = safeData(data);
        var result = BulkSendResult.builder().build();

        var deliverable = new ArrayList<String>(tokens.size());
        for (var token : tokens) {
            if (token == null || token.isBlank()) {
                addFailure(result, token, INVALID_TOKEN);
            } else {
                deliverable.add(token);
            }
        }
        if (result.getFailureCount() > 0) {
            log.warn("Bulk send skipping {} blank tokens", result.getFailureCount());
        }

        if (!deliverable.isEmpty()) {
            var messaging = messagingProvider.ensureInitialized();
            for (int start = 0; start < deliverable.size(); start += MAX_BATCH_SIZE) {
                var batch = deliverable.subList(start, Math.min(start + MAX_BATCH_SIZE, deliverable.size()));
                try {
                    var message = MulticastMessage.builder()
                            .addAllTokens(batch)
                            .setNotification(notification(title, body))
                            .putAllData(payload)
                            .build();
                    BatchResponse response = await(messaging.sendEachForMulticastAsync(message), "Failed to send batch");
                    var responses = response.getResponses();
                    for (int i = 0; i < batch.size(); i++) {
                        var sendResponse = i < responses.size() ? responses.get(i) : null;
                        if (sendResponse != null && sendResponse.isSuccessful()) {
                            result.setSuccessCount(result.getSuccessCount() + 1);
                        } else {
                            addFailure(result, batch.get(i), errorCode(sendResponse));
                        }
                    }
                } catch (RuntimeException e) {
                    log.error("Batch of {} tokens starting at {} failed: {}", batch.size(), start, e.getMessage());
                    batch.forEach(token -> addFailure(result, token, BATCH_FAILED));
                }
            }
        }

        metricsConfig.recordNotifications("bulk", true, result.getSuccessCount());
        metricsConfig.recordNotifications("bulk", false, result.getFailureCount());
        log.info("Bulk send finished: {} sent, {} failed", result.getSuccessCount(), result.getFailureCount());
        return result;
    }

    /**
     * Notify an assignee about a task they were given
     */
    public String sendTaskAssignment(String token, String taskTitle, String projectName, String dueDate) {
        var hasDueDate = dueDate != null && !dueDate.isBlank();
        var body = String.format("You have been assigned a new task: %s in %s", taskTitle, projectName);
        if (hasDueDate) {
            body += " (Due: " + dueDate + ")";
        }

        var data = new LinkedHashMap<String, String>();
        data.put("type", "task_assignment");
        data.put("task_title", taskTitle);
        data.put("project_name", projectName);
        if (hasDueDate) {
            data.put("due_date", dueDate);
        }
        return sendToUser(token, "New Task Assigned", body, data);
    }

    private <T> T await(ApiFuture<T> future, String failureMessage) {
        var timeout = properties.getSendTimeoutSeconds();
        try {
            return future.get(timeout, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof FirebaseMessagingException fme && fme.getMessagingErrorCode() != null) {
                throw new DeliveryException(failureMessage, fme.getMessagingErrorCode().name(), fme);
            }
            throw new DeliveryException(failureMessage, cause);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DeliveryException(String.format("%s: no response within %d seconds", failureMessage, timeout));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException(failureMessage + ": interrupted", e);
        }
    }

    private static void addFailure(BulkSendResult result, String token, String errorCode) {
        result.setFailureCount(result.getFailureCount() + 1);
        result.getFailures().add(new BulkSendResult.TokenFailure(token, errorCode));
    }

    private static String errorCode(SendResponse response) {
        if (response == null || response.getException() == null) {
            return "UNKNOWN";
        }
        var exception = response.getException();
        if (exception.getMessagingErrorCode() != null) {
            return exception.getMessagingErrorCode().name();
        }
        return exception.getErrorCode() != null ? exception.getErrorCode().name() : "UNKNOWN";
    }

    private static Notification notification(String title, String body) {
        return Notification.builder()
                .setTitle(title)
                .setBody(body)
                .build();
    }

    /**
     * @throws IllegalArgumentException if a data entry has a null key or value
     */
    private static Map<String, String> safeData(Map<String, String> data) {
        if (data == null) {
            return Map.of();
        }
        for (var entry : data.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException(String.format("Data value for '%s' must not be null", entry.getKey()));
            }
        }
        return data;
    }
}

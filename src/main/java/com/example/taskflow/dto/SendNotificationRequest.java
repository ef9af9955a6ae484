package com.example.taskflow.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request for a push to a single device token
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendNotificationRequest {

    @NotBlank(message = "Device token is required")
    private String token;

    @Builder.Default
    private String title = NotificationDefaults.TITLE;

    @Builder.Default
    private String body = NotificationDefaults.BODY;

    /**
     * Optional data payload delivered alongside the notification
     */
    private Map<String, String> data;
}

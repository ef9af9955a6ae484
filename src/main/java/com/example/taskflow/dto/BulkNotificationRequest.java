package com.example.taskflow.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request for a push to many device tokens.
 * Tokens are delivered in gateway-sized batches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkNotificationRequest {

    @NotEmpty(message = "Tokens are required")
    private List<String> tokens;

    @Builder.Default
    private String title = NotificationDefaults.TITLE;

    @Builder.Default
    private String body = NotificationDefaults.BODY;

    private Map<String, String> data;
}

package com.example.taskflow.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicNotificationRequest {

    @NotBlank(message = "Topic is required")
    private String topic;

    @Builder.Default
    private String title = NotificationDefaults.TITLE;

    @Builder.Default
    private String body = NotificationDefaults.BODY;

    private Map<String, String> data;
}

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
public class AnalyticsEventRequest {

    @NotBlank(message = "userId is required")
    private String userId;

    @NotBlank(message = "eventType is required")
    private String eventType;

    private Map<String, Object> eventData;
}

package com.example.taskflow.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for creating a new scheduled task
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateScheduledTaskRequest {

    /**
     * One of daily_summary, weekly_report, custom
     */
    @NotBlank(message = "Task type is required")
    private String taskType;

    /**
     * Cron expression, required for custom tasks
     */
    private String schedule;

    /**
     * Task-specific parameters: hour, minute, timezone, dayOfWeek,
     * and the push target (userId, token, topic, title, body)
     */
    private Map<String, Object> parameters;

    private String description;
}

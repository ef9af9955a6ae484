package com.example.taskflow.dto;

import com.example.taskflow.domain.enums.TaskType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for scheduled task data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledTaskResponse {

    private String taskId;
    private TaskType taskType;
    private String schedule;
    private Map<String, Object> parameters;
    private String description;
    private boolean enabled;
    private Instant createdAt;
    private String jobId;
    private String trigger;
    private Instant nextRunAt;
    private Instant lastRunAt;
    private String lastError;
    private long runCount;
}

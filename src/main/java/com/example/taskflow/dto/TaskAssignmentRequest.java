package com.example.taskflow.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to notify an assignee about a newly assigned task.
 * Delivery is gated by the user's taskAssignment preference.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskAssignmentRequest {

    @NotBlank(message = "assigneeToken is required")
    private String assigneeToken;

    @NotBlank(message = "taskTitle is required")
    private String taskTitle;

    @NotBlank(message = "projectName is required")
    private String projectName;

    private String dueDate;

    /**
     * User whose preferences gate the push; defaults to the authenticated user
     */
    private String userId;
}

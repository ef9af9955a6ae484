package com.example.taskflow.service.handler;

import com.example.taskflow.exception.DeliveryException;
import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Represents the result of one task execution.
 * <p>
 * Carries what the runner needs to update the task's run bookkeeping,
 * record metrics and decide whether to alert.
 */
@Data
@Builder
public class TaskExecutionResult {

    private boolean success;

    /**
     * True when the task ran but sent nothing, e.g. the user opted out
     */
    private boolean suppressed;

    private String errorMessage;

    /**
     * Error type/classification for metrics
     */
    private String errorType;

    /**
     * Details of what was sent (message id, target, counts)
     */
    @Builder.Default
    private Map<String, Object> responseData = new HashMap<>();

    private String notes;

    public static TaskExecutionResult success(Map<String, Object> responseData) {
        return TaskExecutionResult.builder()
                .success(true)
                .responseData(responseData != null ? new HashMap<>(responseData) : new HashMap<>())
                .build();
    }

    /**
     * Create a success result for a run that was gated off
     */
    public static TaskExecutionResult suppressed(String reason) {
        return TaskExecutionResult.builder()
                .success(true)
                .suppressed(true)
                .notes(reason)
                .build();
    }

    /**
     * Create a failure result from exception. Delivery errors keep the gateway's error code.
     */
    public static TaskExecutionResult failure(Exception e) {
        var errorType = e.getClass().getSimpleName();
        if (e instanceof DeliveryException delivery && delivery.getErrorCode() != null) {
            errorType = delivery.getErrorCode();
        }
        return TaskExecutionResult.builder()
                .success(false)
                .errorMessage(e.getMessage())
                .errorType(errorType)
                .build();
    }
}

package com.example.taskflow.service.handler;

import com.example.taskflow.domain.enums.TaskType;
import com.example.taskflow.domain.model.ScheduledTask;
import com.example.taskflow.scheduling.TriggerSpec;

/**
 * Interface for task handlers.
 * <p>
 * Each task type has a handler that knows when the task fires and what it does
 * when it fires.
 * <p>
 * Handlers should:
 * - Be stateless
 * - Translate their own delivery errors into results
 * - Never throw from {@link #execute(ScheduledTask)}
 */
public interface TaskHandler {

    /**
     * Get the task type this handler supports
     */
    TaskType getTaskType();

    /**
     * Build the trigger for a new task from its schedule and parameters
     *
     * @throws com.example.taskflow.exception.InvalidTriggerException if the schedule is unusable
     */
    TriggerSpec buildTrigger(ScheduledTask task);

    /**
     * Execute the task
     *
     * @param task The task to execute
     * @return Result of the execution
     */
    TaskExecutionResult execute(ScheduledTask task);

    /**
     * Check if this handler supports the given task type
     */
    default boolean supports(TaskType taskType) {
        return getTaskType() == taskType;
    }

    /**
     * Validate task parameters before registration (optional override)
     *
     * @throws IllegalArgumentException if validation fails
     */
    default void validate(ScheduledTask task) {
    }
}

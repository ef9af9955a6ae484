package com.example.taskflow.exception;

import lombok.Getter;

/**
 * Exception for task not found
 */
@Getter
public class TaskNotFoundException extends TaskFlowException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super(ErrorKind.NOT_FOUND, "Task not found: " + taskId);
        this.taskId = taskId;
    }
}

package com.example.taskflow.exception;

import lombok.Getter;

/**
 * Base class for all errors raised by the service layer.
 */
@Getter
public abstract class TaskFlowException extends RuntimeException {

    private final ErrorKind kind;

    protected TaskFlowException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TaskFlowException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}

package com.example.taskflow.exception;

/**
 * Exception for schedule parameters that cannot form a trigger
 */
public class InvalidTriggerException extends TaskFlowException {

    public InvalidTriggerException(String message) {
        super(ErrorKind.INVALID_TRIGGER, message);
    }

    public InvalidTriggerException(String message, Throwable cause) {
        super(ErrorKind.INVALID_TRIGGER, message, cause);
    }
}

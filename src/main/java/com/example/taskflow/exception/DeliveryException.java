package com.example.taskflow.exception;

import lombok.Getter;

/**
 * Exception for push gateway failures.
 * <p>
 * Wraps the gateway's own message and, when the gateway reported one,
 * its error code (for example UNREGISTERED or INVALID_ARGUMENT).
 */
@Getter
public class DeliveryException extends TaskFlowException {

    private final String errorCode;

    public DeliveryException(String message) {
        super(ErrorKind.DELIVERY, message);
        this.errorCode = null;
    }

    public DeliveryException(String message, Throwable cause) {
        super(ErrorKind.DELIVERY, String.format("%s: %s", message, cause.getMessage()), cause);
        this.errorCode = null;
    }

    public DeliveryException(String message, String errorCode, Throwable cause) {
        super(ErrorKind.DELIVERY, String.format("%s [%s]: %s", message, errorCode, cause.getMessage()), cause);
        this.errorCode = errorCode;
    }
}

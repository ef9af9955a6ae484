package com.example.taskflow.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Classification of every error the service surfaces to a caller.
 * Callers branch on the kind rather than on the message text.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    VALIDATION(HttpStatus.BAD_REQUEST),
    AUTH(HttpStatus.UNAUTHORIZED),
    RATE_LIMIT(HttpStatus.TOO_MANY_REQUESTS),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    DELIVERY(HttpStatus.INTERNAL_SERVER_ERROR),
    INVALID_TRIGGER(HttpStatus.BAD_REQUEST),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;
}

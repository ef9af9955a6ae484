package com.example.taskflow.exception;

import lombok.Getter;

@Getter
public class RateLimitExceededException extends TaskFlowException {

    private final String clientKey;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String clientKey, long retryAfterSeconds) {
        super(ErrorKind.RATE_LIMIT, "Rate limit exceeded");
        this.clientKey = clientKey;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}

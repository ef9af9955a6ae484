package com.example.taskflow.exception;

public class AuthenticationFailedException extends TaskFlowException {

    public AuthenticationFailedException(String message) {
        super(ErrorKind.AUTH, message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(ErrorKind.AUTH, message, cause);
    }
}

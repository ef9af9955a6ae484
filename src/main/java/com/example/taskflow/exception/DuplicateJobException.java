package com.example.taskflow.exception;

import lombok.Getter;

/**
 * Exception for registering a job under an id that is already taken
 */
@Getter
public class DuplicateJobException extends TaskFlowException {

    private final String jobId;

    public DuplicateJobException(String jobId) {
        super(ErrorKind.CONFLICT, String.format("Job already registered with id %s", jobId));
        this.jobId = jobId;
    }
}

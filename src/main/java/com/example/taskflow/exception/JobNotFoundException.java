package com.example.taskflow.exception;

import lombok.Getter;

@Getter
public class JobNotFoundException extends TaskFlowException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super(ErrorKind.NOT_FOUND, "Job not found: " + jobId);
        this.jobId = jobId;
    }
}

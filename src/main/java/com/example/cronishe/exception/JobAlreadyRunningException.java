package com.example.cronishe.exception;

import lombok.Getter;

@Getter
public class JobAlreadyRunningException extends RuntimeException {

    private final Long jobId;

    public JobAlreadyRunningException(Long jobId) {
        super("Job is already running: " + jobId);
        this.jobId = jobId;
    }
}

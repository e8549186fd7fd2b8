package com.example.cronishe.exception;

import lombok.Getter;

/**
 * Exception for job not found
 */
@Getter
public class JobNotFoundException extends RuntimeException {

    private final Long jobId;

    public JobNotFoundException(Long jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }
}

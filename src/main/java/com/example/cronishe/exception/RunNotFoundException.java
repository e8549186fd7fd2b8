package com.example.cronishe.exception;

import lombok.Getter;

/**
 * Raised when a stop is requested for a run that is not open or has no process
 */
@Getter
public class RunNotFoundException extends RuntimeException {

    private final Long runId;

    public RunNotFoundException(Long runId) {
        super("Run not found or not running: " + runId);
        this.runId = runId;
    }
}

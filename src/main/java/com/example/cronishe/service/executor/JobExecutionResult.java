package com.example.cronishe.service.executor;

import com.example.cronishe.domain.enums.RunOutcome;
import lombok.Builder;
import lombok.Data;

/**
 * What happened when the supervisor was asked to execute a job.
 * <p>
 * Expected failures (non-zero exit, spawn errors) are reported here rather than
 * thrown.
 */
@Data
@Builder
public class JobExecutionResult {

    private Long jobId;

    /**
     * Null when the execution was skipped
     */
    private Long runId;

    /**
     * Null when the execution was skipped
     */
    private RunOutcome outcome;

    /**
     * True if no run was created because the job was already running
     */
    private boolean skipped;

    /**
     * Process exit status, null if the process never exited normally
     */
    private Integer exitCode;

    private long durationSeconds;

    /**
     * Spawn or supervision error text, if any
     */
    private String errorMessage;

    public static JobExecutionResult skipped(Long jobId) {
        return JobExecutionResult.builder()
                .jobId(jobId)
                .skipped(true)
                .build();
    }

    public static JobExecutionResult exited(Long jobId, Long runId, int exitCode, long durationSeconds) {
        return JobExecutionResult.builder()
                .jobId(jobId)
                .runId(runId)
                .outcome(RunOutcome.fromExitCode(exitCode))
                .exitCode(exitCode)
                .durationSeconds(durationSeconds)
                .build();
    }

    public static JobExecutionResult failure(Long jobId, Long runId, String errorMessage, long durationSeconds) {
        return JobExecutionResult.builder()
                .jobId(jobId)
                .runId(runId)
                .outcome(RunOutcome.FAIL)
                .errorMessage(errorMessage)
                .durationSeconds(durationSeconds)
                .build();
    }

    public static JobExecutionResult aborted(Long jobId, Long runId, long durationSeconds) {
        return JobExecutionResult.builder()
                .jobId(jobId)
                .runId(runId)
                .outcome(RunOutcome.ABORTED)
                .durationSeconds(durationSeconds)
                .build();
    }

    public boolean isSuccess() {
        return outcome == RunOutcome.SUCCESS;
    }
}

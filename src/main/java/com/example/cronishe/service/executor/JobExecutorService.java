package com.example.cronishe.service.executor;

import com.example.cronishe.config.MetricsConfig;
import com.example.cronishe.domain.entity.Job;
import com.example.cronishe.domain.enums.RunOutcome;
import com.example.cronishe.domain.enums.WebhookStage;
import com.example.cronishe.service.retry.RetryCascadeService;
import com.example.cronishe.service.store.JobStore;
import com.example.cronishe.service.webhook.WebhookNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Supervises one execution of a job from spawn to recorded outcome.
 * <p>
 * Handles:
 * - Refusing to start while the job has an open run
 * - Run creation and pid recording
 * - Streaming process output into the run log
 * - Outcome classification and duration measurement
 * - Last-run bookkeeping, webhooks and hand-off to the retry engine
 * <p>
 * Called on a worker thread; blocks until the process exits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobExecutorService {

    static final String RETRY_LOG_FORMAT = "Retry attempt %d of %d";
    static final String ERROR_LOG_PREFIX = "ERROR: ";

    private final JobStore jobStore;
    private final ShellCommandRunner commandRunner;
    private final WebhookNotifier webhookNotifier;
    private final RetryCascadeService retryCascadeService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Execute a job with full run lifecycle management.
     *
     * @param job           the job to run
     * @param retry         whether this execution was fired from the retry queue
     * @param attemptNumber retry attempt, 0 for an origin run
     * @return the classified result; skipped if the job was already running
     */
    public JobExecutionResult execute(Job job, boolean retry, int attemptNumber) {
        var jobId = job.getId();

        if (jobStore.isRunning(jobId)) {
            log.warn("Job '{}' (ID: {}) is already running, skipping", job.getName(), jobId);
            metricsConfig.recordSkippedRun();
            return JobExecutionResult.skipped(jobId);
        }

        var startNanos = System.nanoTime();
        var runId = jobStore.createRun(jobId, retry, attemptNumber);

        if (retry) {
            log.info("Starting retry attempt {} of job '{}' (ID: {}), run {}", attemptNumber, job.getName(), jobId, runId);
            jobStore.appendLog(runId, String.format(RETRY_LOG_FORMAT, attemptNumber, job.getRetryLimit()));
        } else {
            log.info("Starting job '{}' (ID: {}), run {}", job.getName(), jobId, runId);
        }

        webhookNotifier.deliverAsync(job.getOnStartUrl(), job.getName(), WebhookStage.START);

        var timerSample = metricsConfig.startRunTimer();
        JobExecutionResult result;
        try {
            var exitCode = commandRunner.run(job.getCommand(),
                    pid -> jobStore.recordProcessId(runId, pid),
                    line -> captureLine(job, runId, line));
            result = JobExecutionResult.exited(jobId, runId, exitCode, elapsedSeconds(startNanos));
        } catch (IOException e) {
            log.error("Error executing job '{}' (ID: {}): {}", job.getName(), jobId, e.getMessage());
            jobStore.appendLog(runId, storable(ERROR_LOG_PREFIX + e.getMessage()));
            result = JobExecutionResult.failure(jobId, runId, e.getMessage(), elapsedSeconds(startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while supervising job '{}' (ID: {})", job.getName(), jobId);
            jobStore.appendLog(runId, ERROR_LOG_PREFIX + "interrupted while waiting for the process");
            result = JobExecutionResult.failure(jobId, runId, "interrupted", elapsedSeconds(startNanos));
        }

        var outcome = result.getOutcome();
        var finishedAt = clock.instant();

        if (!jobStore.finishRun(runId, outcome, result.getDurationSeconds())) {
            log.info("Run {} of job '{}' (ID: {}) was stopped before the process exited", runId, job.getName(), jobId);
            metricsConfig.recordRun(timerSample, RunOutcome.ABORTED, retry);
            return JobExecutionResult.aborted(jobId, runId, result.getDurationSeconds());
        }
        metricsConfig.recordRun(timerSample, outcome, retry);

        // A failed retry with attempts still queued is not the end of the cascade
        if (outcome == RunOutcome.SUCCESS || !retry || !jobStore.hasPendingRetries(jobId)) {
            jobStore.setLastRun(jobId, outcome);
        }

        if (result.getErrorMessage() != null) {
            log.info("Job '{}' (ID: {}) finished with result: {} ({}, {}s)",
                    job.getName(), jobId, outcome.getCode(), result.getErrorMessage(), result.getDurationSeconds());
        } else {
            log.info("Job '{}' (ID: {}) finished with result: {} (exit code: {}, {}s)",
                    job.getName(), jobId, outcome.getCode(), result.getExitCode(), result.getDurationSeconds());
        }

        var url = result.isSuccess() ? job.getOnSuccessUrl() : job.getOnFailUrl();
        webhookNotifier.deliver(url, job.getName(), WebhookStage.forOutcome(outcome));

        retryCascadeService.onRunFinished(job, runId, outcome, retry, attemptNumber, finishedAt);
        return result;
    }

    private void captureLine(Job job, Long runId, String line) {
        log.info("[{}] {}", job.getName(), line);
        jobStore.appendLog(runId, storable(line));
    }

    /**
     * Drop NUL characters, which text columns reject
     */
    static String storable(String line) {
        return line.indexOf('\0') < 0 ? line : line.replace("\0", "");
    }

    private static long elapsedSeconds(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).getSeconds();
    }
}

package com.example.cronishe.service.retry;

import com.example.cronishe.config.MetricsConfig;
import com.example.cronishe.domain.entity.Job;
import com.example.cronishe.domain.enums.RunOutcome;
import com.example.cronishe.service.alert.SlackAlertService;
import com.example.cronishe.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Reacts to finished runs by creating or clearing queued retries.
 * <p>
 * Only an origin run's failure creates retries, and it creates the whole
 * cascade (attempts 1..retryLimit) at once. A failing retry leaves the rest of
 * the cascade queued; a success at any point clears it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetryCascadeService {

    private final JobStore jobStore;
    private final RetryDelayPolicy delayPolicy;
    private final MetricsConfig metricsConfig;
    private final SlackAlertService slackAlertService;

    /**
     * Handle the outcome of a closed run.
     *
     * @param job           the job that ran
     * @param runId         the run that just closed
     * @param outcome       its outcome
     * @param retry         whether the run came from the retry queue
     * @param attemptNumber retry attempt, 0 for an origin run
     * @param finishedAt    when the run closed
     */
    public void onRunFinished(Job job, Long runId, RunOutcome outcome, boolean retry, int attemptNumber, Instant finishedAt) {
        if (outcome == RunOutcome.SUCCESS) {
            jobStore.clearRetries(job.getId());
            if (retry) {
                log.info("Job '{}' (ID: {}) succeeded on retry attempt {}, remaining retries cleared", job.getName(), job.getId(), attemptNumber);
            }
            return;
        }

        if (outcome != RunOutcome.FAIL) {
            return;
        }

        if (!retry) {
            scheduleCascade(job, runId, finishedAt);
            return;
        }

        if (jobStore.hasPendingRetries(job.getId())) {
            log.info("Job '{}' (ID: {}) failed retry attempt {} of {}, remaining attempts stay queued",
                    job.getName(), job.getId(), attemptNumber, job.getRetryLimit());
            return;
        }

        log.error("Job '{}' (ID: {}) failed its final retry attempt {}, giving up until the next scheduled run",
                job.getName(), job.getId(), attemptNumber);
        metricsConfig.recordRetriesExhausted();
        slackAlertService.sendRetriesExhaustedAlert(job, runId, attemptNumber);
    }

    /**
     * Replace any queued retries of the job with a fresh cascade for {@code originRunId}.
     * <p>
     * Fire times are computed from the failure minute so they line up with ticks.
     * A job whose schedule is incomplete uses the weekly delay table.
     */
    public void scheduleCascade(Job job, Long originRunId, Instant failedAt) {
        jobStore.clearRetries(job.getId());

        var limit = job.getRetryLimit();
        if (limit <= 0) {
            log.info("Job '{}' (ID: {}) failed and has retries disabled", job.getName(), job.getId());
            return;
        }

        var schedule = job.toSchedule().orElse(null);
        var base = failedAt.truncatedTo(ChronoUnit.MINUTES);

        for (var attempt = 1; attempt <= limit; attempt++) {
            var fireAt = base.plus(delayPolicy.delay(schedule, attempt));
            jobStore.scheduleRetry(job.getId(), originRunId, attempt, fireAt);
            log.info("Scheduled retry {} of {} for job '{}' (ID: {}) at {}", attempt, limit, job.getName(), job.getId(), fireAt);
        }

        metricsConfig.recordRetriesScheduled(limit);
    }
}

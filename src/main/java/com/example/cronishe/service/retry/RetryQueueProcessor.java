package com.example.cronishe.service.retry;

import com.example.cronishe.domain.entity.RetryTask;
import com.example.cronishe.service.executor.JobDispatcher;
import com.example.cronishe.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Fires queued retries whose time has come.
 * <p>
 * Runs once per tick, independently of due-job selection. A retry for a job
 * that is still running stays queued untouched and is looked at again next tick.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetryQueueProcessor {

    private final JobStore jobStore;
    private final JobDispatcher jobDispatcher;

    /**
     * Evaluate all retry tasks due at {@code now}.
     *
     * @return number of retries dispatched
     */
    public int processDueRetries(Instant now) {
        var dueTasks = jobStore.listDueRetries(now);
        if (dueTasks.isEmpty()) {
            log.debug("No retries due at {}", now);
            return 0;
        }

        log.info("Found {} retry task(s) due at {}", dueTasks.size(), now);

        var dispatched = 0;
        for (var task : dueTasks) {
            if (process(task)) {
                dispatched++;
            }
        }
        return dispatched;
    }

    private boolean process(RetryTask task) {
        var jobId = task.getJobId();

        if (jobStore.isRunning(jobId)) {
            log.info("Job {} is still running, retry attempt {} stays queued", jobId, task.getAttemptNumber());
            return false;
        }

        var job = jobStore.findJob(jobId).orElse(null);
        if (job == null) {
            log.info("Job {} no longer exists, dropping retry attempt {}", jobId, task.getAttemptNumber());
            jobStore.removeRetry(task.getId());
            return false;
        }

        if (!job.isActive()) {
            log.info("Job '{}' (ID: {}) was deactivated, dropping retry attempt {}", job.getName(), jobId, task.getAttemptNumber());
            jobStore.removeRetry(task.getId());
            return false;
        }

        // Remove before dispatch so the same attempt cannot fire twice
        if (!jobStore.removeRetry(task.getId())) {
            log.debug("Retry task {} already consumed, skipping", task.getId());
            return false;
        }

        log.info("Firing retry attempt {} of {} for job '{}' (ID: {})", task.getAttemptNumber(), job.getRetryLimit(), job.getName(), jobId);
        jobDispatcher.dispatchRetry(job, task.getAttemptNumber());
        return true;
    }
}

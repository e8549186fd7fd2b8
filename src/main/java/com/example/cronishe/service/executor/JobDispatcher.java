package com.example.cronishe.service.executor;

import com.example.cronishe.domain.entity.Job;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Hands job executions to worker threads without waiting for them.
 * <p>
 * {@link #runNow(Job)} is the single entry point used both by the tick driver
 * and by manual triggers. Callers are expected to have checked that the job is
 * not running; the supervisor checks again right before spawning.
 */
@Slf4j
@Service
public class JobDispatcher {

    private final JobExecutorService jobExecutorService;
    private final TaskExecutor workerExecutor;

    public JobDispatcher(JobExecutorService jobExecutorService, @Qualifier("jobWorkerExecutor") TaskExecutor workerExecutor) {
        this.jobExecutorService = jobExecutorService;
        this.workerExecutor = workerExecutor;
    }

    /**
     * Start an origin run of the job on its own worker
     */
    public void runNow(Job job) {
        dispatch(job, false, 0);
    }

    /**
     * Start retry attempt {@code attemptNumber} of the job on its own worker
     */
    public void dispatchRetry(Job job, int attemptNumber) {
        dispatch(job, true, attemptNumber);
    }

    private void dispatch(Job job, boolean retry, int attemptNumber) {
        try {
            workerExecutor.execute(() -> runWorker(job, retry, attemptNumber));
        } catch (TaskRejectedException e) {
            log.error("Could not start a worker for job '{}' (ID: {}): {}", job.getName(), job.getId(), e.getMessage());
        }
    }

    private void runWorker(Job job, boolean retry, int attemptNumber) {
        try {
            jobExecutorService.execute(job, retry, attemptNumber);
        } catch (Exception e) {
            log.error("Worker for job '{}' (ID: {}) terminated: {}", job.getName(), job.getId(), e.getMessage(), e);
        }
    }

    @PreDestroy
    void logOutstandingWorkers() {
        if (workerExecutor instanceof ThreadPoolTaskExecutor pool && pool.getActiveCount() > 0) {
            log.warn("Shutting down with {} job worker(s) still running; their runs will be closed on next start", pool.getActiveCount());
        }
    }
}

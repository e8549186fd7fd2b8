package com.example.cronishe.service.store;

import com.example.cronishe.domain.entity.Job;
import com.example.cronishe.domain.entity.JobRun;
import com.example.cronishe.domain.entity.RetryTask;
import com.example.cronishe.domain.enums.RunOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of jobs, runs, run output and queued retries.
 * <p>
 * Implementations must make every mutation a single atomic operation on one
 * row; the scheduler relies on that, plus its own {@link #isRunning} check right
 * before {@link #createRun}, for the one-open-run-per-job rule.
 */
public interface JobStore {

    List<Job> listActiveJobs();

    Optional<Job> findJob(Long jobId);

    /**
     * Check if the job has a run without a finish time
     */
    boolean isRunning(Long jobId);

    Optional<JobRun> getOpenRun(Long runId);

    Optional<JobRun> findRun(Long runId);

    List<JobRun> listOpenRuns();

    /**
     * Open a new run for the job, started now
     *
     * @param retry         whether the run was fired from the retry queue
     * @param attemptNumber retry attempt, 0 for an origin run
     * @return id of the new run
     */
    Long createRun(Long jobId, boolean retry, int attemptNumber);

    void recordProcessId(Long runId, long pid);

    void appendLog(Long runId, String line);

    /**
     * Close an open run with the given outcome
     *
     * @return false if the run had already been closed (e.g. stopped by a user)
     */
    boolean finishRun(Long runId, RunOutcome outcome, long durationSeconds);

    /**
     * Close an open run as aborted
     *
     * @return false if the run had already been closed
     */
    boolean abortRun(Long runId, long durationSeconds);

    void setLastRun(Long jobId, RunOutcome outcome);

    void scheduleRetry(Long jobId, Long originRunId, int attemptNumber, Instant fireAt);

    List<RetryTask> listDueRetries(Instant now);

    /**
     * Remove one queued retry
     *
     * @return false if it was no longer queued
     */
    boolean removeRetry(Long retryId);

    void clearRetries(Long jobId);

    boolean hasPendingRetries(Long jobId);

    long countOpenRuns();

    long countPendingRetries();
}

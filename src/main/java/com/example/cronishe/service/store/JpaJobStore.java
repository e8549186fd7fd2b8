package com.example.cronishe.service.store;

import com.example.cronishe.domain.entity.Job;
import com.example.cronishe.domain.entity.JobRun;
import com.example.cronishe.domain.entity.RetryTask;
import com.example.cronishe.domain.entity.RunLogLine;
import com.example.cronishe.domain.enums.RunOutcome;
import com.example.cronishe.domain.repository.JobRepository;
import com.example.cronishe.domain.repository.JobRunRepository;
import com.example.cronishe.domain.repository.RetryTaskRepository;
import com.example.cronishe.domain.repository.RunLogLineRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link JobStore} backed by Spring Data JPA.
 * <p>
 * Each method runs in its own short transaction so one call never holds a row
 * lock across a process spawn or a webhook.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaJobStore implements JobStore {

    private final JobRepository jobRepository;
    private final JobRunRepository runRepository;
    private final RunLogLineRepository logLineRepository;
    private final RetryTaskRepository retryTaskRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<Job> listActiveJobs() {
        return jobRepository.findByActiveTrueOrderByIdAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Job> findJob(Long jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isRunning(Long jobId) {
        return runRepository.existsByJobIdAndFinishAtIsNull(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JobRun> getOpenRun(Long runId) {
        return runRepository.findByIdAndFinishAtIsNull(runId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JobRun> findRun(Long runId) {
        return runRepository.findById(runId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobRun> listOpenRuns() {
        return runRepository.findByFinishAtIsNullOrderByIdAsc();
    }

    @Override
    @Transactional
    public Long createRun(Long jobId, boolean retry, int attemptNumber) {
        var run = JobRun.builder()
                .jobId(jobId)
                .startAt(clock.instant())
                .outcome(RunOutcome.RUNNING)
                .retry(retry)
                .attemptNumber(attemptNumber)
                .build();
        return runRepository.save(run).getId();
    }

    @Override
    @Transactional
    public void recordProcessId(Long runId, long pid) {
        if (runRepository.updateProcessId(runId, pid) == 0) {
            log.debug("Run {} already closed, pid {} not recorded", runId, pid);
        }
    }

    @Override
    @Transactional
    public void appendLog(Long runId, String line) {
        logLineRepository.save(RunLogLine.builder()
                .runId(runId)
                .loggedAt(clock.instant())
                .line(line)
                .build());
    }

    @Override
    @Transactional
    public boolean finishRun(Long runId, RunOutcome outcome, long durationSeconds) {
        return runRepository.closeRun(runId, outcome, durationSeconds, clock.instant()) == 1;
    }

    @Override
    @Transactional
    public boolean abortRun(Long runId, long durationSeconds) {
        return runRepository.closeRun(runId, RunOutcome.ABORTED, durationSeconds, clock.instant()) == 1;
    }

    @Override
    @Transactional
    public void setLastRun(Long jobId, RunOutcome outcome) {
        if (jobRepository.updateLastRun(jobId, clock.instant(), outcome) == 0) {
            log.warn("Job {} no longer exists, last run not recorded", jobId);
        }
    }

    @Override
    @Transactional
    public void scheduleRetry(Long jobId, Long originRunId, int attemptNumber, Instant fireAt) {
        retryTaskRepository.save(RetryTask.builder()
                .jobId(jobId)
                .originRunId(originRunId)
                .attemptNumber(attemptNumber)
                .fireAt(fireAt)
                .createdAt(clock.instant())
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public List<RetryTask> listDueRetries(Instant now) {
        return retryTaskRepository.findDue(now);
    }

    @Override
    @Transactional
    public boolean removeRetry(Long retryId) {
        return retryTaskRepository.deleteTask(retryId) == 1;
    }

    @Override
    @Transactional
    public void clearRetries(Long jobId) {
        var removed = retryTaskRepository.deleteByJobId(jobId);
        if (removed > 0) {
            log.debug("Cleared {} queued retries for job {}", removed, jobId);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasPendingRetries(Long jobId) {
        return retryTaskRepository.existsByJobId(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public long countOpenRuns() {
        return runRepository.countByFinishAtIsNull();
    }

    @Override
    @Transactional(readOnly = true)
    public long countPendingRetries() {
        return retryTaskRepository.count();
    }
}

package com.example.cronishe.service.executor;

import com.example.cronishe.domain.entity.JobRun;
import com.example.cronishe.exception.RunNotFoundException;
import com.example.cronishe.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Stops a running job on operator request.
 * <p>
 * The run is closed as aborted before the process is signalled, so the worker
 * that owns the process sees a closed run when the process exits and leaves it
 * alone. The run ends aborted whether or not the signal reached anything.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunStopService {

    static final String STOPPED_LOG_LINE = "Job stopped by user";

    private final JobStore jobStore;
    private final ProcessTreeTerminator processTreeTerminator;
    private final Clock clock;

    /**
     * Stop an open run.
     *
     * @param runId the run to stop
     * @return the run after it was closed
     * @throws RunNotFoundException if the run is not open, has no recorded process,
     *                              or finished before it could be aborted
     */
    public JobRun stop(Long runId) {
        var run = jobStore.getOpenRun(runId)
                .filter(r -> r.getProcessId() != null)
                .orElseThrow(() -> new RunNotFoundException(runId));

        var pid = run.getProcessId();
        var durationSeconds = run.elapsedSeconds(clock.instant());

        if (!jobStore.abortRun(runId, durationSeconds)) {
            log.info("Run {} closed on its own before it could be marked aborted", runId);
            throw new RunNotFoundException(runId);
        }
        jobStore.appendLog(runId, STOPPED_LOG_LINE);

        processTreeTerminator.terminate(pid);
        log.info("Stopped run {} of job {} (pid {}) after {}s", runId, run.getJobId(), pid, durationSeconds);

        return jobStore.findRun(runId).orElse(run);
    }
}

package com.example.cronishe.service.recovery;

import com.example.cronishe.domain.enums.RunOutcome;
import com.example.cronishe.service.store.JobStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Closes runs left open by a previous scheduler process.
 * <p>
 * Runs once while the context starts, before the tick driver and the HTTP
 * endpoints are live, so no run created by this process can be touched.
 * Processes from the previous instance are not signalled, and last-run fields,
 * retries and webhooks are left alone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrashRecoveryService {

    static final String RECOVERY_LOG_LINE = "Job aborted - scheduler restarted";

    private final JobStore jobStore;
    private final Clock clock;

    @PostConstruct
    public void onStartup() {
        recover();
    }

    /**
     * Mark every open run as failed.
     *
     * @return number of runs closed
     */
    public int recover() {
        var openRuns = jobStore.listOpenRuns();
        if (openRuns.isEmpty()) {
            log.debug("No runs left open by a previous instance");
            return 0;
        }

        log.warn("Found {} run(s) left open by a previous instance, marking them failed", openRuns.size());

        var now = clock.instant();
        var closed = 0;
        for (var run : openRuns) {
            jobStore.appendLog(run.getId(), RECOVERY_LOG_LINE);
            if (jobStore.finishRun(run.getId(), RunOutcome.FAIL, run.elapsedSeconds(now))) {
                closed++;
                log.info("Closed run {} of job {} (pid {})", run.getId(), run.getJobId(), run.getProcessId());
            }
        }
        return closed;
    }
}

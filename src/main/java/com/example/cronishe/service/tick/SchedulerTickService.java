package com.example.cronishe.service.tick;

import com.example.cronishe.config.SchedulerProperties;
import com.example.cronishe.service.executor.JobDispatcher;
import com.example.cronishe.service.retry.RetryQueueProcessor;
import com.example.cronishe.service.schedule.DueJobSelector;
import com.example.cronishe.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The scheduler's control loop.
 * <p>
 * Flow, once per minute boundary (and once when the application is ready):
 * 1. Truncate the clock to the minute
 * 2. Select due jobs among the active ones and dispatch each to a worker
 * 3. Fire retry tasks whose time has come
 * <p>
 * The tick never waits for workers. An unexpected error is logged and the
 * driver pauses before the next tick.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulerTickService {

    private final JobStore jobStore;
    private final DueJobSelector dueJobSelector;
    private final RetryQueueProcessor retryQueueProcessor;
    private final JobDispatcher jobDispatcher;
    private final SchedulerProperties properties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final AtomicBoolean ticking = new AtomicBoolean(false);

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isRunOnStartup()) {
            log.info("Performing initial job check");
            taskScheduler.schedule(this::tick, clock.instant());
        }
    }

    @Scheduled(cron = "${cronishe.scheduler.tick-cron:0 * * * * *}", zone = "UTC")
    public void scheduledTick() {
        tick();
    }

    /**
     * Run one tick.
     *
     * @return false if a previous tick was still in progress and this one was skipped
     */
    public boolean tick() {
        if (!ticking.compareAndSet(false, true)) {
            log.debug("Previous tick still running, skipping");
            return false;
        }

        try {
            var now = clock.instant().truncatedTo(ChronoUnit.MINUTES);

            var activeJobs = jobStore.listActiveJobs();
            log.info("Checking {} active job(s) at {}", activeJobs.size(), now);

            var dueJobs = dueJobSelector.selectDue(activeJobs, now);
            if (dueJobs.isEmpty()) {
                log.info("No jobs due to run at this time");
            } else {
                log.info("Found {} job(s) to run", dueJobs.size());
                dueJobs.forEach(jobDispatcher::runNow);
            }

            retryQueueProcessor.processDueRetries(now);
        } catch (Exception e) {
            log.error("Error in scheduler tick: {}", e.getMessage(), e);
            backOff();
        } finally {
            ticking.set(false);
        }
        return true;
    }

    private void backOff() {
        var pause = properties.getTickErrorBackoff();
        if (pause.isZero() || pause.isNegative()) {
            return;
        }
        log.warn("Pausing scheduler for {}s after tick error", pause.getSeconds());
        try {
            Thread.sleep(pause.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

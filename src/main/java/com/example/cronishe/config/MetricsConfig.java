package com.example.cronishe.config;

import com.example.cronishe.domain.enums.RunOutcome;
import com.example.cronishe.domain.enums.WebhookStage;
import com.example.cronishe.service.store.JobStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for monitoring scheduler health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Run counts and durations by outcome
 * - Retries scheduled and cascades exhausted
 * - Webhook delivery failures
 * - Open runs and queued retries
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final JobStore jobStore;

    private final AtomicLong openRuns = new AtomicLong(0);
    private final AtomicLong pendingRetries = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("cronishe_open_runs", openRuns, AtomicLong::get)
                .description("Number of runs without a finish time")
                .register(meterRegistry);

        Gauge.builder("cronishe_pending_retries", pendingRetries, AtomicLong::get)
                .description("Number of queued retry tasks")
                .register(meterRegistry);
    }

    /**
     * Periodically refresh gauges from the store
     */
    @Scheduled(fixedDelayString = "${cronishe.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            openRuns.set(jobStore.countOpenRuns());
            pendingRetries.set(jobStore.countPendingRetries());
        } catch (Exception e) {
            log.warn("Failed to refresh scheduler gauges: {}", e.getMessage());
        }
    }

    public Timer.Sample startRunTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record the duration and outcome of a closed run
     */
    public void recordRun(Timer.Sample sample, RunOutcome outcome, boolean retry) {
        sample.stop(Timer.builder("cronishe_run_time")
                .tag("outcome", outcome.getCode())
                .tag("retry", String.valueOf(retry))
                .description("Job run wall-clock time")
                .register(meterRegistry));
        meterRegistry.counter("cronishe_runs", "outcome", outcome.getCode()).increment();
    }

    /**
     * Record a run that was refused because the job was already running
     */
    public void recordSkippedRun() {
        meterRegistry.counter("cronishe_runs_skipped").increment();
    }

    public void recordRetriesScheduled(int count) {
        meterRegistry.counter("cronishe_retries_scheduled").increment(count);
    }

    public void recordRetriesExhausted() {
        meterRegistry.counter("cronishe_retries_exhausted").increment();
    }

    public void recordWebhookFailure(WebhookStage stage) {
        meterRegistry.counter("cronishe_webhook_failures", "stage", stage.getCode()).increment();
    }
}

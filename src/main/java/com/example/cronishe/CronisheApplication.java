package com.example.cronishe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cronishe Scheduler Application
 * <p>
 * Runs user-defined shell commands on interval or weekly schedules with
 * minute resolution.
 * <p>
 * Features:
 * - One worker thread per running job, at most one open run per job
 * - Retry cascades with schedule-aware backoff
 * - Start, success and failure webhooks
 * - Recovery of runs left open by a crashed instance
 * - Manual run and stop over HTTP
 */
@EnableScheduling
@SpringBootApplication
public class CronisheApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronisheApplication.class, args);
    }
}

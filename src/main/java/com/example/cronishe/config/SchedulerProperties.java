package com.example.cronishe.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the tick driver and job workers.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "cronishe.scheduler")
public class SchedulerProperties {

    /**
     * Cron expression (UTC) for the minute tick. "-" disables the recurring tick.
     */
    @NotNull
    private String tickCron = "0 * * * * *";

    /**
     * Whether to tick once as soon as the application is ready
     */
    private boolean runOnStartup = true;

    /**
     * Pause after an unexpected error in a tick before the driver resumes
     */
    @NotNull
    private Duration tickErrorBackoff = Duration.ofSeconds(60);

    /**
     * Shell prefix used to run job commands. Empty means sh -c (cmd /c on Windows).
     */
    private List<String> shell = List.of();
}

package com.example.cronishe.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Job webhook delivery settings
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "cronishe.webhook")
public class WebhookProperties {

    /**
     * Connect and response timeout for one webhook call
     */
    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

    /**
     * Total attempts per notification, including the first
     */
    @Min(1)
    private int maxAttempts = 3;

    /**
     * Pause before the n-th retry; the last entry repeats
     */
    @NotNull
    private List<Duration> retryPauses = List.of(Duration.ofSeconds(1), Duration.ofSeconds(3), Duration.ofSeconds(5));
}

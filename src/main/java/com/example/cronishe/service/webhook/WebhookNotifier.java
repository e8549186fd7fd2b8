package com.example.cronishe.service.webhook;

import com.example.cronishe.config.MetricsConfig;
import com.example.cronishe.config.WebhookProperties;
import com.example.cronishe.domain.enums.WebhookStage;
import com.example.cronishe.exception.WebhookDeliveryException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Client for user-configured job webhooks.
 * <p>
 * Uses:
 * - WebClient for the GET call, bounded by the webhook timeout
 * - Resilience4j Retry with a fixed pause table between attempts
 * <p>
 * Delivery failures are logged and counted, never propagated to the caller.
 */
@Slf4j
@Component
public class WebhookNotifier {

    private final WebClient webClient;
    private final WebhookProperties properties;
    private final MetricsConfig metricsConfig;
    private final Retry retry;

    public WebhookNotifier(@Qualifier("webhookWebClient") WebClient webClient, WebhookProperties properties, MetricsConfig metricsConfig) {
        this.webClient = webClient;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.retry = Retry.of("jobWebhook", RetryConfig.custom()
                .maxAttempts(properties.getMaxAttempts())
                .intervalFunction(pauseTable(properties.getRetryPauses()))
                .retryExceptions(WebhookDeliveryException.class)
                .build());
    }

    /**
     * Call the webhook and wait until it was delivered or every attempt failed.
     *
     * @param url     target URL; nothing is sent when null or blank
     * @param jobName name of the job, for logging
     * @param stage   lifecycle stage that fired the webhook
     * @return true if some attempt got a 2xx or 3xx response
     */
    public boolean deliver(String url, String jobName, WebhookStage stage) {
        if (url == null || url.isBlank()) {
            return false;
        }

        try {
            retry.executeRunnable(() -> call(url));
            log.debug("Delivered {} webhook for job '{}' to {}", stage.getCode(), jobName, url);
            return true;
        } catch (WebhookDeliveryException e) {
            log.error("Giving up on {} webhook for job '{}' after {} attempt(s): {}",
                    stage.getCode(), jobName, properties.getMaxAttempts(), e.getMessage());
            metricsConfig.recordWebhookFailure(stage);
            return false;
        }
    }

    /**
     * Same as {@link #deliver} but on the async executor, so the caller does not wait
     */
    @Async
    public void deliverAsync(String url, String jobName, WebhookStage stage) {
        deliver(url, jobName, stage);
    }

    private void call(String url) {
        int status;
        try {
            var code = webClient.get()
                    .uri(url)
                    .exchangeToMono(response -> response.releaseBody().thenReturn(response.statusCode().value()))
                    .timeout(properties.getTimeout())
                    .block();
            status = code != null ? code : 0;
        } catch (Exception e) {
            log.warn("Webhook call to {} failed: {}", url, e.getMessage());
            throw new WebhookDeliveryException(url, e);
        }

        if (status < 200 || status >= 400) {
            log.warn("Webhook call to {} answered HTTP {}", url, status);
            throw new WebhookDeliveryException(url, status);
        }
    }

    /**
     * Pause before retry n is the n-th entry; the last entry repeats
     */
    static IntervalFunction pauseTable(List<Duration> pauses) {
        if (pauses == null || pauses.isEmpty()) {
            return attempt -> 0L;
        }
        return attempt -> {
            var index = Math.min(Math.max(attempt, 1), pauses.size()) - 1;
            return pauses.get(index).toMillis();
        };
    }
}

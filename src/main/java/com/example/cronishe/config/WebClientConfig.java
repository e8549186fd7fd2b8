package com.example.cronishe.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for job webhook calls.
 * <p>
 * Webhook targets are arbitrary user URLs, so the client has no base URL and
 * every call is bounded by the configured webhook timeout.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    @Bean(name = "webhookWebClient")
    public WebClient webhookWebClient(WebClient.Builder builder, WebhookProperties properties) {
        var timeout = properties.getTimeout();
        var timeoutMillis = (int) timeout.toMillis();

        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis)
                .responseTimeout(timeout)
                .followRedirect(false)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS)));

        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("X-Service-Name", "cronishe")
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    /**
     * Log outgoing requests
     */
    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[Webhook] Request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    /**
     * Log incoming responses
     */
    private ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            log.debug("[Webhook] Response status: {}", clientResponse.statusCode());
            return Mono.just(clientResponse);
        });
    }
}

package com.example.jobscheduler.config;

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

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for jobs that call out over HTTP.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    /**
     * WebClient used by the health check job
     */
    @Bean(name = "healthCheckWebClient")
    public WebClient healthCheckWebClient(WebClient.Builder builder, HealthCheckProperties properties) {
        return createWebClient(builder, properties.getTimeoutSeconds(), "HealthCheck");
    }

    private WebClient createWebClient(WebClient.Builder builder, int timeoutSeconds, String clientName) {
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("X-Service-Name", "job-scheduler")
                .filter(logRequest(clientName))
                .filter(logResponse(clientName))
                .build();
    }

    /**
     * Log outgoing requests
     */
    private ExchangeFilterFunction logRequest(String clientName) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[{}] Request: {} {}", clientName, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    /**
     * Log incoming responses, warning on error statuses
     */
    private ExchangeFilterFunction logResponse(String clientName) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                log.warn("[{}] Error response: {}", clientName, clientResponse.statusCode());
            } else {
                log.debug("[{}] Response status: {}", clientName, clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}

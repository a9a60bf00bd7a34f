package com.gprintex.commission.config;

import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClients for the outbound collaborators: approval notifications and the external billing system.
 */
@Configuration
public class ClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ClientConfig.class);

    private final CommissionProperties properties;

    public ClientConfig(CommissionProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient notificationWebClient(WebClient.Builder builder) {
        var notification = properties.notification();
        return builder.clone()
            .baseUrl(notification.baseUrl())
            .clientConnector(connector(notification.timeoutMs()))
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .filter(loggingFilter("notification"))
            .build();
    }

    @Bean
    public WebClient billingWebClient(WebClient.Builder builder) {
        var sync = properties.sync();
        return builder.clone()
            .baseUrl(sync.baseUrl())
            .clientConnector(connector(sync.timeoutMs()))
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .filter(apiKeyFilter(sync.apiKey()))
            .filter(loggingFilter("billing"))
            .build();
    }

    private ReactorClientHttpConnector connector(int timeoutMs) {
        var httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMs)
            .responseTimeout(Duration.ofMillis(timeoutMs));
        return new ReactorClientHttpConnector(httpClient);
    }

    /**
     * Adds the billing API key as a bearer token when one is configured.
     */
    private ExchangeFilterFunction apiKeyFilter(String apiKey) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            if (apiKey == null || apiKey.isBlank()) {
                log.warn("Billing API key is not configured, calling {} unauthenticated", clientRequest.url());
                return Mono.just(clientRequest);
            }
            return Mono.just(ClientRequest.from(clientRequest)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .build());
        });
    }

    private ExchangeFilterFunction loggingFilter(String clientName) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("{} request: {} {}", clientName, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}

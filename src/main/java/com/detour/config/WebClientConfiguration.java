package com.detour.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

/**
 * WebClient backing the default transport, plus the clock used for cache ages and log timestamps.
 */
@Configuration
public class WebClientConfiguration {

    private final DetourProperties properties;

    public WebClientConfiguration(DetourProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        // No connector-level response timeout: RetryExecutor bounds every attempt
        // with the request's own deadline.
        HttpClient httpClient = HttpClient.create();

        int maxInMemorySize = maxInMemorySize();
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .build();

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private int maxInMemorySize() {
        long bytes = properties.getTransport().getMaxBodySize().toBytes();
        if (bytes < 0) {
            return -1;
        }
        return (int) Math.min(bytes, Integer.MAX_VALUE);
    }
}

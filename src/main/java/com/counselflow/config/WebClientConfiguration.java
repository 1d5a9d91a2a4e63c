package com.counselflow.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient used by the HTTP provider adapters.
 */
@Configuration
public class WebClientConfiguration {

    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    private final CounselFlowProperties properties;

    public WebClientConfiguration(CounselFlowProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        // The orchestrator applies its own hard timeout per call; this one guards the socket
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getOrchestrator().getRequestTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                        .build())
                .build();
    }
}

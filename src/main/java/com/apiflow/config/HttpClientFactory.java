package com.apiflow.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * A Spring configuration class responsible for creating the HTTP client used for discovery
 * documents and remote method calls.
 * <p>
 * The client carries no retry filter. Calls are retried only by the
 * {@link com.apiflow.service.api.RetryExecutor}, which classifies every failure first.
 */
@Configuration
public class HttpClientFactory {

    /**
     * Creates the shared {@link WebClient}. Discovery documents for large APIs run to several
     * megabytes, so the in-memory codec buffer is raised to {@code apiflow.http.max-in-memory-size}.
     *
     * @param properties The bound engine properties.
     * @return A configured {@link WebClient}.
     */
    @Bean
    public WebClient webClient(EngineProperties properties) {
        int maxInMemorySize = (int) properties.getHttp().getMaxInMemorySize().toBytes();
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .build();
        return WebClient.builder()
                .exchangeStrategies(strategies)
                .build();
    }
}

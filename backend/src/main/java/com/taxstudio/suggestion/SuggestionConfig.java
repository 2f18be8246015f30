package com.taxstudio.suggestion;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the query suggestion backend: the remote service when {@code taxstudio.suggestion.base-url} is set,
 * otherwise the local heuristic generator.
 */
@Configuration
@EnableConfigurationProperties(SuggestionProperties.class)
@Slf4j
public class SuggestionConfig {

    @Bean(name = "querySuggestionRateLimiter")
    public RateLimiter querySuggestionRateLimiter(SuggestionProperties properties) {
        int rps = Math.max(1, properties.getRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("query-suggestion", config);
    }

    @Bean
    public QuerySuggestionService querySuggestionService(
            SuggestionProperties properties,
            WebClient.Builder webClientBuilder,
            @Qualifier("querySuggestionRateLimiter") RateLimiter rateLimiter) {
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            log.info("No query suggestion base-url configured, using local heuristic queries");
            return new HeuristicQuerySuggestionService();
        }
        log.info("Query suggestions served by {}", properties.getBaseUrl());
        return new WebClientQuerySuggestionService(properties, webClientBuilder, rateLimiter);
    }
}

package com.taxstudio.search.config;

import com.taxstudio.common.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Precision search configuration: properties and retry backoff for failed jobs.
 */
@Configuration
@EnableConfigurationProperties(PrecisionSearchProperties.class)
public class PrecisionSearchConfig {

    @Bean
    public RetryPolicy precisionSearchRetryPolicy(PrecisionSearchProperties properties) {
        return new RetryPolicy(
                Duration.ofMinutes(properties.getRetryBaseDelayMinutes()),
                Duration.ofMinutes(properties.getRetryMaxDelayMinutes()),
                0.25);
    }
}

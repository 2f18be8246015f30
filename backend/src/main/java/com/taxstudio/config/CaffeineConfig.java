package com.taxstudio.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Query suggestions are keyed by transaction id and expire after
 * {@code taxstudio.suggestion.cache-ttl-minutes}.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String QUERY_SUGGESTION_CACHE = "querySuggestionCache";

    @Bean
    public CacheManager caffeineCacheManager(
            @Value("${taxstudio.suggestion.cache-ttl-minutes:30}") long suggestionTtlMinutes) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(QUERY_SUGGESTION_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(suggestionTtlMinutes, TimeUnit.MINUTES)
                .maximumSize(5_000)
                .build());
        return manager;
    }
}

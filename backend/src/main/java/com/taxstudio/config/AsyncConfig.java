package com.taxstudio.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: search-executor runs precision search jobs (one worker per queue item),
 * event-executor handles inbound application events such as mail-sync completions.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String SEARCH_EXECUTOR = "search-executor";
    public static final String EVENT_EXECUTOR = "event-executor";

    @Bean(name = SEARCH_EXECUTOR)
    public Executor searchExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(200);
        e.setThreadNamePrefix("search-");
        e.initialize();
        return e;
    }

    @Bean(name = EVENT_EXECUTOR)
    public Executor eventExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("event-");
        e.initialize();
        return e;
    }
}

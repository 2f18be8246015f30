package com.taxstudio.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Runs the precision search housekeeping jobs: pending poll, stale-lease sweep, retry scheduler and
 * retention purge. One thread per job so a slow Mongo sweep does not hold back the others.
 */
@Slf4j
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";
    static final int HOUSEKEEPING_JOBS = 4;

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(HOUSEKEEPING_JOBS);
        s.setThreadNamePrefix("scheduler-");
        s.setErrorHandler(t -> log.error("Scheduled precision search job failed: {}", t.getMessage(), t));
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(10);
        s.initialize();
        return s;
    }
}

package com.example.taskflow.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Configuration for the scheduler that drives the job registry.
 * <p>
 * Job callbacks fire on this pool, never on request threads. Cancelled
 * futures are removed from the work queue immediately so removed jobs
 * do not linger until their next due time.
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean(name = "jobTaskScheduler")
    public ThreadPoolTaskScheduler jobTaskScheduler(SchedulerProperties properties) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getPoolSize());
        scheduler.setThreadNamePrefix("job-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(properties.getAwaitTerminationSeconds());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(t -> log.error("Uncaught error on job scheduler thread: {}", t.getMessage(), t));
        scheduler.initialize();

        log.info("Job scheduler initialized with pool size {}", properties.getPoolSize());
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

package com.bridgewatcher.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Single worker thread for the watcher loop: one scan-then-deliver cycle at a time.
 */
@Configuration
public class AsyncConfig {

    public static final String WATCHER_EXECUTOR = "watcher-executor";

    @Bean(name = WATCHER_EXECUTOR)
    public Executor watcherExecutor(
            @Value("${bridgewatcher.watcher.shutdown-timeout-seconds:60}") int shutdownTimeoutSeconds) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(1);
        e.setThreadNamePrefix("watcher-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(shutdownTimeoutSeconds);
        e.initialize();
        return e;
    }
}

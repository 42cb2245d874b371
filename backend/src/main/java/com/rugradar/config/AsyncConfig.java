package com.rugradar.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Named thread pool for per-launch work (resolve, evaluate, publish). The feed loop only hands off to it.
 * Rejection is surfaced to the caller so a saturated pool drops launches instead of stalling the feed.
 */
@Configuration
@EnableConfigurationProperties(LaunchExecutorProperties.class)
public class AsyncConfig {

    public static final String LAUNCH_EXECUTOR = "launch-executor";

    @Bean(name = LAUNCH_EXECUTOR)
    public ThreadPoolTaskExecutor launchExecutor(LaunchExecutorProperties properties) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(1, properties.getCorePoolSize()));
        e.setMaxPoolSize(Math.max(e.getCorePoolSize(), properties.getMaxPoolSize()));
        e.setQueueCapacity(Math.max(0, properties.getQueueCapacity()));
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationMillis(properties.getShutdownGracePeriod().toMillis());
        e.setThreadNamePrefix("launch-");
        e.initialize();
        return e;
    }
}

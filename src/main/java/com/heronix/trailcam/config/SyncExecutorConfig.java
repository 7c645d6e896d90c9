package com.heronix.trailcam.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools and clock used by the synchronization coordinator.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Configuration
public class SyncExecutorConfig {

    /**
     * Runs whole cycles, one at a time. The scheduler thread only dispatches
     * here, so a tick that finds a cycle running is skipped instead of queued.
     */
    @Bean(name = "syncCycleExecutor")
    public ThreadPoolTaskExecutor syncCycleExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("trailcam-cycle-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Bounded pool for per-camera state fetches within a cycle.
     */
    @Bean(name = "deviceFetchExecutor")
    public ThreadPoolTaskExecutor deviceFetchExecutor(TrailCamProperties properties) {
        int threads = properties.getPoll().getMaxConcurrency();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("trailcam-device-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

package com.example.exod_detector.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Provides the bounded pool running per-CCD variability and region detection tasks for
 * {@link com.example.exod_detector.service.VariabilityDetectionService}.
 */
@Configuration
public class DetectorExecutorConfig {

    @Bean(name = "tileTaskExecutor")
    public ThreadPoolTaskExecutor tileTaskExecutor(DetectorProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getMaxThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("tile-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}

package com.medimind.intake.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    @Value("${app.extraction.pool-size:4}")
    private int extractionPoolSize;

    @Bean(name = "extractionTaskExecutor")
    public Executor extractionTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(extractionPoolSize);
        executor.setMaxPoolSize(extractionPoolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("extract-");
        // full queue: the submitting thread runs the file itself
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean(name = "completionTaskExecutor")
    public Executor completionTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("completion-");
        executor.initialize();
        return executor;
    }
}

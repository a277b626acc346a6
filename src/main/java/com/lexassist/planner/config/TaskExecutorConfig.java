package com.lexassist.planner.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class TaskExecutorConfig {

    @Value("${app.planner.executor.core-size:4}")
    private int corePoolSize;

    @Value("${app.planner.executor.max-size:8}")
    private int maxPoolSize;

    @Value("${app.planner.executor.queue-capacity:200}")
    private int queueCapacity;

    /**
     * Runs the single completion call of a classification or optimization request.
     */
    @Bean("queryPlannerExecutor")
    public ThreadPoolTaskExecutor queryPlannerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Math.max(corePoolSize, maxPoolSize));
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("QueryPlanner-");
        executor.initialize();
        return executor;
    }
}

package com.example.jobtrigger.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async processing.
 * <p>
 * Quartz scheduler calls and trigger definition lookups are blocking,
 * so they run on a dedicated pool and are exposed to the scheduling
 * flow as CompletableFutures.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    @Value("${jobs.executor-pool-size:8}")
    private int executorPoolSize;

    /**
     * Executor for scheduler and trigger provider I/O.
     */
    @Bean(name = "schedulingExecutor")
    public TaskExecutor schedulingExecutor() {
        log.info("Creating scheduling executor with {} core threads", executorPoolSize);

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(executorPoolSize);
        executor.setMaxPoolSize(executorPoolSize * 2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("scheduling-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }

    /**
     * Task executor for Spring's @Async annotation (alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        log.info("Configuring Spring TaskExecutor for async alerts");

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-task-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        return executor;
    }
}

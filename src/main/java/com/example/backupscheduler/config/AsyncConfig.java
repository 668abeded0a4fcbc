package com.example.backupscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools used by the scheduler.
 * <p>
 * - A single thread owns the scheduler loop
 * - A small bounded pool runs collaborator calls so the loop can await them with a timeout
 * - Spring's {@code @Async} executor carries audit and alert notifications
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    /**
     * Dedicated thread for the scheduler loop.
     */
    @Bean(name = "schedulerLoopExecutor", destroyMethod = "shutdownNow")
    public ExecutorService schedulerLoopExecutor() {
        log.info("Creating single-thread executor for the backup scheduler loop");

        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("backup-scheduler-loop-"));
    }

    /**
     * Bounded pool for resource-state, backup-creation and retention calls issued by the loop.
     */
    @Bean(name = "collaboratorExecutor", destroyMethod = "shutdownNow")
    public ExecutorService collaboratorExecutor(BackupSchedulerProperties properties) {
        log.info("Creating collaborator executor with {} threads", properties.getCollaboratorPoolSize());

        return Executors.newFixedThreadPool(properties.getCollaboratorPoolSize(), new CustomizableThreadFactory("backup-collaborator-"));
    }

    /**
     * Task executor for Spring's @Async annotation.
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        log.info("Configuring Spring TaskExecutor for async notifications");

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-notify-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Notification rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}

package com.example.cronishe.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for job workers and asynchronous side effects.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    @Value("${cronishe.async.pool-size:4}")
    private int asyncPoolSize;

    /**
     * One thread per running job, no upper bound and no queue.
     * <p>
     * Threads are daemons and shutdown does not wait for them: a job keeps
     * running until it exits or is stopped, never until the scheduler exits.
     */
    @Bean(name = "jobWorkerExecutor")
    public ThreadPoolTaskExecutor jobWorkerExecutor() {
        log.info("Creating job worker executor");

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(0);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("job-worker-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        return executor;
    }

    /**
     * Task executor for Spring's @Async annotation (start webhooks, alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        log.info("Configuring Spring TaskExecutor with {} threads", asyncPoolSize);

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(asyncPoolSize);
        executor.setMaxPoolSize(asyncPoolSize * 2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-task-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
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

package com.example.tscribe_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for job execution. {@code workerTaskExecutor} runs one {@code JobExecutor} per claimed
 * job and owns its deadline; {@code jobPhaseExecutor} runs the pipeline itself so it can be
 * interrupted; {@code progressTaskExecutor} writes coalesced progress off the engine thread.
 * Shutdown is driven by {@code WorkerService}, so the pools keep running tasks after context close.
 */
@Configuration
@EnableConfigurationProperties(WorkerExecutorProperties.class)
public class WorkerExecutorConfig {

    @Bean(name = "workerTaskExecutor")
    public ThreadPoolTaskExecutor workerTaskExecutor(WorkerExecutorProperties properties) {
        return pool("worker-", properties.effectiveConcurrency());
    }

    @Bean(name = "jobPhaseExecutor")
    public ThreadPoolTaskExecutor jobPhaseExecutor(WorkerExecutorProperties properties) {
        return pool("job-phase-", properties.effectiveConcurrency());
    }

    @Bean(name = "progressTaskExecutor")
    public ThreadPoolTaskExecutor progressTaskExecutor() {
        return pool("progress-", 1);
    }

    private ThreadPoolTaskExecutor pool(String prefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(threads * 4);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAcceptTasksAfterContextClose(true);
        executor.setAwaitTerminationSeconds(15);
        executor.initialize();
        return executor;
    }
}

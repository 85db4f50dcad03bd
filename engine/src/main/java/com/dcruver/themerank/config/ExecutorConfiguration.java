package com.dcruver.themerank.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools: one for whole runs, one for the numeric clustering and
 * ranking work those runs hand off.
 */
@Configuration
public class ExecutorConfiguration {

    public static final String JOB_EXECUTOR = "jobExecutor";
    public static final String COMPUTE_EXECUTOR = "computeExecutor";

    @Bean(name = JOB_EXECUTOR)
    public ThreadPoolTaskExecutor jobExecutor(PipelineProperties properties) {
        return pool("run-", properties.getJobThreads());
    }

    @Bean(name = COMPUTE_EXECUTOR)
    public ThreadPoolTaskExecutor computeExecutor(PipelineProperties properties) {
        return pool("compute-", properties.getComputeThreads());
    }

    private static ThreadPoolTaskExecutor pool(String prefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, threads));
        executor.setMaxPoolSize(Math.max(1, threads));
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}

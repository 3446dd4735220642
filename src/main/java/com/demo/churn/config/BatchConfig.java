package com.demo.churn.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class BatchConfig {

    /**
     * Worker pool for per-record batch work. Records queue up to the batch size limit; past
     * that the submitting thread scores them itself.
     */
    @Bean(name = "batchExecutor")
    public Executor batchExecutor(ChurnProperties props) {
        ChurnProperties.Batch cfg = props.getBatch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getWorkerThreads());
        executor.setMaxPoolSize(cfg.getWorkerThreads());
        executor.setQueueCapacity(cfg.getMaxRows());
        executor.setThreadNamePrefix("ChurnBatch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}

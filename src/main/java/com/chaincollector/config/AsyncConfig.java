package com.chaincollector.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools of the collector: one thread per concurrently collected index, and a small
 * bounded pool for sink writes. Both run the task on the caller when saturated. Task failures
 * surface through the returned futures and are routed by the orchestrator.
 */
@Configuration
public class AsyncConfig {

    static final int SINK_QUEUE_CAPACITY = 64;

    private final CollectorProperties collectorProperties;

    public AsyncConfig(CollectorProperties collectorProperties) {
        this.collectorProperties = collectorProperties;
    }

    @Bean("indexCollectorExecutor")
    public ThreadPoolTaskExecutor indexCollectorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(collectorProperties.getParallelism());
        executor.setMaxPoolSize(collectorProperties.getParallelism());
        executor.setQueueCapacity(collectorProperties.getParallelism() * 4);
        executor.setThreadNamePrefix("index-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("sinkWriterExecutor")
    public ThreadPoolTaskExecutor sinkWriterExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(collectorProperties.getSinkPoolSize());
        executor.setMaxPoolSize(collectorProperties.getSinkPoolSize());
        executor.setQueueCapacity(SINK_QUEUE_CAPACITY);
        executor.setThreadNamePrefix("sink-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}

package com.eyelevel.docpipeline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the managed thread pools of the pipeline engine, sized from {@code app.pipeline.executor.*}.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Pool that drives executions; one task walks all stages of one execution.
     */
    @Bean("pipelineTaskExecutor")
    public AsyncTaskExecutor pipelineTaskExecutor(final PipelineProperties properties) {
        final PipelineProperties.Executor config = properties.getExecutor();
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCoreSize());
        executor.setMaxPoolSize(config.getMaxSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Pool that runs the individual stage calls, so a call can be abandoned when it exceeds its timeout.
     * It has no queue: each waiting execution holds at most one call, bounded by the pipeline pool.
     */
    @Bean("stageTaskExecutor")
    public AsyncTaskExecutor stageTaskExecutor(final PipelineProperties properties) {
        final PipelineProperties.Executor config = properties.getExecutor();
        final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCoreSize());
        executor.setMaxPoolSize(Math.max(config.getCoreSize(), config.getStageCallMaxSize()));
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("stage-call-");
        executor.initialize();
        return executor;
    }
}

package com.eyelevel.docpipeline.config;

import com.eyelevel.docpipeline.orchestrator.WorkerIdentity;
import com.eyelevel.docpipeline.pipeline.PipelineDefinition;
import com.eyelevel.docpipeline.pipeline.StageExecutorRegistry;
import com.eyelevel.docpipeline.pipeline.StageSpec;
import com.eyelevel.docpipeline.store.ExecutionRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.List;

/**
 * Wires the pipeline engine: the stage list, the active execution store, the clock and the worker identity.
 *
 * <h3>Example configuration (application.yaml):</h3>
 * <pre>
 * app:
 *   pipeline:
 *     store:
 *       type: jpa            # or in-memory
 *     stages:
 *       - name: extract-metadata
 *         max-attempts: 1
 *       - name: extract-text
 *         max-attempts: 3
 *         backoff-base: 2s
 *         timeout: 2m
 * </pre>
 */
@Slf4j
@Configuration
public class PipelineConfig {

    /**
     * Builds the pipeline from {@code app.pipeline.stages}. Start-up fails if the stage list is invalid or names
     * a stage without a registered executor.
     */
    @Bean
    public PipelineDefinition pipelineDefinition(final PipelineProperties properties,
                                                 final StageExecutorRegistry stageExecutorRegistry) {
        final List<StageSpec> stages = properties.getStages().stream()
                .map(stage -> new StageSpec(stage.getName(), stage.getMaxAttempts(), stage.getBackoffBase(),
                                            stage.getTimeout()))
                .toList();
        final PipelineDefinition definition = new PipelineDefinition(stages, properties.getMaxBackoff());
        stageExecutorRegistry.verifyCovers(definition);
        log.info("Pipeline initialized with {} stages: {}", definition.size(), definition);
        return definition;
    }

    /**
     * Selects the execution store according to {@code app.pipeline.store.type}.
     */
    @Bean(name = "executionRecordStore")
    @Primary
    public ExecutionRecordStore executionRecordStore(
            @Qualifier("jpaExecutionRecordStore") final ExecutionRecordStore jpaStore,
            @Qualifier("inMemoryExecutionRecordStore") final ExecutionRecordStore inMemoryStore,
            final PipelineProperties properties) {

        final String type = properties.getStore().getType();
        if (type == null || type.isBlank()) {
            log.warn("No execution store type configured. Defaulting to 'jpa'.");
            return jpaStore;
        }

        return switch (type.trim().toLowerCase()) {
            case "jpa" -> {
                log.info("Execution store set to JPA (durable, shared between workers).");
                yield jpaStore;
            }
            case "in-memory" -> {
                log.warn("Execution store set to IN-MEMORY. Executions will not survive a restart.");
                yield inMemoryStore;
            }
            default -> throw new IllegalStateException(
                    "Unknown execution store type '" + type + "'. Expected 'jpa' or 'in-memory'.");
        };
    }

    @Bean
    public WorkerIdentity workerIdentity(final PipelineProperties properties) {
        final WorkerIdentity identity = new WorkerIdentity(properties.getWorkerId());
        log.info("Pipeline worker identity: {}", identity);
        return identity;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

package com.eyelevel.docpipeline.pipeline;

import com.eyelevel.docpipeline.exception.PipelineDefinitionException;
import com.eyelevel.docpipeline.exception.StageNotFoundException;
import com.eyelevel.docpipeline.stage.StageExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps stage names to their {@link StageExecutor} implementations.
 * All executors present in the application context are registered on start-up.
 */
@Slf4j
@Service
public class StageExecutorRegistry {

    private final Map<String, StageExecutor> executors;

    public StageExecutorRegistry(final List<StageExecutor> executors) {
        final Map<String, StageExecutor> byName = new LinkedHashMap<>();
        for (final StageExecutor executor : executors) {
            final StageExecutor previous = byName.putIfAbsent(executor.name(), executor);
            if (previous != null) {
                throw new PipelineDefinitionException(String.format(
                        "Stage '%s' is registered twice (%s and %s)", executor.name(),
                        previous.getClass().getSimpleName(), executor.getClass().getSimpleName()));
            }
        }
        this.executors = Collections.unmodifiableMap(byName);
        log.info("StageExecutorRegistry initialized with {} stage executors: {}", byName.size(), byName.keySet());
    }

    /**
     * @throws StageNotFoundException if no executor is registered under the name.
     */
    public StageExecutor get(final String stageName) {
        final StageExecutor executor = executors.get(stageName);
        if (executor == null) {
            throw new StageNotFoundException(stageName);
        }
        return executor;
    }

    public Set<String> stageNames() {
        return executors.keySet();
    }

    /**
     * Fails fast when the pipeline names a stage nobody can execute.
     */
    public void verifyCovers(final PipelineDefinition pipeline) {
        final List<String> missing = pipeline.stages().stream()
                .map(StageSpec::name)
                .filter(name -> !executors.containsKey(name))
                .toList();
        if (!missing.isEmpty()) {
            throw new PipelineDefinitionException(
                    "No stage executor registered for " + missing + ". Available: " + executors.keySet());
        }
    }
}

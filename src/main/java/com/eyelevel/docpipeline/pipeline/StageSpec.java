package com.eyelevel.docpipeline.pipeline;

import com.eyelevel.docpipeline.exception.PipelineDefinitionException;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Per-stage execution policy.
 *
 * @param name        The stage name; selects the {@link com.eyelevel.docpipeline.stage.StageExecutor}.
 * @param maxAttempts Total attempts allowed for the stage, including the first one. At least 1.
 * @param backoffBase Wait before the first retry; doubles on each further retry. Zero disables the wait.
 * @param timeout     Upper bound for a single stage call.
 */
public record StageSpec(String name, int maxAttempts, Duration backoffBase, Duration timeout) {

    public StageSpec {
        if (!StringUtils.hasText(name)) {
            throw new PipelineDefinitionException("Stage name must not be blank");
        }
        if (maxAttempts < 1) {
            throw new PipelineDefinitionException(
                    String.format("Stage '%s': maxAttempts must be >= 1 but was %d", name, maxAttempts));
        }
        if (backoffBase == null || backoffBase.isNegative()) {
            throw new PipelineDefinitionException(
                    String.format("Stage '%s': backoffBase must be >= 0 but was %s", name, backoffBase));
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new PipelineDefinitionException(
                    String.format("Stage '%s': timeout must be positive but was %s", name, timeout));
        }
    }
}

package com.eyelevel.docpipeline.orchestrator;

import com.eyelevel.docpipeline.exception.RetryableStageException;
import com.eyelevel.docpipeline.pipeline.PipelineDefinition;
import com.eyelevel.docpipeline.pipeline.StageSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.NoBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the {@link RetryTemplate} that drives the attempts of one stage in one run.
 * <p>
 * Attempts already spent in an earlier run count against the stage's budget, and the backoff continues from
 * where that run stopped: the wait after overall attempt {@code n} is {@code backoffBase * 2^(n-1)}, capped at
 * the pipeline's maximum backoff. Only {@link RetryableStageException} is retried.
 */
@Component
@RequiredArgsConstructor
public class StageRetryTemplateFactory {

    private final PipelineDefinition pipeline;
    private final StageRetryListener stageRetryListener;

    /**
     * @param priorAttempts attempts recorded on the execution before this run; must be below the stage's budget.
     * @param token         cancels the backoff wait.
     */
    public RetryTemplate create(final StageSpec stage, final int priorAttempts, final CancellationToken token) {
        final int remaining = stage.maxAttempts() - priorAttempts;
        if (remaining < 1) {
            throw new IllegalArgumentException(String.format(
                    "Stage '%s' has no attempts left (%d of %d used)", stage.name(), priorAttempts, stage.maxAttempts()));
        }

        final RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(remaining, Map.of(RetryableStageException.class, true)));
        template.setBackOffPolicy(backOffPolicy(stage, priorAttempts, token));
        template.registerListener(stageRetryListener);
        return template;
    }

    private BackOffPolicy backOffPolicy(final StageSpec stage, final int priorAttempts,
                                        final CancellationToken token) {
        if (stage.backoffBase().isZero()) {
            return new NoBackOffPolicy();
        }
        final ExponentialBackOffPolicy policy = new ExponentialBackOffPolicy();
        policy.setInitialInterval(pipeline.backoffAfter(stage, priorAttempts + 1).toMillis());
        policy.setMultiplier(2.0);
        policy.setMaxInterval(pipeline.maxBackoff().toMillis());
        policy.setSleeper(token);
        return policy;
    }
}

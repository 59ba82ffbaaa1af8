package com.eyelevel.docpipeline.orchestrator;

import com.eyelevel.docpipeline.exception.ExecutionCancelledException;
import com.eyelevel.docpipeline.exception.TransientCollaboratorException;
import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.StagePayload;
import com.eyelevel.docpipeline.pipeline.StageSpec;
import com.eyelevel.docpipeline.stage.StageExecutor;
import com.eyelevel.docpipeline.stage.StageOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one stage call on the stage-call pool and bounds it by the stage's timeout.
 * <p>
 * Every failure mode is turned into a {@link StageOutcome}: a timeout or a saturated pool is retryable, an
 * exception escaping the stage is fatal unless it is a {@link TransientCollaboratorException}.
 */
@Slf4j
@Component
public class StageInvoker {

    private final AsyncTaskExecutor stageTaskExecutor;

    public StageInvoker(@Qualifier("stageTaskExecutor") final AsyncTaskExecutor stageTaskExecutor) {
        this.stageTaskExecutor = stageTaskExecutor;
    }

    /**
     * @throws ExecutionCancelledException if the calling thread is interrupted while waiting for the stage.
     */
    public StageOutcome invoke(final StageExecutor executor, final StageSpec stage, final DocumentRef document,
                               final StagePayload payload) {
        final Future<StageOutcome> future;
        try {
            future = stageTaskExecutor.submit(() -> executor.execute(document, payload));
        } catch (TaskRejectedException e) {
            log.warn("[{}] Stage '{}' call rejected by the stage pool: {}", document, stage.name(), e.getMessage());
            return StageOutcome.retryable("Stage call rejected: worker pool saturated");
        }

        try {
            final StageOutcome outcome = future.get(stage.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                return StageOutcome.fatal("Stage '" + stage.name() + "' returned no outcome");
            }
            return outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[{}] Stage '{}' exceeded its timeout of {}", document, stage.name(), stage.timeout());
            return StageOutcome.retryable("Stage timed out after " + stage.timeout());
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TransientCollaboratorException) {
                log.warn("[{}] Stage '{}' threw a transient failure: {}", document, stage.name(), cause.getMessage());
                return StageOutcome.retryable(cause.getMessage());
            }
            log.error("[{}] Stage '{}' threw an unexpected exception", document, stage.name(), cause);
            return StageOutcome.fatal(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException(
                    "Interrupted while waiting for stage '" + stage.name() + "' of " + document);
        }
    }
}

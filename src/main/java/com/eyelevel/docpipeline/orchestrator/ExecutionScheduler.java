package com.eyelevel.docpipeline.orchestrator;

import com.eyelevel.docpipeline.exception.ExecutionStoreException;
import com.eyelevel.docpipeline.model.ExecutionId;
import com.eyelevel.docpipeline.model.ExecutionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Hands executions to the pipeline worker pool, one local task per execution at a time.
 */
@Slf4j
@Component
public class ExecutionScheduler {

    private final ExecutionRunner runner;
    private final ActiveExecutionRegistry activeExecutions;
    private final TaskExecutor pipelineTaskExecutor;

    public ExecutionScheduler(final ExecutionRunner runner, final ActiveExecutionRegistry activeExecutions,
                              @Qualifier("pipelineTaskExecutor") final TaskExecutor pipelineTaskExecutor) {
        this.runner = runner;
        this.activeExecutions = activeExecutions;
        this.pipelineTaskExecutor = pipelineTaskExecutor;
    }

    /**
     * Queues a run of the execution.
     *
     * @return {@code true} if a task was queued; {@code false} if this process already drives the execution
     * or the pool refused the task (the recovery job picks it up later).
     */
    public boolean schedule(final ExecutionId executionId) {
        final Optional<CancellationToken> token = activeExecutions.register(executionId);
        if (token.isEmpty()) {
            log.debug("[{}] Execution is already active in this process; not scheduling again.", executionId);
            return false;
        }
        try {
            pipelineTaskExecutor.execute(() -> runRegistered(executionId, token.get()));
            return true;
        } catch (TaskRejectedException e) {
            activeExecutions.release(executionId, token.get());
            log.warn("[{}] Pipeline worker pool rejected the execution; it will be retried by recovery. {}",
                     executionId, e.getMessage());
            return false;
        }
    }

    /**
     * Runs the execution on the calling thread.
     *
     * @return the resulting record, or empty if this process is already driving the execution.
     */
    public Optional<ExecutionRecord> runNow(final ExecutionId executionId) {
        final Optional<CancellationToken> token = activeExecutions.register(executionId);
        if (token.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(runner.run(executionId, token.get()));
        } finally {
            activeExecutions.release(executionId, token.get());
        }
    }

    private void runRegistered(final ExecutionId executionId, final CancellationToken token) {
        try {
            runner.run(executionId, token);
        } catch (ExecutionStoreException e) {
            log.error("[{}] Execution store failure; the execution stays at its last checkpoint until recovery "
                              + "resumes it.", executionId, e);
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error while running execution.", executionId, e);
        } finally {
            activeExecutions.release(executionId, token);
        }
    }
}

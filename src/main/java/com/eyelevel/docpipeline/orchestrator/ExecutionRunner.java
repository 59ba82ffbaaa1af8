package com.eyelevel.docpipeline.orchestrator;

import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.exception.ConcurrentCheckpointException;
import com.eyelevel.docpipeline.exception.ExecutionCancelledException;
import com.eyelevel.docpipeline.exception.ExecutionNotFoundException;
import com.eyelevel.docpipeline.exception.FatalStageException;
import com.eyelevel.docpipeline.exception.RetryableStageException;
import com.eyelevel.docpipeline.exception.StageFailureException;
import com.eyelevel.docpipeline.exception.TerminalRecordModificationException;
import com.eyelevel.docpipeline.model.ExecutionId;
import com.eyelevel.docpipeline.model.ExecutionRecord;
import com.eyelevel.docpipeline.model.ExecutionStatus;
import com.eyelevel.docpipeline.model.StagePayload;
import com.eyelevel.docpipeline.pipeline.PipelineDefinition;
import com.eyelevel.docpipeline.pipeline.StageExecutorRegistry;
import com.eyelevel.docpipeline.pipeline.StageSpec;
import com.eyelevel.docpipeline.stage.StageExecutor;
import com.eyelevel.docpipeline.stage.StageOutcome;
import com.eyelevel.docpipeline.store.ExecutionRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The execution state machine. Claims an execution, then walks the pipeline from the record's current stage,
 * checkpointing after every stage and after every failed attempt, until the execution succeeds, fails,
 * is cancelled or loses its claim to another writer.
 * <p>
 * The runner never holds more than one working copy of a record; every copy it continues with is the one
 * returned by the store, so a write from anyone else makes its next checkpoint fail instead of overwriting.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionRunner {

    private final ExecutionRecordStore store;
    private final PipelineDefinition pipeline;
    private final StageExecutorRegistry stageRegistry;
    private final StageInvoker stageInvoker;
    private final StageRetryTemplateFactory retryTemplateFactory;
    private final CheckpointWriter checkpointWriter;
    private final WorkerIdentity workerIdentity;
    private final PipelineProperties properties;
    private final Clock clock;

    /**
     * Drives an execution as far as it can go in this call.
     *
     * @return the last known state of the record; terminal unless the run was cancelled or lost its claim.
     * @throws ExecutionNotFoundException                                  if no such execution exists.
     * @throws com.eyelevel.docpipeline.exception.ExecutionStoreException if a checkpoint cannot be written.
     */
    public ExecutionRecord run(final ExecutionId executionId, final CancellationToken token) {
        final ExecutionRecord record = store.load(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
        if (record.getStatus().isTerminal()) {
            log.info("[{}] Execution is already {}; nothing to run.", executionId, record.getStatus());
            return record;
        }
        if (record.isSuspended()) {
            log.info("[{}] Execution is suspended; resume it before running.", executionId);
            return record;
        }

        final Instant now = clock.instant();
        final Optional<ExecutionRecord> claimed = store.claim(executionId, workerIdentity.id(), now,
                                                              now.plus(properties.getLeaseDuration()));
        if (claimed.isEmpty()) {
            log.warn("[{}] Could not claim execution; it is owned by another worker or was suspended.", executionId);
            return store.load(executionId).orElse(record);
        }
        log.info("[{}] Claimed by worker '{}' for {} at stage {}/{}.", executionId, workerIdentity.id(),
                 record.documentRef(), claimed.get().getCurrentStageIndex(), pipeline.size());

        try {
            return drive(claimed.get(), token);
        } catch (ConcurrentCheckpointException | TerminalRecordModificationException e) {
            log.warn("[{}] Lost ownership of the execution; another writer changed it. {}", executionId,
                     e.getMessage());
            return store.load(executionId).orElse(record);
        }
    }

    private ExecutionRecord drive(final ExecutionRecord claimed, final CancellationToken token) {
        ExecutionRecord current = claimed;
        while (current.getCurrentStageIndex() < pipeline.size()) {
            if (token.isCancelled()) {
                return suspend(current);
            }
            current = runStage(current, pipeline.stage(current.getCurrentStageIndex()), token);
            if (current.getStatus() != ExecutionStatus.RUNNING) {
                return current;
            }
        }
        // every stage has completed but the success was never recorded
        final ExecutionRecord completed = current.copy();
        completed.setStatus(ExecutionStatus.SUCCEEDED);
        return checkpointWriter.checkpoint(completed);
    }

    private ExecutionRecord runStage(final ExecutionRecord record, final StageSpec stage,
                                     final CancellationToken token) {
        if (record.getAttempt() >= stage.maxAttempts()) {
            final String reason = record.getLastError() != null ? record.getLastError() : "retry budget exhausted";
            return fail(record, new RetryableStageException(stage.name(), record.getAttempt(), reason));
        }

        final StageExecutor executor = stageRegistry.get(stage.name());
        final RetryTemplate retryTemplate = retryTemplateFactory.create(stage, record.getAttempt(), token);
        final AtomicReference<ExecutionRecord> latest = new AtomicReference<>(record);
        try {
            final StagePayload result = retryTemplate.execute(
                    (RetryCallback<StagePayload, StageFailureException>) context ->
                            attemptOnce(latest, executor, stage, token));
            return completeStage(latest.get(), stage, result);
        } catch (RetryableStageException e) {
            log.error("[{}] Stage '{}' exhausted its {} attempts.", record.getExecutionId(), stage.name(),
                      stage.maxAttempts());
            return fail(latest.get(), e);
        } catch (FatalStageException e) {
            return fail(latest.get(), e);
        } catch (BackOffInterruptedException | ExecutionCancelledException e) {
            final boolean interrupted = Thread.interrupted();
            try {
                return suspend(latest.get());
            } finally {
                // a cancelled backoff reports itself as an interrupt; only a real one is handed back
                if (interrupted && !token.isCancelled()) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    /**
     * One attempt of a stage. Throws to hand control back to the retry template; a retryable failure is
     * checkpointed first whenever another attempt will follow.
     */
    private StagePayload attemptOnce(final AtomicReference<ExecutionRecord> latest, final StageExecutor executor,
                                     final StageSpec stage, final CancellationToken token) {
        final ExecutionRecord current = latest.get();
        if (token.isCancelled()) {
            throw new ExecutionCancelledException("Execution " + current.getExecutionId() + " was cancelled");
        }
        final int attemptNumber = current.getAttempt() + 1;
        log.info("[{}] Running stage '{}' (attempt {}/{}).", current.getExecutionId(), stage.name(), attemptNumber,
                 stage.maxAttempts());

        final StageOutcome outcome = stageInvoker.invoke(executor, stage, current.documentRef(),
                                                         current.getPayload().deepCopy());
        switch (outcome.getType()) {
            case SUCCESS:
                return outcome.getPayload();
            case RETRYABLE:
                final RetryableStageException failure =
                        new RetryableStageException(stage.name(), attemptNumber, outcome.getReason());
                final ExecutionRecord failed = current.copy();
                failed.setAttempt(attemptNumber);
                failed.setLastError(failure.getMessage());
                latest.set(attemptNumber < stage.maxAttempts() ? checkpointWriter.checkpoint(failed) : failed);
                throw failure;
            case FATAL:
            default:
                throw new FatalStageException(stage.name(), attemptNumber, outcome.getReason());
        }
    }

    private ExecutionRecord completeStage(final ExecutionRecord record, final StageSpec stage,
                                          final StagePayload result) {
        final int nextIndex = record.getCurrentStageIndex() + 1;
        final ExecutionRecord next = record.copy();
        next.setPayload(record.getPayload().mergedWith(result));
        next.setCurrentStageIndex(nextIndex);
        next.setAttempt(0);
        next.setLastError(null);
        if (nextIndex == pipeline.size()) {
            next.setStatus(ExecutionStatus.SUCCEEDED);
        }
        final ExecutionRecord saved = checkpointWriter.checkpoint(next);
        log.info("[{}] Stage '{}' completed; checkpoint at stage {}/{}.", saved.getExecutionId(), stage.name(),
                 nextIndex, pipeline.size());
        if (saved.getStatus() == ExecutionStatus.SUCCEEDED) {
            log.info("[{}] Execution for {} SUCCEEDED.", saved.getExecutionId(), saved.documentRef());
        }
        return saved;
    }

    private ExecutionRecord fail(final ExecutionRecord record, final StageFailureException failure) {
        final ExecutionRecord failed = record.copy();
        failed.setStatus(ExecutionStatus.FAILED);
        failed.setAttempt(failure.getAttemptNumber());
        failed.setLastError(failure.getMessage());
        final ExecutionRecord saved = checkpointWriter.checkpoint(failed);
        log.error("[{}] Execution for {} FAILED at stage '{}': {}", saved.getExecutionId(), saved.documentRef(),
                  failure.getStageName(), failure.getMessage());
        return saved;
    }

    private ExecutionRecord suspend(final ExecutionRecord record) {
        final ExecutionRecord suspended = record.copy();
        suspended.setStatus(ExecutionStatus.PENDING);
        suspended.setSuspended(true);
        final ExecutionRecord saved = checkpointWriter.checkpoint(suspended);
        log.info("[{}] Execution cancelled; suspended at stage {}/{}.", saved.getExecutionId(),
                 saved.getCurrentStageIndex(), pipeline.size());
        return saved;
    }
}

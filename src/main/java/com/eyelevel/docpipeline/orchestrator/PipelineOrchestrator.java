package com.eyelevel.docpipeline.orchestrator;

import com.eyelevel.docpipeline.exception.ConcurrentCheckpointException;
import com.eyelevel.docpipeline.exception.ExecutionNotFoundException;
import com.eyelevel.docpipeline.exception.InvalidExecutionStateException;
import com.eyelevel.docpipeline.model.AuditEventType;
import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.ExecutionAuditEvent;
import com.eyelevel.docpipeline.model.ExecutionId;
import com.eyelevel.docpipeline.model.ExecutionRecord;
import com.eyelevel.docpipeline.model.ExecutionSnapshot;
import com.eyelevel.docpipeline.model.ExecutionStatus;
import com.eyelevel.docpipeline.model.ExecutionStatusView;
import com.eyelevel.docpipeline.model.StagePayload;
import com.eyelevel.docpipeline.pipeline.PipelineDefinition;
import com.eyelevel.docpipeline.store.ExecutionRecordStore;
import com.eyelevel.docpipeline.store.ExecutionRecordStore.CreationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Entry point of the pipeline engine for triggers, the admin API and the recovery job.
 * <p>
 * Executions are keyed by {@link ExecutionId#of(DocumentRef)}, so repeated triggers for a document always land
 * on the same record. Finished executions are only run again through {@link #replay(DocumentRef)} or
 * {@link #retryFromStage(ExecutionId, int)}, both of which leave an audit event behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private static final int CANCEL_ATTEMPTS = 3;

    private final ExecutionRecordStore store;
    private final ExecutionScheduler scheduler;
    private final ActiveExecutionRegistry activeExecutions;
    private final CheckpointWriter checkpointWriter;
    private final PipelineDefinition pipeline;
    private final Clock clock;

    /**
     * Starts processing a document, or coalesces into its existing execution.
     * <p>
     * A new execution is created {@code PENDING} and scheduled. An existing one is returned as is; if it is
     * {@code PENDING} and not suspended it is scheduled again, which is a no-op when someone already drives it.
     *
     * @return the execution id of the document.
     */
    public ExecutionId start(final DocumentRef document) {
        final CreationResult result = store.createIfAbsent(ExecutionRecord.pending(document, clock.instant()));
        final ExecutionRecord record = result.record();
        final ExecutionId executionId = record.id();

        if (result.created()) {
            log.info("[{}] Created execution for {}.", executionId, document);
            scheduler.schedule(executionId);
        } else {
            log.info("[{}] Execution for {} already exists with status {}; trigger coalesced.", executionId,
                     document, record.getStatus());
            if (record.getStatus() == ExecutionStatus.PENDING && !record.isSuspended()) {
                scheduler.schedule(executionId);
            }
        }
        return executionId;
    }

    /**
     * Runs an execution synchronously on the calling thread.
     *
     * @throws InvalidExecutionStateException if this process is already driving the execution.
     */
    public ExecutionRecord run(final ExecutionId executionId) {
        return scheduler.runNow(executionId).orElseThrow(() -> new InvalidExecutionStateException(
                "Execution " + executionId + " is already running in this process"));
    }

    /**
     * Cancels an execution at its next cancellation point, leaving it at its last checkpoint, suspended and
     * resumable. An execution driven by this process stops at the next stage boundary or backoff wait; any
     * other execution is suspended in the store directly.
     *
     * @throws InvalidExecutionStateException if the execution already finished.
     */
    public ExecutionStatusView cancel(final ExecutionId executionId) {
        ExecutionRecord record = load(executionId);
        for (int attempt = 1; attempt <= CANCEL_ATTEMPTS; attempt++) {
            if (record.getStatus().isTerminal()) {
                throw new InvalidExecutionStateException(
                        "Execution " + executionId + " is already " + record.getStatus() + " and cannot be cancelled");
            }
            if (activeExecutions.cancel(executionId) || record.isSuspended()) {
                return view(record);
            }
            final ExecutionRecord suspended = record.copy();
            suspended.setStatus(ExecutionStatus.PENDING);
            suspended.setSuspended(true);
            try {
                final ExecutionRecord saved = checkpointWriter.checkpoint(suspended);
                log.info("[{}] Execution suspended at stage {}/{}.", executionId, saved.getCurrentStageIndex(),
                         pipeline.size());
                return view(saved);
            } catch (ConcurrentCheckpointException e) {
                log.debug("[{}] Execution changed while cancelling (attempt {}); reloading.", executionId, attempt);
                record = load(executionId);
            }
        }
        throw new ConcurrentCheckpointException(
                "Execution " + executionId + " kept changing; cancellation was not recorded after "
                        + CANCEL_ATTEMPTS + " attempts");
    }

    /**
     * Schedules an unfinished execution again, lifting a previous cancellation.
     *
     * @throws InvalidExecutionStateException if the execution already finished.
     */
    public ExecutionStatusView resume(final ExecutionId executionId) {
        ExecutionRecord record = load(executionId);
        if (record.getStatus().isTerminal()) {
            throw new InvalidExecutionStateException(
                    "Execution " + executionId + " is already " + record.getStatus() + "; use replay or retry instead");
        }
        if (record.isSuspended()) {
            final ExecutionRecord resumed = record.copy();
            resumed.setSuspended(false);
            record = checkpointWriter.checkpoint(resumed);
            log.info("[{}] Execution resumed at stage {}/{}.", executionId, record.getCurrentStageIndex(),
                     pipeline.size());
        }
        scheduler.schedule(executionId);
        return view(record);
    }

    /**
     * Processes a finished document again from the first stage, starting over from the trigger payload.
     *
     * @throws ExecutionNotFoundException     if the document was never started.
     * @throws InvalidExecutionStateException if its execution has not finished.
     */
    public ExecutionId replay(final DocumentRef document) {
        final ExecutionId executionId = ExecutionId.of(document);
        final ExecutionRecord record = store.load(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(document));
        requireTerminal(record, "replayed");

        final ExecutionRecord reopened = reopenedCopy(record, 0);
        reopened.setPayload(StagePayload.seed(document));
        store.reopen(reopened, ExecutionAuditEvent.of(record, AuditEventType.REPLAY, 0, reopened.getUpdatedAt()));
        log.info("[{}] Replaying {} (was {}).", executionId, document, record.getStatus());

        scheduler.schedule(executionId);
        return executionId;
    }

    /**
     * Reruns a finished execution from the given stage, keeping the payload of the stages before it.
     * This is the only operation that moves an execution's stage index backwards.
     *
     * @param stageIndex must not exceed the stage the execution reached.
     * @throws InvalidExecutionStateException if the execution has not finished or the index is out of range.
     */
    public ExecutionStatusView retryFromStage(final ExecutionId executionId, final int stageIndex) {
        final ExecutionRecord record = load(executionId);
        requireTerminal(record, "retried");
        final int highest = Math.min(record.getCurrentStageIndex(), pipeline.size() - 1);
        if (stageIndex < 0 || stageIndex > highest) {
            throw new InvalidExecutionStateException(String.format(
                    "Stage index %d is out of range for execution %s; expected 0..%d", stageIndex, executionId,
                    highest));
        }

        final ExecutionRecord reopened = reopenedCopy(record, stageIndex);
        final ExecutionRecord saved = store.reopen(reopened, ExecutionAuditEvent.of(
                record, AuditEventType.RETRY_FROM_STAGE, stageIndex, reopened.getUpdatedAt()));
        log.info("[{}] Retrying from stage '{}' (was {} at stage {}).", executionId, pipeline.stageNameAt(stageIndex),
                 record.getStatus(), record.getCurrentStageIndex());

        scheduler.schedule(executionId);
        return view(saved);
    }

    /**
     * @throws ExecutionNotFoundException if the document was never started.
     */
    public ExecutionStatusView getExecutionStatus(final DocumentRef document) {
        final ExecutionRecord record = store.load(ExecutionId.of(document))
                .orElseThrow(() -> new ExecutionNotFoundException(document));
        return view(record);
    }

    public ExecutionStatusView getExecutionStatus(final ExecutionId executionId) {
        return view(load(executionId));
    }

    public ExecutionSnapshot describe(final ExecutionId executionId) {
        final ExecutionRecord record = load(executionId);
        return new ExecutionSnapshot(record, pipeline.stageNameAt(record.getCurrentStageIndex()),
                                     store.auditTrail(executionId));
    }

    private ExecutionRecord load(final ExecutionId executionId) {
        return store.load(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }

    private ExecutionRecord reopenedCopy(final ExecutionRecord record, final int stageIndex) {
        final Instant now = clock.instant();
        final ExecutionRecord reopened = record.copy();
        reopened.setStatus(ExecutionStatus.PENDING);
        reopened.setCurrentStageIndex(stageIndex);
        reopened.setAttempt(0);
        reopened.setLastError(null);
        reopened.setSuspended(false);
        reopened.setLeaseOwner(null);
        reopened.setLeaseExpiresAt(null);
        reopened.setUpdatedAt(now);
        return reopened;
    }

    private static void requireTerminal(final ExecutionRecord record, final String action) {
        if (!record.getStatus().isTerminal()) {
            throw new InvalidExecutionStateException(String.format(
                    "Execution %s is %s; only finished executions can be %s", record.getExecutionId(),
                    record.getStatus(), action));
        }
    }

    private ExecutionStatusView view(final ExecutionRecord record) {
        return new ExecutionStatusView(record.getExecutionId(), record.getStatus(),
                                       pipeline.stageNameAt(record.getCurrentStageIndex()),
                                       record.getCurrentStageIndex(), record.getAttempt(), record.getLastError(),
                                       record.isSuspended(), record.getUpdatedAt());
    }
}

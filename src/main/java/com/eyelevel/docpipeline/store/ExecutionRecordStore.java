package com.eyelevel.docpipeline.store;

import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.ExecutionAuditEvent;
import com.eyelevel.docpipeline.model.ExecutionId;
import com.eyelevel.docpipeline.model.ExecutionRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of {@link ExecutionRecord}s and the only state shared between workers.
 * <p>
 * Records go in and come out as detached copies; a caller never holds a reference into the store.
 * Every write is a compare-and-set on {@link ExecutionRecord#getVersion()}: a save based on an outdated copy
 * is rejected, so at most one writer can advance an execution. Implementations throw
 * {@link com.eyelevel.docpipeline.exception.ExecutionStoreException} when the backing storage fails.
 */
public interface ExecutionRecordStore {

    /**
     * Inserts the record unless one with the same execution id exists.
     *
     * @return the stored record and whether this call created it.
     */
    CreationResult createIfAbsent(ExecutionRecord record);

    Optional<ExecutionRecord> load(ExecutionId executionId);

    /**
     * Looks up the execution of a document, if one was ever started.
     */
    Optional<ExecutionId> findIdByDocument(DocumentRef document);

    /**
     * Checkpoints a record.
     *
     * @return the stored copy, carrying the new version.
     * @throws com.eyelevel.docpipeline.exception.ExecutionNotFoundException          if the record does not exist.
     * @throws com.eyelevel.docpipeline.exception.ConcurrentCheckpointException       if the stored version differs.
     * @throws com.eyelevel.docpipeline.exception.TerminalRecordModificationException if the stored record is
     *                                                                                already terminal.
     */
    ExecutionRecord save(ExecutionRecord record);

    /**
     * Takes ownership of an execution for {@code owner} until {@code leaseUntil}. Granted when the record is not
     * suspended and is {@code PENDING}, or {@code RUNNING} under a lease that {@code owner} holds or that expired
     * before {@code now}. The granted record is {@code RUNNING}.
     *
     * @return the claimed record, or empty if the claim was refused or the record does not exist.
     */
    Optional<ExecutionRecord> claim(ExecutionId executionId, String owner, Instant now, Instant leaseUntil);

    /**
     * Replaces a terminal record with a reopened one and appends the audit event, atomically.
     * This is the only write allowed on a terminal record.
     *
     * @throws com.eyelevel.docpipeline.exception.InvalidExecutionStateException if the stored record is not
     *                                                                           terminal.
     * @throws com.eyelevel.docpipeline.exception.ConcurrentCheckpointException  if the stored version differs.
     */
    ExecutionRecord reopen(ExecutionRecord reopened, ExecutionAuditEvent event);

    /**
     * Audit events of an execution, oldest first.
     */
    List<ExecutionAuditEvent> auditTrail(ExecutionId executionId);

    /**
     * Executions left without a driver: {@code RUNNING} whose lease expired before {@code now}, and
     * {@code PENDING} last touched before {@code pendingBefore}. Suspended executions are never returned.
     */
    List<ExecutionId> findRecoverable(Instant now, Instant pendingBefore);

    record CreationResult(ExecutionRecord record, boolean created) {
    }
}

package com.eyelevel.docpipeline.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The persisted state of one pipeline run for one document.
 * <p>
 * {@code currentStageIndex} is the index of the next stage to run; it only moves forward, except through an
 * explicit retry-from-stage. Once {@code status} is terminal the record is only changed by a replay, which
 * always appends an {@link ExecutionAuditEvent}. The {@code version} column makes every save a
 * compare-and-set, so two writers can never both advance the same execution.
 */
@Entity
@Table(name = "pipeline_execution")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRecord {

    @Id
    @Column(name = "execution_id", length = 64)
    private String executionId;

    @Column(nullable = false)
    private String container;

    @Column(name = "object_key", nullable = false, length = 1024)
    private String objectKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ExecutionStatus status;

    @Column(nullable = false)
    private int currentStageIndex;

    @Convert(converter = StagePayloadConverter.class)
    @Column(columnDefinition = "TEXT")
    private StagePayload payload;

    /**
     * Attempts made so far on the stage at {@code currentStageIndex}. Reset to zero when a stage succeeds.
     */
    @Column(nullable = false)
    private int attempt;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    /**
     * Set when the execution was cancelled. A suspended record is not claimed until it is resumed.
     */
    @Column(nullable = false)
    private boolean suspended;

    @Column
    private String leaseOwner;

    @Column
    private Instant leaseExpiresAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    /**
     * Creates the first record of an execution, as written on the first trigger for a document.
     */
    public static ExecutionRecord pending(final DocumentRef document, final Instant now) {
        return ExecutionRecord.builder()
                .executionId(ExecutionId.of(document).value())
                .container(document.container())
                .objectKey(document.key())
                .status(ExecutionStatus.PENDING)
                .currentStageIndex(0)
                .payload(StagePayload.seed(document))
                .attempt(0)
                .suspended(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public DocumentRef documentRef() {
        return new DocumentRef(container, objectKey);
    }

    public ExecutionId id() {
        return new ExecutionId(executionId);
    }

    /**
     * A detached copy that shares no mutable state with this record.
     */
    public ExecutionRecord copy() {
        return toBuilder().payload(payload == null ? null : payload.deepCopy()).build();
    }
}

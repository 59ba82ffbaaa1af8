package com.eyelevel.docpipeline.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An append-only entry recording a manual reopen of a terminal execution, together with the state it replaced.
 */
@Entity
@Table(name = "pipeline_execution_audit", indexes = @Index(name = "idx_audit_execution", columnList = "execution_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionAuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "execution_id", nullable = false, length = 64)
    private String executionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AuditEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ExecutionStatus previousStatus;

    @Column(nullable = false)
    private int previousStageIndex;

    @Column(columnDefinition = "TEXT")
    private String previousLastError;

    @Column(nullable = false)
    private int requestedStageIndex;

    @Column(nullable = false)
    private Instant occurredAt;

    public static ExecutionAuditEvent of(final ExecutionRecord replaced, final AuditEventType type,
                                         final int requestedStageIndex, final Instant now) {
        return ExecutionAuditEvent.builder()
                .executionId(replaced.getExecutionId())
                .eventType(type)
                .previousStatus(replaced.getStatus())
                .previousStageIndex(replaced.getCurrentStageIndex())
                .previousLastError(replaced.getLastError())
                .requestedStageIndex(requestedStageIndex)
                .occurredAt(now)
                .build();
    }
}

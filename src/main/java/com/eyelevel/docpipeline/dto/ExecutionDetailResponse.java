package com.eyelevel.docpipeline.dto;

import com.eyelevel.docpipeline.model.ExecutionAuditEvent;
import com.eyelevel.docpipeline.model.ExecutionRecord;
import com.eyelevel.docpipeline.model.ExecutionSnapshot;
import com.eyelevel.docpipeline.model.ExecutionStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Full view of one execution, including its payload and audit trail.
 */
@Getter
@Builder
public class ExecutionDetailResponse {

    private final String executionId;
    private final String container;
    private final String key;
    private final ExecutionStatus status;
    private final String currentStage;
    private final int currentStageIndex;
    private final int attempt;
    private final String lastError;
    private final boolean suspended;
    private final String leaseOwner;
    private final Instant leaseExpiresAt;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Map<String, Object> payload;
    private final List<AuditEntry> auditTrail;

    public record AuditEntry(String eventType, ExecutionStatus previousStatus, int previousStageIndex,
                             String previousLastError, int requestedStageIndex, Instant occurredAt) {

        static AuditEntry of(final ExecutionAuditEvent event) {
            return new AuditEntry(event.getEventType().name(), event.getPreviousStatus(),
                                  event.getPreviousStageIndex(), event.getPreviousLastError(),
                                  event.getRequestedStageIndex(), event.getOccurredAt());
        }
    }

    public static ExecutionDetailResponse from(final ExecutionSnapshot snapshot) {
        final ExecutionRecord record = snapshot.record();
        return ExecutionDetailResponse.builder()
                .executionId(record.getExecutionId())
                .container(record.getContainer())
                .key(record.getObjectKey())
                .status(record.getStatus())
                .currentStage(snapshot.currentStage())
                .currentStageIndex(record.getCurrentStageIndex())
                .attempt(record.getAttempt())
                .lastError(record.getLastError())
                .suspended(record.isSuspended())
                .leaseOwner(record.getLeaseOwner())
                .leaseExpiresAt(record.getLeaseExpiresAt())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .payload(record.getPayload() == null ? Map.of() : record.getPayload().asMap())
                .auditTrail(snapshot.auditTrail().stream().map(AuditEntry::of).toList())
                .build();
    }
}

package com.eyelevel.docpipeline.model;

import java.util.List;

/**
 * An execution record together with its audit trail.
 *
 * @param currentStage Name of the stage at the record's stage index, or {@code null} once every stage completed.
 */
public record ExecutionSnapshot(ExecutionRecord record, String currentStage, List<ExecutionAuditEvent> auditTrail) {
}

package com.eyelevel.docpipeline.model;

import java.time.Instant;

/**
 * Operational view of an execution, as returned by the status query.
 *
 * @param currentStage Name of the stage the execution is at, or {@code null} once every stage has completed.
 */
public record ExecutionStatusView(String executionId,
                                  ExecutionStatus status,
                                  String currentStage,
                                  int currentStageIndex,
                                  int attempt,
                                  String lastError,
                                  boolean suspended,
                                  Instant updatedAt) {
}

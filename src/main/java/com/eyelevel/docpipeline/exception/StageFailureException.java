package com.eyelevel.docpipeline.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Base type for a failed stage attempt, carrying the stage name and the attempt number that failed.
 */
@Getter
public abstract class StageFailureException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 2917554026481170943L;

    private final String stageName;
    private final int attemptNumber;
    private final String reason;

    protected StageFailureException(String stageName, int attemptNumber, String reason) {
        super(String.format("Stage '%s' failed on attempt %d: %s", stageName, attemptNumber, reason));
        this.stageName = stageName;
        this.attemptNumber = attemptNumber;
        this.reason = reason;
    }
}

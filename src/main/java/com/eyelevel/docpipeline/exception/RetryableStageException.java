package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Raised inside the stage retry loop when a stage reports a recoverable failure.
 */
public class RetryableStageException extends StageFailureException {
    @Serial
    private static final long serialVersionUID = -1103342370457620812L;

    public RetryableStageException(String stageName, int attemptNumber, String reason) {
        super(stageName, attemptNumber, reason);
    }
}

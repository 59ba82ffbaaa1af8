package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Raised inside the stage retry loop when a stage reports a failure that must not be retried.
 */
public class FatalStageException extends StageFailureException {
    @Serial
    private static final long serialVersionUID = 4408190218722649536L;

    public FatalStageException(String stageName, int attemptNumber, String reason) {
        super(stageName, attemptNumber, reason);
    }
}

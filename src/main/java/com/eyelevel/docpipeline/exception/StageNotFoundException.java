package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Thrown when a stage name has no registered executor.
 */
public class StageNotFoundException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 8829471390651126047L;

    public StageNotFoundException(String stageName) {
        super("No stage executor registered for stage '" + stageName + "'");
    }
}

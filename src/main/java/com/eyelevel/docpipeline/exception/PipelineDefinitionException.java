package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Thrown when a pipeline definition is invalid or references a stage with no registered executor.
 */
public class PipelineDefinitionException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 6903312458861722410L;

    public PipelineDefinitionException(String message) {
        super(message);
    }

    public PipelineDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}

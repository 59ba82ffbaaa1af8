package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Thrown when an operation is not allowed in the execution's current state,
 * e.g. replaying an execution that has not finished.
 */
public class InvalidExecutionStateException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 1839950204615832044L;

    public InvalidExecutionStateException(String message) {
        super(message);
    }

    public InvalidExecutionStateException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Thrown when the execution record store cannot be reached or fails to complete an operation.
 * Callers treat it as transient: the operation may be retried and the execution resumes from its last checkpoint.
 */
public class ExecutionStoreException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 7160453921553276642L;

    public ExecutionStoreException(String message) {
        super(message);
    }

    public ExecutionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

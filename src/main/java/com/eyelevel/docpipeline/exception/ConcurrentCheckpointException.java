package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Thrown when a save is rejected because another writer changed the execution record first.
 * The current writer no longer owns the execution and must stop advancing it.
 */
public class ConcurrentCheckpointException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 2284117645093381207L;

    public ConcurrentCheckpointException(String message) {
        super(message);
    }

    public ConcurrentCheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}

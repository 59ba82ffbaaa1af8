package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Signals that a running execution was cancelled (or its worker thread interrupted) at a suspension point.
 */
public class ExecutionCancelledException extends PipelineException {
    @Serial
    private static final long serialVersionUID = -5839263309113527006L;

    public ExecutionCancelledException(String message) {
        super(message);
    }
}

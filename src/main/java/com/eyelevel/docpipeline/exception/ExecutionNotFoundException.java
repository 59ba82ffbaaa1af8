package com.eyelevel.docpipeline.exception;

import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.ExecutionId;

import java.io.Serial;

/**
 * Thrown when no execution record exists for the requested execution or document.
 */
public class ExecutionNotFoundException extends PipelineException {
    @Serial
    private static final long serialVersionUID = -2983715063377458315L;

    public ExecutionNotFoundException(ExecutionId executionId) {
        super("No execution found with ID " + executionId);
    }

    public ExecutionNotFoundException(DocumentRef document) {
        super("No execution found for document " + document);
    }
}

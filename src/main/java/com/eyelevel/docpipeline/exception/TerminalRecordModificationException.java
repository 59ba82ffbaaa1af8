package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Thrown when a write would change a terminal execution record outside the replay path.
 */
public class TerminalRecordModificationException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 5512078390421197713L;

    public TerminalRecordModificationException(String message) {
        super(message);
    }

    public TerminalRecordModificationException(String message, Throwable cause) {
        super(message, cause);
    }
}

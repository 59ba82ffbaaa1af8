package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * A collaborator failure that may succeed when retried: throttling, timeouts, network errors, 5xx responses.
 */
public class TransientCollaboratorException extends CollaboratorException {
    @Serial
    private static final long serialVersionUID = 1292651380845711027L;

    public TransientCollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * A collaborator failure that retrying cannot fix: malformed or unsupported documents, rejected requests,
 * missing permissions.
 */
public class PermanentCollaboratorException extends CollaboratorException {
    @Serial
    private static final long serialVersionUID = -7735016254479130915L;

    public PermanentCollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}

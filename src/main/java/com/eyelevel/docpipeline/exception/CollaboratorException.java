package com.eyelevel.docpipeline.exception;

import java.io.Serial;

/**
 * Base type for failures reported by an external collaborator (OCR, sentiment analysis, result storage).
 * Adapters raise one of the two subtypes so that stages can map the failure onto a stage outcome
 * without knowing the provider's own exception types.
 */
public abstract class CollaboratorException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -6418024570318823310L;

    protected CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}

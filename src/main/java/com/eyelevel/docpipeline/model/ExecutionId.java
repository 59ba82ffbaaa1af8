package com.eyelevel.docpipeline.model;

import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.util.Assert;

/**
 * Identifier of an execution, derived deterministically from its {@link DocumentRef} so that duplicate
 * trigger events for the same document resolve to the same execution.
 *
 * @param value The hex-encoded SHA-256 digest of the document reference.
 */
public record ExecutionId(String value) {

    private static final char SEPARATOR = '\u0000';

    public ExecutionId {
        Assert.hasText(value, "Execution id must not be blank");
    }

    /**
     * Derives the execution id for a document. Container and key are joined with a NUL separator, which
     * neither S3 bucket names nor sane object keys contain, so distinct references never share an input.
     */
    public static ExecutionId of(final DocumentRef document) {
        return new ExecutionId(DigestUtils.sha256Hex(document.container() + SEPARATOR + document.key()));
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.eyelevel.docpipeline.model;

import org.springframework.util.Assert;

/**
 * Immutable identity of a document in object storage. It is the idempotency key for executions:
 * every trigger for the same container and key maps to the same {@link ExecutionId}.
 *
 * @param container The storage container (S3 bucket) holding the document.
 * @param key       The object key of the document inside the container.
 */
public record DocumentRef(String container, String key) {

    public DocumentRef {
        Assert.hasText(container, "Document container must not be blank");
        Assert.hasText(key, "Document key must not be blank");
    }

    @Override
    public String toString() {
        return container + "/" + key;
    }
}

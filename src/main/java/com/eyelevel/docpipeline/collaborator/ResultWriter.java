package com.eyelevel.docpipeline.collaborator;

/**
 * Publishes the final result document of an execution.
 */
public interface ResultWriter {

    /**
     * Writes a JSON document, replacing any previous object at the same location.
     *
     * @return The URI of the written object, e.g. {@code s3://docs/results/a.pdf.json}.
     * @throws com.eyelevel.docpipeline.exception.TransientCollaboratorException on throttling and service errors.
     * @throws com.eyelevel.docpipeline.exception.PermanentCollaboratorException when the write is rejected.
     */
    String write(String container, String key, String json);
}

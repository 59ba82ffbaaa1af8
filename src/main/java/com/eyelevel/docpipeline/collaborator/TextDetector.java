package com.eyelevel.docpipeline.collaborator;

import com.eyelevel.docpipeline.model.DocumentRef;

import java.util.List;

/**
 * OCR capability used by the text extraction stage.
 */
public interface TextDetector {

    /**
     * Detects the text lines of a stored document, in reading order.
     *
     * @throws com.eyelevel.docpipeline.exception.TransientCollaboratorException on throttling, timeouts and
     *                                                                            service errors.
     * @throws com.eyelevel.docpipeline.exception.PermanentCollaboratorException when the document is malformed,
     *                                                                            unsupported or inaccessible.
     */
    List<String> detectText(DocumentRef document);
}

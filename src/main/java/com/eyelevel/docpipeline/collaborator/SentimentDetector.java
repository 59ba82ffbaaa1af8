package com.eyelevel.docpipeline.collaborator;

/**
 * Sentiment analysis capability used by the analysis stage.
 */
public interface SentimentDetector {

    /**
     * @param text         Text to analyze, already truncated to the provider's input limit.
     * @param languageCode ISO language code of the text, e.g. {@code en}.
     * @throws com.eyelevel.docpipeline.exception.TransientCollaboratorException on throttling and service errors.
     * @throws com.eyelevel.docpipeline.exception.PermanentCollaboratorException when the request is rejected.
     */
    SentimentResult detectSentiment(String text, String languageCode);
}

package com.eyelevel.docpipeline.collaborator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param label         The dominant sentiment, e.g. {@code POSITIVE}.
 * @param scorePerLabel Confidence per label, e.g. {@code Positive -> 0.97}, in the order the detector reported them.
 */
public record SentimentResult(String label, Map<String, Double> scorePerLabel) {

    public SentimentResult {
        scorePerLabel = scorePerLabel == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(scorePerLabel));
    }
}

package com.eyelevel.docpipeline.stage.impl;

import com.eyelevel.docpipeline.collaborator.SentimentDetector;
import com.eyelevel.docpipeline.collaborator.SentimentResult;
import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.exception.PermanentCollaboratorException;
import com.eyelevel.docpipeline.exception.TransientCollaboratorException;
import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.PayloadKeys;
import com.eyelevel.docpipeline.model.StagePayload;
import com.eyelevel.docpipeline.stage.StageExecutor;
import com.eyelevel.docpipeline.stage.StageOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs sentiment analysis over the extracted text and stores {@code {sentiment, scores}} under {@code analysis}.
 * <p>
 * Text longer than {@code app.pipeline.analysis.max-input-chars} is truncated before the call; truncation is
 * not an error. The stored {@code text} itself is left untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisStage implements StageExecutor {

    public static final String NAME = "analyze-text";

    private final SentimentDetector sentimentDetector;
    private final PipelineProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageOutcome execute(final DocumentRef document, final StagePayload payload) {
        if (!payload.containsKey(PayloadKeys.TEXT)) {
            return StageOutcome.fatal("Payload has no '" + PayloadKeys.TEXT + "' to analyze");
        }
        final String text = payload.getString(PayloadKeys.TEXT);
        if (!StringUtils.hasText(text)) {
            return StageOutcome.fatal("Extracted text is empty; nothing to analyze");
        }

        final int maxChars = properties.getAnalysis().getMaxInputChars();
        final String input = truncate(text, maxChars);
        if (input.length() < text.length()) {
            log.info("[{}] Truncated text from {} to {} characters before analysis.", document, text.length(),
                     input.length());
        }

        final SentimentResult result;
        try {
            result = sentimentDetector.detectSentiment(input, properties.getAnalysis().getLanguageCode());
        } catch (TransientCollaboratorException e) {
            log.warn("[{}] Sentiment detection failed transiently: {}", document, e.getMessage());
            return StageOutcome.retryable("Sentiment detection unavailable: " + e.getMessage());
        } catch (PermanentCollaboratorException e) {
            log.error("[{}] Sentiment detection rejected the text: {}", document, e.getMessage());
            return StageOutcome.fatal("Sentiment detection rejected the text: " + e.getMessage());
        }

        final Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("sentiment", result.label());
        analysis.put("scores", new LinkedHashMap<>(result.scorePerLabel()));
        log.info("[{}] Sentiment detected: {}", document, result.label());
        return StageOutcome.success(payload.put(PayloadKeys.ANALYSIS, analysis));
    }

    /**
     * Cuts {@code text} to at most {@code maxChars} UTF-16 units without splitting a surrogate pair.
     */
    static String truncate(final String text, final int maxChars) {
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        int end = maxChars;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}

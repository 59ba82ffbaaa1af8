package com.eyelevel.docpipeline.stage.impl;

import com.eyelevel.docpipeline.collaborator.TextDetector;
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

import java.util.List;

/**
 * Runs OCR on the document and stores the detected lines, joined with newlines, under {@code text}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextExtractionStage implements StageExecutor {

    public static final String NAME = "extract-text";

    private final TextDetector textDetector;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageOutcome execute(final DocumentRef document, final StagePayload payload) {
        final List<String> lines;
        try {
            lines = textDetector.detectText(document);
        } catch (TransientCollaboratorException e) {
            log.warn("[{}] Text detection failed transiently: {}", document, e.getMessage());
            return StageOutcome.retryable("Text detection unavailable: " + e.getMessage());
        } catch (PermanentCollaboratorException e) {
            log.error("[{}] Text detection rejected the document: {}", document, e.getMessage());
            return StageOutcome.fatal("Text detection rejected the document: " + e.getMessage());
        }

        final String text = String.join("\n", lines);
        log.info("[{}] Extracted {} lines ({} characters) of text.", document, lines.size(), text.length());
        return StageOutcome.success(payload.put(PayloadKeys.TEXT, text));
    }
}

package com.eyelevel.docpipeline.stage.impl;

import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.PayloadKeys;
import com.eyelevel.docpipeline.model.StagePayload;
import com.eyelevel.docpipeline.stage.StageExecutor;
import com.eyelevel.docpipeline.stage.StageOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives the document's title (last path segment of the key) and source (its container).
 * Makes no external call and never fails transiently.
 */
@Slf4j
@Component
public class MetadataStage implements StageExecutor {

    public static final String NAME = "extract-metadata";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageOutcome execute(final DocumentRef document, final StagePayload payload) {
        String title = StringUtils.getFilename(document.key());
        if (!StringUtils.hasText(title)) {
            // keys ending in '/' have no file name segment
            title = document.key();
        }
        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", title);
        metadata.put("source", document.container());

        log.debug("[{}] Derived metadata {}", document, metadata);
        return StageOutcome.success(payload.put(PayloadKeys.METADATA, metadata));
    }
}

package com.eyelevel.docpipeline.collaborator;

import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.model.DocumentRef;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Derives the deterministic output location of a document's result: {@code <prefix><key><suffix>} in the
 * document's own container, {@code results/<key>.json} by default.
 */
@Component
@RequiredArgsConstructor
public class ResultLocator {

    private final PipelineProperties properties;

    public String resultKey(final DocumentRef document) {
        final PipelineProperties.Results results = properties.getResults();
        return results.getPrefix() + document.key() + results.getSuffix();
    }

    /**
     * Whether an object key lies in the result area, i.e. was written by the pipeline itself.
     */
    public boolean isResultKey(final String key) {
        return key != null && key.startsWith(properties.getResults().getPrefix());
    }
}

package com.eyelevel.docpipeline.stage.impl;

import com.eyelevel.docpipeline.collaborator.ResultLocator;
import com.eyelevel.docpipeline.collaborator.ResultWriter;
import com.eyelevel.docpipeline.common.json.JsonSerializer;
import com.eyelevel.docpipeline.exception.PermanentCollaboratorException;
import com.eyelevel.docpipeline.exception.TransientCollaboratorException;
import com.eyelevel.docpipeline.exception.json.JsonParsingException;
import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.PayloadKeys;
import com.eyelevel.docpipeline.model.StagePayload;
import com.eyelevel.docpipeline.stage.StageExecutor;
import com.eyelevel.docpipeline.stage.StageOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Publishes the accumulated payload as a pretty-printed JSON document at the document's result location and
 * records where it was written under {@code resultPath}.
 * <p>
 * The execution can only succeed once this write has gone through.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PersistenceStage implements StageExecutor {

    public static final String NAME = "store-results";

    private final ResultWriter resultWriter;
    private final ResultLocator resultLocator;
    private final JsonSerializer jsonSerializer;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageOutcome execute(final DocumentRef document, final StagePayload payload) {
        final String outputKey = resultLocator.resultKey(document);
        final String json;
        try {
            json = jsonSerializer.serialize(payload.asMap(), true);
        } catch (JsonParsingException e) {
            return StageOutcome.fatal("Payload could not be serialized: " + e.getMessage());
        }

        final String location;
        try {
            location = resultWriter.write(document.container(), outputKey, json);
        } catch (TransientCollaboratorException e) {
            log.warn("[{}] Writing result to '{}' failed transiently: {}", document, outputKey, e.getMessage());
            return StageOutcome.retryable("Result write failed: " + e.getMessage());
        } catch (PermanentCollaboratorException e) {
            log.error("[{}] Writing result to '{}' was rejected: {}", document, outputKey, e.getMessage());
            return StageOutcome.fatal("Result write rejected: " + e.getMessage());
        }

        log.info("[{}] Result stored at {}", document, location);
        return StageOutcome.success(payload.put(PayloadKeys.RESULT_PATH, location));
    }
}

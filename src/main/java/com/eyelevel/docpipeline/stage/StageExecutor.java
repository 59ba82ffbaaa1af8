package com.eyelevel.docpipeline.stage;

import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.StagePayload;

/**
 * Defines the contract for one unit of work in the document pipeline.
 * Each implementation handles one named stage and is selected by the pipeline definition's stage order.
 * <p>
 * Implementations must be stateless: the outcome may depend only on the document, the payload handed in
 * and the state of external collaborators, never on in-process state left behind by other stages.
 */
public interface StageExecutor {

    /**
     * The stage name this executor is registered under.
     */
    String name();

    /**
     * Runs the stage.
     *
     * @param document The document being processed.
     * @param payload  A private deep copy of the execution's payload; implementations may modify and return it.
     * @return {@link StageOutcome#success(StagePayload)} with the updated payload, or a retryable/fatal outcome.
     * Keys missing from a successful payload are kept from the previous payload, never removed.
     */
    StageOutcome execute(DocumentRef document, StagePayload payload);
}

package com.eyelevel.docpipeline.model;

/**
 * Lifecycle states of an {@link ExecutionRecord}.
 */
public enum ExecutionStatus {
    /**
     * Created by a trigger (or reopened by a replay) and waiting for a worker to claim it.
     */
    PENDING,
    /**
     * Claimed by a worker that is walking the pipeline stages.
     */
    RUNNING,
    /**
     * Every stage completed and the result document was published.
     */
    SUCCEEDED,
    /**
     * A stage failed fatally or exhausted its retry budget.
     */
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}

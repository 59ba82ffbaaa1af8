package com.eyelevel.docpipeline.stage;

import com.eyelevel.docpipeline.model.StagePayload;
import lombok.Getter;

import java.util.Objects;

/**
 * The result of one stage call: the updated payload on success, or a typed failure with its reason.
 */
@Getter
public final class StageOutcome {

    public enum Type {
        SUCCESS,
        /**
         * Transient failure; the stage is attempted again while its attempt budget lasts.
         */
        RETRYABLE,
        /**
         * Permanent failure; the execution fails without further attempts.
         */
        FATAL
    }

    private final Type type;
    private final StagePayload payload;
    private final String reason;

    private StageOutcome(final Type type, final StagePayload payload, final String reason) {
        this.type = type;
        this.payload = payload;
        this.reason = reason;
    }

    public static StageOutcome success(final StagePayload payload) {
        return new StageOutcome(Type.SUCCESS, Objects.requireNonNull(payload, "Successful outcome needs a payload"), null);
    }

    public static StageOutcome retryable(final String reason) {
        return new StageOutcome(Type.RETRYABLE, null, reason);
    }

    public static StageOutcome fatal(final String reason) {
        return new StageOutcome(Type.FATAL, null, reason);
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    @Override
    public String toString() {
        return isSuccess() ? "SUCCESS" : type + "(" + reason + ")";
    }
}

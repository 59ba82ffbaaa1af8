package com.eyelevel.docpipeline.orchestrator;

import com.eyelevel.docpipeline.exception.StageFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs every failed stage attempt that the stage retry template sees.
 */
@Slf4j
@Component("stageRetryListener")
public class StageRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(final RetryContext context, final RetryCallback<T, E> callback,
                                                 final Throwable throwable) {
        if (throwable instanceof StageFailureException failure) {
            log.warn("Stage '{}' failed on attempt {} ({} in this run). Error: {}", failure.getStageName(),
                     failure.getAttemptNumber(), context.getRetryCount(), failure.getReason());
        } else {
            log.warn("Stage attempt aborted after {} tries: {}", context.getRetryCount(), throwable.getMessage());
        }
    }
}

package com.eyelevel.docpipeline.orchestrator;

import com.eyelevel.docpipeline.model.ExecutionId;
import org.springframework.retry.backoff.Sleeper;

import java.io.Serial;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal for one running execution.
 * <p>
 * The runner polls {@link #isCancelled()} at stage boundaries. The token is also the {@link Sleeper} of the
 * retry backoff, so a cancel wakes up an execution that is waiting to retry instead of letting it sleep out.
 */
public class CancellationToken implements Sleeper {

    @Serial
    private static final long serialVersionUID = -1469254071584330718L;

    private final ExecutionId executionId;
    private final transient CountDownLatch cancelled = new CountDownLatch(1);

    public CancellationToken(final ExecutionId executionId) {
        this.executionId = executionId;
    }

    public ExecutionId executionId() {
        return executionId;
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits for the backoff period, or less if the execution is cancelled meanwhile.
     *
     * @throws InterruptedException if the execution was cancelled before or during the wait.
     */
    @Override
    public void sleep(final long backOffPeriod) throws InterruptedException {
        if (cancelled.await(backOffPeriod, TimeUnit.MILLISECONDS)) {
            throw new InterruptedException("Execution " + executionId + " was cancelled during retry backoff");
        }
    }
}

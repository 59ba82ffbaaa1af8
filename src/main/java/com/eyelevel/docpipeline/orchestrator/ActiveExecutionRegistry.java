package com.eyelevel.docpipeline.orchestrator;

import com.eyelevel.docpipeline.model.ExecutionId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the executions this process is currently driving, at most one task per execution id.
 */
@Slf4j
@Component
public class ActiveExecutionRegistry {

    private final Map<ExecutionId, CancellationToken> active = new ConcurrentHashMap<>();

    /**
     * Registers a new local task for the execution.
     *
     * @return the task's cancellation token, or empty if the execution is already driven by this process.
     */
    public Optional<CancellationToken> register(final ExecutionId executionId) {
        final CancellationToken token = new CancellationToken(executionId);
        final CancellationToken existing = active.putIfAbsent(executionId, token);
        return existing == null ? Optional.of(token) : Optional.empty();
    }

    public void release(final ExecutionId executionId, final CancellationToken token) {
        active.remove(executionId, token);
    }

    /**
     * Signals the local task of the execution to stop at its next cancellation point.
     *
     * @return {@code true} if a local task was running and has been signalled.
     */
    public boolean cancel(final ExecutionId executionId) {
        final CancellationToken token = active.get(executionId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("Cancellation signalled to local task of execution {}", executionId);
        return true;
    }

    public boolean isActive(final ExecutionId executionId) {
        return active.containsKey(executionId);
    }

    public int size() {
        return active.size();
    }
}

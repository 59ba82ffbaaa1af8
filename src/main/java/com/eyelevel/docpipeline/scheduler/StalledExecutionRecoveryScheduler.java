package com.eyelevel.docpipeline.scheduler;

import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.exception.ExecutionStoreException;
import com.eyelevel.docpipeline.model.ExecutionId;
import com.eyelevel.docpipeline.orchestrator.ExecutionScheduler;
import com.eyelevel.docpipeline.store.ExecutionRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Picks up executions that no worker is driving anymore: {@code RUNNING} ones whose lease expired because
 * their worker died, and {@code PENDING} ones whose scheduling was lost. They resume from their last checkpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.pipeline.recovery.enabled", havingValue = "true", matchIfMissing = true)
public class StalledExecutionRecoveryScheduler {

    private final ExecutionRecordStore store;
    private final ExecutionScheduler executionScheduler;
    private final PipelineProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${app.pipeline.recovery.cron}")
    public void recoverStalledExecutions() {
        final Instant now = clock.instant();
        final Instant pendingBefore = now.minus(properties.getRecovery().getPendingGrace());
        log.debug("Running stalled execution recovery (expired leases before {}, pending before {}).", now,
                  pendingBefore);

        final List<ExecutionId> stalled;
        try {
            stalled = store.findRecoverable(now, pendingBefore);
        } catch (ExecutionStoreException e) {
            log.error("Stalled execution recovery skipped: execution store unavailable.", e);
            return;
        }

        if (CollectionUtils.isEmpty(stalled)) {
            log.debug("No stalled executions found.");
            return;
        }

        log.warn("Found {} stalled executions; rescheduling.", stalled.size());
        int scheduled = 0;
        for (final ExecutionId executionId : stalled) {
            if (executionScheduler.schedule(executionId)) {
                scheduled++;
            }
        }
        log.info("Finished stalled execution recovery. Rescheduled {} of {} executions.", scheduled, stalled.size());
    }
}

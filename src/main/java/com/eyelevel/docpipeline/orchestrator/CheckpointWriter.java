package com.eyelevel.docpipeline.orchestrator;

import com.eyelevel.docpipeline.config.PipelineProperties;
import com.eyelevel.docpipeline.exception.ExecutionStoreException;
import com.eyelevel.docpipeline.model.ExecutionRecord;
import com.eyelevel.docpipeline.model.ExecutionStatus;
import com.eyelevel.docpipeline.store.ExecutionRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Persists execution progress. A {@code RUNNING} record gets its lease renewed for this worker; any other
 * status releases the lease. Store outages are retried with a fixed backoff before the failure is rethrown.
 */
@Slf4j
@Component
public class CheckpointWriter {

    private final ExecutionRecordStore store;
    private final WorkerIdentity workerIdentity;
    private final PipelineProperties properties;
    private final Clock clock;
    private final RetryTemplate storeRetryTemplate;

    public CheckpointWriter(final ExecutionRecordStore store, final WorkerIdentity workerIdentity,
                            final PipelineProperties properties, final Clock clock) {
        this.store = store;
        this.workerIdentity = workerIdentity;
        this.properties = properties;
        this.clock = clock;
        this.storeRetryTemplate = RetryTemplate.builder()
                .maxAttempts(Math.max(1, properties.getStore().getCheckpointAttempts()))
                .fixedBackoff(Math.max(1L, properties.getStore().getCheckpointBackoff().toMillis()))
                .retryOn(ExecutionStoreException.class)
                .build();
    }

    /**
     * @return the stored copy of the record, with its new version.
     * @throws ExecutionStoreException if the store stays unavailable through every attempt.
     */
    public ExecutionRecord checkpoint(final ExecutionRecord record) {
        final Instant now = clock.instant();
        final ExecutionRecord toSave = record.copy();
        toSave.setUpdatedAt(now);
        if (toSave.getStatus() == ExecutionStatus.RUNNING) {
            toSave.setLeaseOwner(workerIdentity.id());
            toSave.setLeaseExpiresAt(now.plus(properties.getLeaseDuration()));
        } else {
            toSave.setLeaseOwner(null);
            toSave.setLeaseExpiresAt(null);
        }

        return storeRetryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying checkpoint of execution {} (attempt {}) after store failure: {}",
                         toSave.getExecutionId(), context.getRetryCount() + 1,
                         context.getLastThrowable().getMessage());
            }
            return store.save(toSave);
        });
    }
}

package com.eyelevel.docpipeline.store;

import com.eyelevel.docpipeline.exception.ConcurrentCheckpointException;
import com.eyelevel.docpipeline.exception.ExecutionNotFoundException;
import com.eyelevel.docpipeline.exception.InvalidExecutionStateException;
import com.eyelevel.docpipeline.exception.TerminalRecordModificationException;
import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.ExecutionAuditEvent;
import com.eyelevel.docpipeline.model.ExecutionId;
import com.eyelevel.docpipeline.model.ExecutionRecord;
import com.eyelevel.docpipeline.model.ExecutionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local {@link ExecutionRecordStore}. Each write runs inside {@link ConcurrentHashMap#compute}, which
 * serializes writers per execution id; records are copied on the way in and out.
 * Selected with {@code app.pipeline.store.type=in-memory}; state does not survive a restart.
 */
@Slf4j
@Component("inMemoryExecutionRecordStore")
public class InMemoryExecutionRecordStore implements ExecutionRecordStore {

    private final Map<String, ExecutionRecord> records = new ConcurrentHashMap<>();
    private final Map<String, List<ExecutionAuditEvent>> auditEvents = new ConcurrentHashMap<>();
    private final AtomicLong auditSequence = new AtomicLong();

    @Override
    public CreationResult createIfAbsent(final ExecutionRecord record) {
        final AtomicBoolean created = new AtomicBoolean(false);
        final ExecutionRecord stored = records.computeIfAbsent(record.getExecutionId(), id -> {
            created.set(true);
            final ExecutionRecord copy = record.copy();
            copy.setVersion(0L);
            return copy;
        });
        return new CreationResult(stored.copy(), created.get());
    }

    @Override
    public Optional<ExecutionRecord> load(final ExecutionId executionId) {
        return Optional.ofNullable(records.get(executionId.value())).map(ExecutionRecord::copy);
    }

    @Override
    public Optional<ExecutionId> findIdByDocument(final DocumentRef document) {
        final ExecutionId id = ExecutionId.of(document);
        return records.containsKey(id.value()) ? Optional.of(id) : Optional.empty();
    }

    @Override
    public ExecutionRecord save(final ExecutionRecord record) {
        final ExecutionRecord saved = records.compute(record.getExecutionId(), (id, current) -> {
            if (current == null) {
                throw new ExecutionNotFoundException(record.id());
            }
            if (current.getStatus().isTerminal()) {
                throw new TerminalRecordModificationException(
                        "Execution " + id + " is " + current.getStatus() + " and can no longer be checkpointed");
            }
            checkVersion(current, record);
            return nextVersionOf(record, current);
        });
        return saved.copy();
    }

    @Override
    public Optional<ExecutionRecord> claim(final ExecutionId executionId, final String owner, final Instant now,
                                           final Instant leaseUntil) {
        final AtomicReference<ExecutionRecord> claimed = new AtomicReference<>();
        records.computeIfPresent(executionId.value(), (id, current) -> {
            if (!isClaimable(current, owner, now)) {
                return current;
            }
            final ExecutionRecord next = current.copy();
            next.setStatus(ExecutionStatus.RUNNING);
            next.setLeaseOwner(owner);
            next.setLeaseExpiresAt(leaseUntil);
            next.setUpdatedAt(now);
            next.setVersion(current.getVersion() + 1);
            claimed.set(next);
            return next;
        });
        return Optional.ofNullable(claimed.get()).map(ExecutionRecord::copy);
    }

    @Override
    public ExecutionRecord reopen(final ExecutionRecord reopened, final ExecutionAuditEvent event) {
        final ExecutionRecord saved = records.compute(reopened.getExecutionId(), (id, current) -> {
            if (current == null) {
                throw new ExecutionNotFoundException(reopened.id());
            }
            if (!current.getStatus().isTerminal()) {
                throw new InvalidExecutionStateException(
                        "Execution " + id + " is " + current.getStatus() + "; only finished executions can be reopened");
            }
            checkVersion(current, reopened);
            final ExecutionAuditEvent stored = ExecutionAuditEvent.builder()
                    .id(auditSequence.incrementAndGet())
                    .executionId(event.getExecutionId())
                    .eventType(event.getEventType())
                    .previousStatus(event.getPreviousStatus())
                    .previousStageIndex(event.getPreviousStageIndex())
                    .previousLastError(event.getPreviousLastError())
                    .requestedStageIndex(event.getRequestedStageIndex())
                    .occurredAt(event.getOccurredAt())
                    .build();
            auditEvents.computeIfAbsent(id, k -> new CopyOnWriteArrayList<>()).add(stored);
            return nextVersionOf(reopened, current);
        });
        return saved.copy();
    }

    @Override
    public List<ExecutionAuditEvent> auditTrail(final ExecutionId executionId) {
        return List.copyOf(auditEvents.getOrDefault(executionId.value(), List.of()));
    }

    @Override
    public List<ExecutionId> findRecoverable(final Instant now, final Instant pendingBefore) {
        return records.values().stream()
                .filter(r -> !r.isSuspended())
                .filter(r -> (r.getStatus() == ExecutionStatus.RUNNING && isLeaseExpired(r, now))
                        || (r.getStatus() == ExecutionStatus.PENDING && r.getUpdatedAt().isBefore(pendingBefore)))
                .sorted(Comparator.comparing(ExecutionRecord::getUpdatedAt))
                .map(ExecutionRecord::id)
                .toList();
    }

    private static boolean isClaimable(final ExecutionRecord current, final String owner, final Instant now) {
        if (current.isSuspended()) {
            return false;
        }
        if (current.getStatus() == ExecutionStatus.PENDING) {
            return true;
        }
        return current.getStatus() == ExecutionStatus.RUNNING
                && (owner.equals(current.getLeaseOwner()) || isLeaseExpired(current, now));
    }

    private static boolean isLeaseExpired(final ExecutionRecord record, final Instant now) {
        return record.getLeaseExpiresAt() == null || record.getLeaseExpiresAt().isBefore(now);
    }

    private static void checkVersion(final ExecutionRecord current, final ExecutionRecord incoming) {
        if (!Objects.equals(current.getVersion(), incoming.getVersion())) {
            throw new ConcurrentCheckpointException(String.format(
                    "Execution %s was modified concurrently (stored version %d, attempted write on version %s)",
                    current.getExecutionId(), current.getVersion(), incoming.getVersion()));
        }
    }

    private static ExecutionRecord nextVersionOf(final ExecutionRecord incoming, final ExecutionRecord current) {
        final ExecutionRecord next = incoming.copy();
        next.setCreatedAt(current.getCreatedAt());
        next.setVersion(current.getVersion() + 1);
        return next;
    }
}

package com.eyelevel.docpipeline.store;

import com.eyelevel.docpipeline.exception.ConcurrentCheckpointException;
import com.eyelevel.docpipeline.exception.ExecutionNotFoundException;
import com.eyelevel.docpipeline.exception.ExecutionStoreException;
import com.eyelevel.docpipeline.exception.InvalidExecutionStateException;
import com.eyelevel.docpipeline.exception.TerminalRecordModificationException;
import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.ExecutionAuditEvent;
import com.eyelevel.docpipeline.model.ExecutionId;
import com.eyelevel.docpipeline.model.ExecutionRecord;
import com.eyelevel.docpipeline.model.ExecutionStatus;
import com.eyelevel.docpipeline.repository.ExecutionAuditEventRepository;
import com.eyelevel.docpipeline.repository.ExecutionRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link ExecutionRecordStore} on top of Spring Data JPA.
 * <p>
 * Each operation runs in its own transaction. Saves rely on the entity's {@code @Version} column, so a stale
 * writer fails with {@link ConcurrentCheckpointException}; claims are a single conditional UPDATE. Any other
 * database failure surfaces as {@link ExecutionStoreException}.
 */
@Slf4j
@Component("jpaExecutionRecordStore")
public class JpaExecutionRecordStore implements ExecutionRecordStore {

    private final ExecutionRecordRepository recordRepository;
    private final ExecutionAuditEventRepository auditRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaExecutionRecordStore(final ExecutionRecordRepository recordRepository,
                                   final ExecutionAuditEventRepository auditRepository,
                                   final PlatformTransactionManager transactionManager) {
        this.recordRepository = recordRepository;
        this.auditRepository = auditRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public CreationResult createIfAbsent(final ExecutionRecord record) {
        try {
            return inTransaction("create", () -> {
                final Optional<ExecutionRecord> existing = recordRepository.findById(record.getExecutionId());
                if (existing.isPresent()) {
                    return new CreationResult(existing.get().copy(), false);
                }
                final ExecutionRecord toInsert = record.copy();
                toInsert.setVersion(null);
                return new CreationResult(recordRepository.saveAndFlush(toInsert).copy(), true);
            });
        } catch (ExecutionStoreException e) {
            if (!(e.getCause() instanceof DataIntegrityViolationException
                    || e.getCause() instanceof ConcurrencyFailureException)) {
                throw e;
            }
            // another worker inserted the same execution between our lookup and insert
            log.info("Execution {} was created concurrently; using the existing record.", record.getExecutionId());
            return new CreationResult(load(record.id()).orElseThrow(() -> e), false);
        }
    }

    @Override
    public Optional<ExecutionRecord> load(final ExecutionId executionId) {
        return inTransaction("load", () -> recordRepository.findById(executionId.value()).map(ExecutionRecord::copy));
    }

    @Override
    public Optional<ExecutionId> findIdByDocument(final DocumentRef document) {
        final ExecutionId id = ExecutionId.of(document);
        return inTransaction("lookup", () -> recordRepository.existsById(id.value()) ? Optional.of(id) : Optional.empty());
    }

    @Override
    public ExecutionRecord save(final ExecutionRecord record) {
        return inTransaction("save", () -> {
            final ExecutionRecord current = recordRepository.findById(record.getExecutionId())
                    .orElseThrow(() -> new ExecutionNotFoundException(record.id()));
            if (current.getStatus().isTerminal()) {
                throw new TerminalRecordModificationException(
                        "Execution " + record.getExecutionId() + " is " + current.getStatus()
                                + " and can no longer be checkpointed");
            }
            checkVersion(current, record);
            return recordRepository.saveAndFlush(record.copy()).copy();
        });
    }

    @Override
    public Optional<ExecutionRecord> claim(final ExecutionId executionId, final String owner, final Instant now,
                                           final Instant leaseUntil) {
        return inTransaction("claim", () -> {
            final int updated = recordRepository.claim(executionId.value(), owner, now, leaseUntil,
                                                       ExecutionStatus.PENDING, ExecutionStatus.RUNNING);
            if (updated == 0) {
                return Optional.<ExecutionRecord>empty();
            }
            return recordRepository.findById(executionId.value()).map(ExecutionRecord::copy);
        });
    }

    @Override
    public ExecutionRecord reopen(final ExecutionRecord reopened, final ExecutionAuditEvent event) {
        return inTransaction("reopen", () -> {
            final ExecutionRecord current = recordRepository.findById(reopened.getExecutionId())
                    .orElseThrow(() -> new ExecutionNotFoundException(reopened.id()));
            if (!current.getStatus().isTerminal()) {
                throw new InvalidExecutionStateException(
                        "Execution " + reopened.getExecutionId() + " is " + current.getStatus()
                                + "; only finished executions can be reopened");
            }
            checkVersion(current, reopened);
            auditRepository.save(event);
            return recordRepository.saveAndFlush(reopened.copy()).copy();
        });
    }

    @Override
    public List<ExecutionAuditEvent> auditTrail(final ExecutionId executionId) {
        return inTransaction("audit", () -> auditRepository.findAllByExecutionIdOrderByIdAsc(executionId.value()));
    }

    @Override
    public List<ExecutionId> findRecoverable(final Instant now, final Instant pendingBefore) {
        return inTransaction("recovery scan", () -> recordRepository
                .findRecoverableIds(now, pendingBefore, ExecutionStatus.PENDING, ExecutionStatus.RUNNING)
                .stream()
                .map(ExecutionId::new)
                .toList());
    }

    private static void checkVersion(final ExecutionRecord current, final ExecutionRecord incoming) {
        if (!Objects.equals(current.getVersion(), incoming.getVersion())) {
            throw new ConcurrentCheckpointException(String.format(
                    "Execution %s was modified concurrently (stored version %d, attempted write on version %s)",
                    current.getExecutionId(), current.getVersion(), incoming.getVersion()));
        }
    }

    private <T> T inTransaction(final String operation, final Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrentCheckpointException("Concurrent modification detected during " + operation, e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Execution store {} failed: {}", operation, e.getMessage());
            throw new ExecutionStoreException("Execution store " + operation + " failed", e);
        }
    }
}

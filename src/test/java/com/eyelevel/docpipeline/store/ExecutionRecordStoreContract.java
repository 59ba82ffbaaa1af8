package com.eyelevel.docpipeline.store;

import com.eyelevel.docpipeline.exception.ConcurrentCheckpointException;
import com.eyelevel.docpipeline.exception.ExecutionNotFoundException;
import com.eyelevel.docpipeline.exception.InvalidExecutionStateException;
import com.eyelevel.docpipeline.exception.TerminalRecordModificationException;
import com.eyelevel.docpipeline.model.AuditEventType;
import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.ExecutionAuditEvent;
import com.eyelevel.docpipeline.model.ExecutionId;
import com.eyelevel.docpipeline.model.ExecutionRecord;
import com.eyelevel.docpipeline.model.ExecutionStatus;
import com.eyelevel.docpipeline.model.PayloadKeys;
import com.eyelevel.docpipeline.store.ExecutionRecordStore.CreationResult;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behaviour every {@link ExecutionRecordStore} implementation must share.
 * Subclasses only provide the store under test.
 */
abstract class ExecutionRecordStoreContract {

    static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    static final DocumentRef DOC = new DocumentRef("docs", "a.pdf");

    protected abstract ExecutionRecordStore store();

    ExecutionRecord created(DocumentRef document, Instant at) {
        return store().createIfAbsent(ExecutionRecord.pending(document, at)).record();
    }

    // ------------------------------------------------------------------
    // createIfAbsent / load
    // ------------------------------------------------------------------

    @Test
    void createIfAbsent_secondCall_returnsExistingRecord() {
        CreationResult first = store().createIfAbsent(ExecutionRecord.pending(DOC, NOW));
        CreationResult second = store().createIfAbsent(ExecutionRecord.pending(DOC, NOW.plusSeconds(5)));

        assertThat(first.created()).isTrue();
        assertThat(second.created()).isFalse();
        assertThat(second.record().getExecutionId()).isEqualTo(ExecutionId.of(DOC).value());
        assertThat(second.record().getCreatedAt()).isEqualTo(NOW);
        assertThat(second.record().getVersion()).isEqualTo(first.record().getVersion());
    }

    @Test
    void createIfAbsent_concurrentCallers_shareOneRecord() throws Exception {
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch ready = new CountDownLatch(callers);
        CountDownLatch go = new CountDownLatch(1);
        List<CreationResult> results = new ArrayList<>();
        try {
            List<Future<CreationResult>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    go.await();
                    return store().createIfAbsent(ExecutionRecord.pending(DOC, NOW));
                }));
            }
            assertThat(ready.await(10, TimeUnit.SECONDS)).isTrue();
            go.countDown();
            for (Future<CreationResult> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(results).filteredOn(CreationResult::created).hasSize(1);
        assertThat(results).extracting(result -> result.record().getExecutionId())
                .containsOnly(ExecutionId.of(DOC).value());
        Instant later = NOW.plus(Duration.ofHours(1));
        assertThat(store().findRecoverable(later, later)).containsExactly(ExecutionId.of(DOC));
    }

    @Test
    void load_unknownId_isEmpty() {
        assertThat(store().load(ExecutionId.of(new DocumentRef("docs", "missing.pdf")))).isEmpty();
        assertThat(store().findIdByDocument(new DocumentRef("docs", "missing.pdf"))).isEmpty();
    }

    @Test
    void load_returnsSeedPayload() {
        created(DOC, NOW);

        ExecutionRecord loaded = store().load(ExecutionId.of(DOC)).orElseThrow();

        assertThat(loaded.getStatus()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(loaded.getPayload().asMap()).containsEntry(PayloadKeys.BUCKET, "docs")
                .containsEntry(PayloadKeys.KEY, "a.pdf");
        assertThat(store().findIdByDocument(DOC)).contains(ExecutionId.of(DOC));
    }

    // ------------------------------------------------------------------
    // save
    // ------------------------------------------------------------------

    @Test
    void save_persistsNestedPayloadAndBumpsVersion() {
        ExecutionRecord record = created(DOC, NOW);
        record.setCurrentStageIndex(3);
        record.setPayload(record.getPayload()
                                  .put(PayloadKeys.TEXT, "line one\nline two")
                                  .put(PayloadKeys.ANALYSIS, Map.of("sentiment", "POSITIVE",
                                                                    "scores", Map.of("Positive", 0.97))));

        ExecutionRecord saved = store().save(record);

        assertThat(saved.getVersion()).isEqualTo(record.getVersion() + 1);
        ExecutionRecord loaded = store().load(record.id()).orElseThrow();
        assertThat(loaded.getCurrentStageIndex()).isEqualTo(3);
        assertThat(loaded.getPayload().getString(PayloadKeys.TEXT)).isEqualTo("line one\nline two");
        assertThat(((Map<?, ?>) loaded.getPayload().get(PayloadKeys.ANALYSIS)).get("scores"))
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("Positive", 0.97);
    }

    @Test
    void save_staleCopy_isRejected() {
        ExecutionRecord original = created(DOC, NOW);
        ExecutionRecord first = original.copy();
        first.setAttempt(1);
        store().save(first);

        ExecutionRecord stale = original.copy();
        stale.setAttempt(2);

        assertThatThrownBy(() -> store().save(stale)).isInstanceOf(ConcurrentCheckpointException.class);
        assertThat(store().load(original.id()).orElseThrow().getAttempt()).isEqualTo(1);
    }

    @Test
    void save_terminalRecord_isRejected() {
        ExecutionRecord record = created(DOC, NOW);
        record.setStatus(ExecutionStatus.SUCCEEDED);
        ExecutionRecord finished = store().save(record);

        finished.setStatus(ExecutionStatus.RUNNING);

        assertThatThrownBy(() -> store().save(finished)).isInstanceOf(TerminalRecordModificationException.class);
        assertThat(store().load(record.id()).orElseThrow().getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
    }

    @Test
    void save_unknownRecord_throwsNotFound() {
        ExecutionRecord ghost = ExecutionRecord.pending(new DocumentRef("docs", "ghost.pdf"), NOW);
        ghost.setVersion(0L);

        assertThatThrownBy(() -> store().save(ghost)).isInstanceOf(ExecutionNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // claim
    // ------------------------------------------------------------------

    @Test
    void claim_pending_grantsLeaseAndRunningStatus() {
        ExecutionRecord record = created(DOC, NOW);

        ExecutionRecord claimed = store().claim(record.id(), "w1", NOW, NOW.plusSeconds(60)).orElseThrow();

        assertThat(claimed.getStatus()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(claimed.getLeaseOwner()).isEqualTo("w1");
        assertThat(claimed.getLeaseExpiresAt()).isEqualTo(NOW.plusSeconds(60));
        assertThat(claimed.getVersion()).isGreaterThan(record.getVersion());
    }

    @Test
    void claim_liveLeaseOfOtherWorker_isRefused() {
        ExecutionRecord record = created(DOC, NOW);
        store().claim(record.id(), "w1", NOW, NOW.plusSeconds(60));

        assertThat(store().claim(record.id(), "w2", NOW.plusSeconds(10), NOW.plusSeconds(70))).isEmpty();
        // the holder may renew
        assertThat(store().claim(record.id(), "w1", NOW.plusSeconds(10), NOW.plusSeconds(70))).isPresent();
    }

    @Test
    void claim_expiredLease_canBeTakenOver() {
        ExecutionRecord record = created(DOC, NOW);
        store().claim(record.id(), "w1", NOW, NOW.plusSeconds(60));

        ExecutionRecord takenOver = store().claim(record.id(), "w2", NOW.plusSeconds(61), NOW.plusSeconds(121))
                .orElseThrow();

        assertThat(takenOver.getLeaseOwner()).isEqualTo("w2");
    }

    @Test
    void claim_suspendedOrTerminal_isRefused() {
        ExecutionRecord suspended = created(DOC, NOW);
        suspended.setSuspended(true);
        store().save(suspended);

        ExecutionRecord failed = created(new DocumentRef("docs", "b.pdf"), NOW);
        failed.setStatus(ExecutionStatus.FAILED);
        store().save(failed);

        assertThat(store().claim(suspended.id(), "w1", NOW, NOW.plusSeconds(60))).isEmpty();
        assertThat(store().claim(failed.id(), "w1", NOW, NOW.plusSeconds(60))).isEmpty();
    }

    @Test
    void claim_staleCopyCanNoLongerBeSaved() {
        ExecutionRecord beforeClaim = created(DOC, NOW);
        store().claim(beforeClaim.id(), "w1", NOW, NOW.plusSeconds(60));

        beforeClaim.setCurrentStageIndex(1);

        assertThatThrownBy(() -> store().save(beforeClaim)).isInstanceOf(ConcurrentCheckpointException.class);
    }

    // ------------------------------------------------------------------
    // reopen / audit trail
    // ------------------------------------------------------------------

    @Test
    void reopen_terminalRecord_appendsAuditEvent() {
        ExecutionRecord record = created(DOC, NOW);
        record.setStatus(ExecutionStatus.FAILED);
        record.setCurrentStageIndex(2);
        record.setLastError("boom");
        ExecutionRecord failed = store().save(record);

        ExecutionRecord reopened = failed.copy();
        reopened.setStatus(ExecutionStatus.PENDING);
        reopened.setCurrentStageIndex(0);
        ExecutionRecord saved = store().reopen(
                reopened, ExecutionAuditEvent.of(failed, AuditEventType.REPLAY, 0, NOW.plusSeconds(30)));

        assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(saved.getCurrentStageIndex()).isZero();
        List<ExecutionAuditEvent> trail = store().auditTrail(failed.id());
        assertThat(trail).hasSize(1);
        assertThat(trail.get(0).getId()).isNotNull();
        assertThat(trail.get(0).getEventType()).isEqualTo(AuditEventType.REPLAY);
        assertThat(trail.get(0).getPreviousStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(trail.get(0).getPreviousStageIndex()).isEqualTo(2);
        assertThat(trail.get(0).getPreviousLastError()).isEqualTo("boom");
    }

    @Test
    void reopen_unfinishedRecord_isRejected() {
        ExecutionRecord record = created(DOC, NOW);

        assertThatThrownBy(() -> store().reopen(
                record, ExecutionAuditEvent.of(record, AuditEventType.REPLAY, 0, NOW)))
                .isInstanceOf(InvalidExecutionStateException.class);
        assertThat(store().auditTrail(record.id())).isEmpty();
    }

    // ------------------------------------------------------------------
    // findRecoverable
    // ------------------------------------------------------------------

    @Test
    void findRecoverable_returnsOrphanedExecutionsOnly() {
        Instant now = NOW.plus(Duration.ofHours(1));

        ExecutionRecord stalePending = created(new DocumentRef("docs", "stale.pdf"), NOW);
        created(new DocumentRef("docs", "fresh.pdf"), now.minusSeconds(10));

        ExecutionRecord expired = created(new DocumentRef("docs", "expired.pdf"), NOW);
        store().claim(expired.id(), "w1", NOW.plusSeconds(1), NOW.plusSeconds(60));

        ExecutionRecord leased = created(new DocumentRef("docs", "leased.pdf"), NOW);
        store().claim(leased.id(), "w1", now.minusSeconds(5), now.plusSeconds(600));

        ExecutionRecord suspended = created(new DocumentRef("docs", "suspended.pdf"), NOW);
        suspended.setSuspended(true);
        store().save(suspended);

        List<ExecutionId> recoverable = store().findRecoverable(now, now.minus(Duration.ofMinutes(15)));

        assertThat(recoverable).containsExactly(stalePending.id(), expired.id());
    }
}

package com.eyelevel.docpipeline.orchestrator;

import com.eyelevel.docpipeline.exception.ExecutionNotFoundException;
import com.eyelevel.docpipeline.exception.InvalidExecutionStateException;
import com.eyelevel.docpipeline.model.AuditEventType;
import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.ExecutionAuditEvent;
import com.eyelevel.docpipeline.model.ExecutionId;
import com.eyelevel.docpipeline.model.ExecutionRecord;
import com.eyelevel.docpipeline.model.ExecutionSnapshot;
import com.eyelevel.docpipeline.model.ExecutionStatus;
import com.eyelevel.docpipeline.model.ExecutionStatusView;
import com.eyelevel.docpipeline.model.PayloadKeys;
import com.eyelevel.docpipeline.stage.StageOutcome;
import com.eyelevel.docpipeline.store.InMemoryExecutionRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.eyelevel.docpipeline.orchestrator.PipelineHarness.DOC;
import static com.eyelevel.docpipeline.orchestrator.PipelineHarness.NOW;
import static com.eyelevel.docpipeline.orchestrator.PipelineHarness.spec;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineOrchestratorTest {

    private final ScriptedStage a = new ScriptedStage("a");
    private final ScriptedStage b = new ScriptedStage("b");
    private final ScriptedStage c = new ScriptedStage("c");

    private PipelineHarness harness;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        harness = new PipelineHarness(new InMemoryExecutionRecordStore(),
                                      List.of(spec("a", 3), spec("b", 3), spec("c", 3)), List.of(a, b, c));
        orchestrator = harness.orchestrator;
    }

    private ExecutionId startAndRun(DocumentRef document) {
        ExecutionId id = orchestrator.start(document);
        harness.runPending();
        return id;
    }

    // ------------------------------------------------------------------
    // start
    // ------------------------------------------------------------------

    @Test
    void start_newDocument_runsToSuccess() {
        ExecutionId id = startAndRun(DOC);

        assertThat(id).isEqualTo(ExecutionId.of(DOC));
        ExecutionStatusView status = orchestrator.getExecutionStatus(DOC);
        assertThat(status.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(status.currentStage()).isNull();
        assertThat(status.currentStageIndex()).isEqualTo(3);
        assertThat(harness.activeExecutions.size()).isZero();
    }

    @Test
    void start_duplicateWhileQueued_coalesces() {
        ExecutionId first = orchestrator.start(DOC);
        ExecutionId second = orchestrator.start(DOC);

        assertThat(second).isEqualTo(first);
        assertThat(harness.runPending()).isEqualTo(1);
        assertThat(a.calls()).isEqualTo(1);
    }

    @Test
    void start_afterCompletion_doesNotRunAgain() {
        startAndRun(DOC);

        ExecutionId again = orchestrator.start(DOC);
        harness.runPending();

        assertThat(again).isEqualTo(ExecutionId.of(DOC));
        assertThat(List.of(a.calls(), b.calls(), c.calls())).containsExactly(1, 1, 1);
    }

    @Test
    void start_afterFailure_doesNotRetry() {
        b.thenFatal("corrupt");
        startAndRun(DOC);

        orchestrator.start(DOC);

        assertThat(harness.pipelineExecutor.pending()).isZero();
        assertThat(orchestrator.getExecutionStatus(DOC).status()).isEqualTo(ExecutionStatus.FAILED);
    }

    @Test
    void start_differentDocuments_runIndependently() {
        b.thenFatal("corrupt");
        DocumentRef other = new DocumentRef("docs", "b.pdf");

        startAndRun(DOC);
        startAndRun(other);

        assertThat(orchestrator.getExecutionStatus(DOC).status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(orchestrator.getExecutionStatus(other).status()).isEqualTo(ExecutionStatus.SUCCEEDED);
    }

    @Test
    void run_executesOnCallingThread() {
        harness.store.createIfAbsent(ExecutionRecord.pending(DOC, NOW));

        ExecutionRecord result = orchestrator.run(ExecutionId.of(DOC));

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
    }

    // ------------------------------------------------------------------
    // status
    // ------------------------------------------------------------------

    @Test
    void getExecutionStatus_unknownDocument_throwsNotFound() {
        assertThatThrownBy(() -> orchestrator.getExecutionStatus(new DocumentRef("docs", "never.pdf")))
                .isInstanceOf(ExecutionNotFoundException.class);
    }

    @Test
    void getExecutionStatus_failedExecution_reportsStageAttemptAndError() {
        b.alwaysRetryable("throttled");
        ExecutionId id = startAndRun(DOC);

        ExecutionStatusView status = orchestrator.getExecutionStatus(id);

        assertThat(status.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(status.currentStage()).isEqualTo("b");
        assertThat(status.attempt()).isEqualTo(3);
        assertThat(status.lastError()).contains("throttled");
    }

    // ------------------------------------------------------------------
    // cancel / resume
    // ------------------------------------------------------------------

    @Test
    void cancel_queuedExecution_suspendsBeforeFirstStage() {
        ExecutionId id = orchestrator.start(DOC);

        orchestrator.cancel(id);
        harness.runPending();

        ExecutionRecord record = harness.record(id);
        assertThat(record.getStatus()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(record.isSuspended()).isTrue();
        assertThat(a.calls()).isZero();
    }

    @Test
    void cancel_idleExecution_isSuspendedInStore() {
        harness.store.createIfAbsent(ExecutionRecord.pending(DOC, NOW));

        ExecutionStatusView status = orchestrator.cancel(ExecutionId.of(DOC));

        assertThat(status.suspended()).isTrue();
        // a later trigger for the same document does not lift the cancellation
        orchestrator.start(DOC);
        assertThat(harness.pipelineExecutor.pending()).isZero();
    }

    @Test
    void cancel_finishedExecution_isRejected() {
        ExecutionId id = startAndRun(DOC);

        assertThatThrownBy(() -> orchestrator.cancel(id)).isInstanceOf(InvalidExecutionStateException.class);
    }

    @Test
    void resume_suspendedExecution_continuesFromCheckpoint() {
        ExecutionId id = orchestrator.start(DOC);
        b.then((document, payload) -> {
            orchestrator.cancel(id);
            return StageOutcome.success(payload.put("b", "done"));
        });
        harness.runPending();
        assertThat(harness.record(id).isSuspended()).isTrue();
        assertThat(harness.record(id).getCurrentStageIndex()).isEqualTo(2);

        ExecutionStatusView resumed = orchestrator.resume(id);
        harness.runPending();

        assertThat(resumed.suspended()).isFalse();
        assertThat(harness.record(id).getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(List.of(a.calls(), b.calls(), c.calls())).containsExactly(1, 1, 1);
    }

    @Test
    void resume_finishedExecution_isRejected() {
        ExecutionId id = startAndRun(DOC);

        assertThatThrownBy(() -> orchestrator.resume(id)).isInstanceOf(InvalidExecutionStateException.class);
    }

    // ------------------------------------------------------------------
    // replay
    // ------------------------------------------------------------------

    @Test
    void replay_finishedExecution_rerunsFromSeedAndIsAudited() {
        ExecutionId id = startAndRun(DOC);

        orchestrator.replay(DOC);
        harness.runPending();

        assertThat(a.calls()).isEqualTo(2);
        assertThat(a.received().get(1).keySet()).containsExactly(PayloadKeys.BUCKET, PayloadKeys.KEY);
        assertThat(harness.record(id).getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);

        List<ExecutionAuditEvent> trail = harness.store.auditTrail(id);
        assertThat(trail).hasSize(1);
        assertThat(trail.get(0).getEventType()).isEqualTo(AuditEventType.REPLAY);
        assertThat(trail.get(0).getPreviousStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
    }

    @Test
    void replay_unfinishedExecution_isRejected() {
        orchestrator.start(DOC);

        assertThatThrownBy(() -> orchestrator.replay(DOC)).isInstanceOf(InvalidExecutionStateException.class);
    }

    @Test
    void replay_unknownDocument_throwsNotFound() {
        assertThatThrownBy(() -> orchestrator.replay(new DocumentRef("docs", "never.pdf")))
                .isInstanceOf(ExecutionNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // retryFromStage
    // ------------------------------------------------------------------

    @Test
    void retryFromStage_failedExecution_keepsEarlierOutputs() {
        b.thenFatal("bad input");
        ExecutionId id = startAndRun(DOC);
        assertThat(harness.record(id).getStatus()).isEqualTo(ExecutionStatus.FAILED);

        ExecutionStatusView status = orchestrator.retryFromStage(id, 1);
        harness.runPending();

        assertThat(status.status()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(status.attempt()).isZero();
        assertThat(a.calls()).isEqualTo(1);
        assertThat(b.received().get(1).get("a")).isEqualTo("done");
        assertThat(harness.record(id).getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);

        ExecutionAuditEvent event = harness.store.auditTrail(id).get(0);
        assertThat(event.getEventType()).isEqualTo(AuditEventType.RETRY_FROM_STAGE);
        assertThat(event.getRequestedStageIndex()).isEqualTo(1);
        assertThat(event.getPreviousLastError()).contains("bad input");
    }

    @Test
    void retryFromStage_beyondReachedStage_isRejected() {
        b.thenFatal("bad input");
        ExecutionId id = startAndRun(DOC);

        assertThatThrownBy(() -> orchestrator.retryFromStage(id, 2))
                .isInstanceOf(InvalidExecutionStateException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> orchestrator.retryFromStage(id, -1))
                .isInstanceOf(InvalidExecutionStateException.class);
        assertThat(harness.store.auditTrail(id)).isEmpty();
    }

    @Test
    void retryFromStage_unfinishedExecution_isRejected() {
        ExecutionId id = orchestrator.start(DOC);

        assertThatThrownBy(() -> orchestrator.retryFromStage(id, 0))
                .isInstanceOf(InvalidExecutionStateException.class);
    }

    // ------------------------------------------------------------------
    // describe
    // ------------------------------------------------------------------

    @Test
    void describe_includesCurrentStageAndAuditTrail() {
        b.thenFatal("bad input");
        ExecutionId id = startAndRun(DOC);
        orchestrator.retryFromStage(id, 0);

        ExecutionSnapshot snapshot = orchestrator.describe(id);

        assertThat(snapshot.currentStage()).isEqualTo("a");
        assertThat(snapshot.auditTrail()).hasSize(1);
        assertThat(snapshot.record().getStatus()).isEqualTo(ExecutionStatus.PENDING);
    }
}

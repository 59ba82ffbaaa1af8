package com.eyelevel.docpipeline.orchestrator;

import com.eyelevel.docpipeline.exception.ExecutionStoreException;
import com.eyelevel.docpipeline.exception.TransientCollaboratorException;
import com.eyelevel.docpipeline.model.ExecutionId;
import com.eyelevel.docpipeline.model.ExecutionRecord;
import com.eyelevel.docpipeline.model.ExecutionStatus;
import com.eyelevel.docpipeline.model.PayloadKeys;
import com.eyelevel.docpipeline.model.StagePayload;
import com.eyelevel.docpipeline.pipeline.StageSpec;
import com.eyelevel.docpipeline.stage.StageOutcome;
import com.eyelevel.docpipeline.store.InMemoryExecutionRecordStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.eyelevel.docpipeline.orchestrator.PipelineHarness.DOC;
import static com.eyelevel.docpipeline.orchestrator.PipelineHarness.NOW;
import static com.eyelevel.docpipeline.orchestrator.PipelineHarness.WORKER;
import static com.eyelevel.docpipeline.orchestrator.PipelineHarness.spec;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Drives {@link ExecutionRunner} directly against an in-memory store with scripted stages.
 */
class ExecutionRunnerTest {

    private final ScriptedStage a = new ScriptedStage("a");
    private final ScriptedStage b = new ScriptedStage("b");
    private final ScriptedStage c = new ScriptedStage("c");

    private InMemoryExecutionRecordStore store;
    private ExecutionId id;
    private CancellationToken token;

    @BeforeEach
    void setUp() {
        store = spy(new InMemoryExecutionRecordStore());
        id = store.createIfAbsent(ExecutionRecord.pending(DOC, NOW)).record().id();
        token = new CancellationToken(id);
    }

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    private PipelineHarness harness(StageSpec... specs) {
        return new PipelineHarness(store, List.of(specs), List.of(a, b, c));
    }

    private PipelineHarness defaultHarness() {
        return harness(spec("a", 3), spec("b", 3), spec("c", 3));
    }

    /**
     * Moves the stored record to the given stage, as a previous run would have left it.
     */
    private void checkpointAt(int stageIndex, int attempt, StagePayload payload) {
        ExecutionRecord record = store.load(id).orElseThrow();
        record.setCurrentStageIndex(stageIndex);
        record.setAttempt(attempt);
        record.setPayload(payload);
        store.save(record);
    }

    // ------------------------------------------------------------------
    // happy path
    // ------------------------------------------------------------------

    @Test
    void run_allStagesSucceed_recordsSuccessWithMergedPayload() {
        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(result.getCurrentStageIndex()).isEqualTo(3);
        assertThat(result.getAttempt()).isZero();
        assertThat(result.getLeaseOwner()).isNull();
        assertThat(result.getPayload().keySet())
                .containsExactly(PayloadKeys.BUCKET, PayloadKeys.KEY, "a", "b", "c");
        assertThat(List.of(a.calls(), b.calls(), c.calls())).containsExactly(1, 1, 1);
    }

    @Test
    void run_stagesSeeOutputOfEarlierStages() {
        defaultHarness().runner.run(id, token);

        assertThat(b.received().get(0).keySet()).contains("a");
        assertThat(c.received().get(0).keySet()).contains("a", "b");
    }

    @Test
    void run_stageDroppingKeys_cannotRemoveThem() {
        b.then((document, payload) -> StageOutcome.success(new StagePayload().put("b", "only")));

        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(result.getPayload().keySet()).contains(PayloadKeys.BUCKET, PayloadKeys.KEY, "a", "b", "c");
        assertThat(result.getPayload().get("b")).isEqualTo("only");
    }

    // ------------------------------------------------------------------
    // retries
    // ------------------------------------------------------------------

    @Test
    void run_retryableFailure_retriedUntilSuccess() {
        b.thenRetryable("throttled").thenRetryable("throttled");

        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(b.calls()).isEqualTo(3);
        assertThat(result.getLastError()).isNull();
    }

    @Test
    void run_retryBudgetExhausted_failsAfterExactlyMaxAttempts() {
        b.alwaysRetryable("service unavailable");

        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(b.calls()).isEqualTo(3);
        assertThat(c.calls()).isZero();
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getCurrentStageIndex()).isEqualTo(1);
        assertThat(result.getAttempt()).isEqualTo(3);
        assertThat(result.getLastError()).isEqualTo("Stage 'b' failed on attempt 3: service unavailable");
        // outputs of completed stages are kept
        assertThat(result.getPayload().get("a")).isEqualTo("done");
    }

    @Test
    void run_failedAttempt_leavesNoPayloadChanges() {
        b.then((document, payload) -> {
            payload.put("partial", true);
            return StageOutcome.retryable("flaky");
        });

        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(result.getPayload().containsKey("partial")).isFalse();
        assertThat(b.received().get(1).containsKey("partial")).isFalse();
    }

    @Test
    void run_transientExceptionFromStage_isRetried() {
        b.then((document, payload) -> {
            throw new TransientCollaboratorException("connection reset", null);
        });

        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(b.calls()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // fatal failures
    // ------------------------------------------------------------------

    @Test
    void run_fatalOutcome_failsWithoutRetry() {
        b.thenFatal("unsupported document");

        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(b.calls()).isEqualTo(1);
        assertThat(c.calls()).isZero();
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getAttempt()).isEqualTo(1);
        assertThat(result.getLastError()).contains("unsupported document");
    }

    @Test
    void run_unexpectedException_isFatal() {
        b.then((document, payload) -> {
            throw new IllegalStateException("bug");
        });

        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(b.calls()).isEqualTo(1);
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getLastError()).contains("IllegalStateException");
    }

    @Test
    void run_stageTimeout_isRetryable() {
        b.then((document, payload) -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return StageOutcome.success(payload);
        });
        PipelineHarness harness = harness(spec("a", 1),
                                          new StageSpec("b", 2, Duration.ZERO, Duration.ofMillis(100)),
                                          spec("c", 1));

        ExecutionRecord result = harness.runner.run(id, token);

        assertThat(b.calls()).isEqualTo(2);
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
    }

    @Test
    void run_stageAlwaysTimingOut_failsWithTimeoutReason() {
        b.otherwise((document, payload) -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return StageOutcome.success(payload);
        });
        PipelineHarness harness = harness(spec("a", 1),
                                          new StageSpec("b", 1, Duration.ZERO, Duration.ofMillis(100)),
                                          spec("c", 1));

        ExecutionRecord result = harness.runner.run(id, token);

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getLastError()).contains("timed out");
    }

    // ------------------------------------------------------------------
    // resuming from a checkpoint
    // ------------------------------------------------------------------

    @Test
    void run_existingCheckpoint_resumesWithoutRerunningCompletedStages() {
        checkpointAt(2, 0, StagePayload.seed(DOC).put("a", "done").put("b", "done"));

        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(a.calls()).isZero();
        assertThat(b.calls()).isZero();
        assertThat(c.calls()).isEqualTo(1);
        assertThat(c.received().get(0).keySet()).contains("a", "b");
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
    }

    @Test
    void run_attemptsFromEarlierRun_countAgainstBudget() {
        checkpointAt(1, 2, StagePayload.seed(DOC).put("a", "done"));
        b.alwaysRetryable("still down");

        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(b.calls()).isEqualTo(1);
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getAttempt()).isEqualTo(3);
    }

    @Test
    void run_backoff_doublesAndContinuesFromEarlierAttempts() {
        checkpointAt(1, 1, StagePayload.seed(DOC).put("a", "done"));
        b.thenRetryable("throttled").thenRetryable("throttled");
        RecordingToken sleeps = new RecordingToken(id);

        ExecutionRecord result = harness(spec("a", 3),
                                         new StageSpec("b", 4, Duration.ofMillis(100), Duration.ofSeconds(5)),
                                         spec("c", 3)).runner.run(id, sleeps);

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(b.calls()).isEqualTo(3);
        assertThat(sleeps.periods()).containsExactly(200L, 400L);
    }

    @Test
    void run_backoff_cappedAtMaximum() {
        b.alwaysRetryable("throttled");
        RecordingToken sleeps = new RecordingToken(id);

        ExecutionRecord result = harness(spec("a", 3),
                                         new StageSpec("b", 4, Duration.ofMinutes(2), Duration.ofSeconds(5)),
                                         spec("c", 3)).runner.run(id, sleeps);

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(sleeps.periods()).containsExactly(Duration.ofMinutes(2).toMillis(),
                                                     Duration.ofMinutes(4).toMillis(),
                                                     Duration.ofMinutes(5).toMillis());
    }

    @Test
    void run_terminalRecord_isReturnedUntouched() {
        ExecutionRecord record = store.load(id).orElseThrow();
        record.setStatus(ExecutionStatus.SUCCEEDED);
        store.save(record);

        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(a.calls()).isZero();
    }

    // ------------------------------------------------------------------
    // cancellation
    // ------------------------------------------------------------------

    @Test
    void run_cancelledBeforeStart_suspendsAtCurrentStage() {
        token.cancel();

        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(a.calls()).isZero();
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(result.isSuspended()).isTrue();
        assertThat(result.getCurrentStageIndex()).isZero();
    }

    @Test
    void run_cancelDuringBackoff_stopsWithoutFurtherAttempts() {
        b.then((document, payload) -> {
            token.cancel();
            return StageOutcome.retryable("throttled");
        });
        PipelineHarness harness = harness(spec("a", 1),
                                          new StageSpec("b", 3, Duration.ofMinutes(1), Duration.ofSeconds(5)),
                                          spec("c", 1));

        ExecutionRecord result = harness.runner.run(id, token);

        assertThat(b.calls()).isEqualTo(1);
        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(result.isSuspended()).isTrue();
        assertThat(result.getCurrentStageIndex()).isEqualTo(1);
        assertThat(result.getAttempt()).isEqualTo(1);
        assertThat(Thread.currentThread().isInterrupted()).isFalse();
    }

    // ------------------------------------------------------------------
    // ownership
    // ------------------------------------------------------------------

    @Test
    void run_liveLeaseOfOtherWorker_doesNothing() {
        store.claim(id, "other-worker", NOW, NOW.plus(Duration.ofMinutes(10)));

        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(a.calls()).isZero();
        assertThat(result.getLeaseOwner()).isEqualTo("other-worker");
    }

    @Test
    void run_concurrentWriter_stopsAtNextCheckpoint() {
        b.then((document, payload) -> {
            ExecutionRecord elsewhere = store.load(id).orElseThrow();
            elsewhere.setLastError("written by another worker");
            store.save(elsewhere);
            return StageOutcome.success(payload.put("b", "done"));
        });

        ExecutionRecord result = defaultHarness().runner.run(id, token);

        assertThat(c.calls()).isZero();
        assertThat(result.getCurrentStageIndex()).isEqualTo(1);
        assertThat(result.getLastError()).isEqualTo("written by another worker");
    }

    // ------------------------------------------------------------------
    // store failures
    // ------------------------------------------------------------------

    @Test
    void run_storeUnavailable_propagatesAfterCheckpointRetries() {
        PipelineHarness harness = defaultHarness();
        doThrow(new ExecutionStoreException("database unavailable")).when(store).save(any(ExecutionRecord.class));

        assertThatThrownBy(() -> harness.runner.run(id, token)).isInstanceOf(ExecutionStoreException.class);

        verify(store, times(3)).save(any(ExecutionRecord.class));
        ExecutionRecord stored = store.load(id).orElseThrow();
        assertThat(stored.getCurrentStageIndex()).isZero();
        assertThat(stored.getStatus()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(stored.getLeaseOwner()).isEqualTo(WORKER);
    }

    @Test
    void run_afterStoreRecovers_resumesFromLastCheckpoint() {
        PipelineHarness harness = defaultHarness();
        doThrow(new ExecutionStoreException("database unavailable")).when(store).save(any(ExecutionRecord.class));
        assertThatThrownBy(() -> harness.runner.run(id, token)).isInstanceOf(ExecutionStoreException.class);

        doCallRealMethod().when(store).save(any(ExecutionRecord.class));
        ExecutionRecord result = harness.runner.run(id, new CancellationToken(id));

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
        // the stage whose result was never checkpointed runs again
        assertThat(a.calls()).isEqualTo(2);
        assertThat(b.calls()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Records the requested backoff periods instead of waiting them out.
     */
    private static final class RecordingToken extends CancellationToken {

        private final List<Long> periods = new CopyOnWriteArrayList<>();

        RecordingToken(ExecutionId executionId) {
            super(executionId);
        }

        @Override
        public void sleep(long backOffPeriod) {
            periods.add(backOffPeriod);
        }

        List<Long> periods() {
            return periods;
        }
    }
}

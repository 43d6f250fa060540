package com.ryuqq.conductor.testkit.support;

import com.ryuqq.conductor.core.cache.CacheKey;
import com.ryuqq.conductor.core.event.RunCancelled;
import com.ryuqq.conductor.core.event.RunCompleted;
import com.ryuqq.conductor.core.event.RunCreated;
import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.event.RunFailed;
import com.ryuqq.conductor.core.event.RunPaused;
import com.ryuqq.conductor.core.event.RunResumed;
import com.ryuqq.conductor.core.event.RunStarted;
import com.ryuqq.conductor.core.event.StageAwaitingFeedback;
import com.ryuqq.conductor.core.event.StageCompleted;
import com.ryuqq.conductor.core.event.StageFailed;
import com.ryuqq.conductor.core.event.StageRetried;
import com.ryuqq.conductor.core.event.StageSkipped;
import com.ryuqq.conductor.core.event.StageStarted;
import com.ryuqq.conductor.core.event.StateSnapshot;
import com.ryuqq.conductor.core.event.UserFeedbackRecorded;
import com.ryuqq.conductor.core.model.BranchOrigin;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.ScopeId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.model.TemplateId;
import com.ryuqq.conductor.core.model.TokenUsage;
import com.ryuqq.conductor.core.state.RunState;
import com.ryuqq.conductor.core.state.RunStateProjector;
import com.ryuqq.conductor.core.state.SkipReason;
import com.ryuqq.conductor.core.state.StageError;
import com.ryuqq.conductor.core.state.StageOutput;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds valid, contiguous event logs for sink and projector tests.
 *
 * <p>Each call consumes the next sequence number of the run. Timestamps are one second
 * apart starting at {@link #BASE}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventFixtures {

    public static final Instant BASE = Instant.parse("2026-01-01T00:00:00Z");

    private final RunId runId;
    private long sequence;

    private EventFixtures(RunId runId, long lastSequence) {
        this.runId = runId;
        this.sequence = lastSequence;
    }

    public static EventFixtures forRun(String runId) {
        return new EventFixtures(RunId.of(runId), 0);
    }

    /**
     * Fixtures for a child run whose own log starts after {@code branchSequence}.
     */
    public static EventFixtures forBranch(String runId, long branchSequence) {
        return new EventFixtures(RunId.of(runId), branchSequence);
    }

    public RunId runId() {
        return runId;
    }

    public long lastSequence() {
        return sequence;
    }

    private long next() {
        return ++sequence;
    }

    private static Instant at(long seq) {
        return BASE.plusSeconds(seq);
    }

    public RunCreated created(String... stageIds) {
        long seq = next();
        return new RunCreated(runId, seq, at(seq), TemplateId.of("fixture"), 1, Map.of("topic", "cats"), ids(stageIds), null);
    }

    public RunCreated branchCreated(RunId parent, String... stageIds) {
        long seq = next();
        return new RunCreated(runId, seq, at(seq), TemplateId.of("fixture"), 1, Map.of("topic", "cats"), ids(stageIds),
            new BranchOrigin(parent, seq - 1));
    }

    public RunStarted started() {
        long seq = next();
        return new RunStarted(runId, seq, at(seq));
    }

    public RunPaused paused() {
        long seq = next();
        return new RunPaused(runId, seq, at(seq));
    }

    public RunResumed resumed() {
        long seq = next();
        return new RunResumed(runId, seq, at(seq));
    }

    public StageStarted stageStarted(String stageId, int attempt) {
        long seq = next();
        return new StageStarted(runId, seq, at(seq), StageId.of(stageId), attempt);
    }

    public StageCompleted stageCompleted(String stageId, int attempt, String text) {
        long seq = next();
        CacheKey key = CacheKey.derive(text, "fixture-model", Map.of(), ScopeId.of("fixture"));
        return new StageCompleted(runId, seq, at(seq), StageId.of(stageId), attempt,
            StageOutput.fresh(text, "fixture-model", key, new TokenUsage(3, 7)));
    }

    public StageRetried stageRetried(String stageId, int attempt) {
        long seq = next();
        return new StageRetried(runId, seq, at(seq), StageId.of(stageId), attempt, 250, error(stageId, attempt));
    }

    public StageFailed stageFailed(String stageId, int attempt) {
        long seq = next();
        return new StageFailed(runId, seq, at(seq), StageId.of(stageId), attempt, error(stageId, attempt));
    }

    public StageSkipped stageSkipped(String stageId, String cause) {
        long seq = next();
        return new StageSkipped(runId, seq, at(seq), StageId.of(stageId),
            cause == null ? SkipReason.EXPLICIT : SkipReason.UPSTREAM_FAILED, cause == null ? null : StageId.of(cause));
    }

    public StageAwaitingFeedback awaitingFeedback(String stageId, int attempt, String... candidates) {
        long seq = next();
        return new StageAwaitingFeedback(runId, seq, at(seq), StageId.of(stageId), attempt, List.of(candidates),
            new TokenUsage(2, 4));
    }

    public UserFeedbackRecorded feedback(String stageId, int candidateIndex, String text) {
        long seq = next();
        return new UserFeedbackRecorded(runId, seq, at(seq), StageId.of(stageId), candidateIndex, text, "picked");
    }

    public RunCompleted completed() {
        long seq = next();
        return new RunCompleted(runId, seq, at(seq));
    }

    public RunFailed failed(String reason, List<StageError> errors) {
        long seq = next();
        return new RunFailed(runId, seq, at(seq), reason, errors);
    }

    public RunCancelled cancelled(String... inFlight) {
        long seq = next();
        return new RunCancelled(runId, seq, at(seq), ids(inFlight), "cancel requested");
    }

    public StateSnapshot snapshot(RunState state) {
        long seq = next();
        return new StateSnapshot(runId, seq, at(seq), state);
    }

    public static StageError error(String stageId, int attempt) {
        return new StageError(StageId.of(stageId), attempt, StageError.GENERATION_FAILED, "scripted failure " + attempt);
    }

    /**
     * A valid log that uses every event type, including a snapshot.
     *
     * <pre>
     * outline ok, pick awaits feedback and completes, flaky retries then fails,
     * skipped is skipped, run is paused/resumed and fails.
     * </pre>
     */
    public static List<RunEvent> everyEventType(String runId) {
        EventFixtures events = forRun(runId);
        RunStateProjector projector = new RunStateProjector();
        List<RunEvent> log = new ArrayList<>();
        log.add(events.created("outline", "pick", "flaky", "skipped"));
        log.add(events.started());
        log.add(events.stageStarted("outline", 1));
        log.add(events.stageCompleted("outline", 1, "an outline"));
        log.add(events.stageStarted("pick", 1));
        log.add(events.awaitingFeedback("pick", 1, "first", "second"));
        log.add(events.feedback("pick", 1, "second"));
        log.add(events.stageCompleted("pick", 1, "second"));
        log.add(events.snapshot(projector.replay(log)));
        log.add(events.paused());
        log.add(events.resumed());
        log.add(events.stageStarted("flaky", 1));
        log.add(events.stageRetried("flaky", 1));
        log.add(events.stageStarted("flaky", 2));
        log.add(events.stageFailed("flaky", 2));
        log.add(events.stageSkipped("skipped", "flaky"));
        log.add(events.failed("stage flaky failed", List.of(error("flaky", 1), error("flaky", 2))));
        return log;
    }

    private static List<StageId> ids(String... values) {
        List<StageId> ids = new ArrayList<>();
        for (String value : values) {
            ids.add(StageId.of(value));
        }
        return ids;
    }
}

package com.ryuqq.conductor.core.state;

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
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.statemachine.RunStatus;
import com.ryuqq.conductor.core.statemachine.RunTransition;
import com.ryuqq.conductor.core.statemachine.StageStatus;
import com.ryuqq.conductor.core.statemachine.StageTransition;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 이벤트를 Run 상태로 접는 순수 함수 모음.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>부수효과 없음: 같은 입력이면 항상 같은 상태 ({@code equals})를 반환</li>
 *   <li>시퀀스는 직전 상태의 {@code lastSequence + 1}이어야 함</li>
 *   <li>Stage/Run 전이는 {@link StageTransition}, {@link RunTransition}으로 검증</li>
 *   <li>Run이 종료된 뒤 도착한 늦은 이벤트는 시퀀스만 반영하고 무시</li>
 *   <li>{@link StateSnapshot}은 담고 있는 상태로 그대로 대체</li>
 * </ul>
 *
 * <p>규칙을 어기는 이벤트 열은 손상된 로그로 간주하여
 * {@link IllegalStateException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunStateProjector {

    /**
     * 이벤트 열 전체를 처음부터 접음.
     *
     * @param events 시퀀스 순서의 이벤트 목록 (비어 있으면 안 됨)
     * @return 마지막 이벤트까지 접힌 상태
     * @throws IllegalStateException 이벤트 열이 규칙을 어긴 경우
     */
    public RunState replay(List<? extends RunEvent> events) {
        return replay(null, events);
    }

    /**
     * 기준 상태에서 이어서 접음.
     *
     * @param base 기준 상태 (nullable, null이면 첫 이벤트가 RunCreated/StateSnapshot이어야 함)
     * @param events 이어지는 이벤트 목록
     * @return 접힌 상태
     * @throws IllegalStateException 이벤트 열이 규칙을 어긴 경우
     */
    public RunState replay(RunState base, List<? extends RunEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        RunState state = base;
        for (RunEvent event : events) {
            state = apply(state, event);
        }
        if (state == null) {
            throw new IllegalStateException("Nothing to replay: no base state and no events");
        }
        return state;
    }

    /**
     * 스냅샷 내용을 믿지 않고 원시 이벤트만으로 접음.
     *
     * <p>{@link StateSnapshot}은 시퀀스만 전진시킵니다. 스냅샷에서 복원한 상태가
     * 로그 자체와 일치하는지 대조할 때 사용합니다.</p>
     *
     * @param events 시퀀스 순서의 이벤트 목록 (RunCreated로 시작)
     * @return 마지막 이벤트까지 접힌 상태
     * @throws IllegalStateException 이벤트 열이 규칙을 어긴 경우
     */
    public RunState replayWithoutSnapshots(List<? extends RunEvent> events) {
        return replayWithoutSnapshots(null, events);
    }

    /**
     * 기준 상태에서 이어서 원시 이벤트만으로 접음.
     *
     * @param base 기준 상태 (nullable, null이면 첫 이벤트가 RunCreated여야 함)
     * @param events 이어지는 이벤트 목록
     * @return 접힌 상태
     * @throws IllegalStateException 이벤트 열이 규칙을 어긴 경우
     */
    public RunState replayWithoutSnapshots(RunState base, List<? extends RunEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        RunState state = base;
        for (RunEvent event : events) {
            if (event instanceof StateSnapshot) {
                if (state == null) {
                    throw new IllegalStateException(
                        "Raw replay of run " + event.runId() + " must start with RunCreated (got STATE_SNAPSHOT)"
                    );
                }
                requireNext(state, event);
                state = state.withLastSequence(event.sequence());
            } else {
                state = apply(state, event);
            }
        }
        if (state == null) {
            throw new IllegalStateException("Nothing to replay: no base state and no events");
        }
        return state;
    }

    /**
     * 이벤트 하나를 접음.
     *
     * @param state 현재 상태 (첫 이벤트면 null)
     * @param event 다음 이벤트
     * @return 새 상태
     * @throws IllegalStateException 이벤트가 현재 상태에 적용될 수 없는 경우
     */
    public RunState apply(RunState state, RunEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }

        if (event instanceof RunCreated) {
            return applyCreated(state, (RunCreated) event);
        }
        if (state == null) {
            if (event instanceof StateSnapshot) {
                StateSnapshot snapshot = (StateSnapshot) event;
                return snapshot.state().withLastSequence(snapshot.sequence());
            }
            throw new IllegalStateException(
                String.format("First event of run %s must be RunCreated (got %s)", event.runId(), event.type())
            );
        }

        requireNext(state, event);
        if (event instanceof StateSnapshot) {
            return ((StateSnapshot) event).state().withLastSequence(event.sequence());
        }

        RunState next = state.withLastSequence(event.sequence());
        if (state.isTerminal()) {
            // 종료 이후 도착한 늦은 완료/실패는 기록만 되고 상태에는 영향 없음
            return next;
        }

        if (event instanceof RunStarted) {
            return next.withStatus(RunTransition.transition(state.status(), RunStatus.RUNNING));
        }
        if (event instanceof RunPaused) {
            return next.withStatus(RunTransition.transition(state.status(), RunStatus.PAUSED));
        }
        if (event instanceof RunResumed) {
            if (state.status() != RunStatus.PAUSED) {
                throw new IllegalStateException("RunResumed requires PAUSED run (current: " + state.status() + ")");
            }
            return next.withStatus(RunTransition.transition(state.status(), RunStatus.RUNNING));
        }
        if (event instanceof StageStarted) {
            return applyStageStarted(next, (StageStarted) event);
        }
        if (event instanceof StageCompleted) {
            return applyStageCompleted(next, (StageCompleted) event);
        }
        if (event instanceof StageRetried) {
            StageRetried retried = (StageRetried) event;
            StageExecution execution = requireAttempt(next, retried.stageId(), retried.attempt());
            StageTransition.validate(execution.status(), StageStatus.FAILED);
            return next.withStage(execution.failed(retried.error(), true, retried.occurredAt()))
                .withError(retried.error());
        }
        if (event instanceof StageFailed) {
            StageFailed failed = (StageFailed) event;
            StageExecution execution = requireAttempt(next, failed.stageId(), failed.attempt());
            StageTransition.validate(execution.status(), StageStatus.FAILED);
            return next.withStage(execution.failed(failed.error(), false, failed.occurredAt()))
                .withError(failed.error());
        }
        if (event instanceof StageSkipped) {
            StageSkipped skipped = (StageSkipped) event;
            StageExecution execution = next.stage(skipped.stageId());
            StageTransition.validate(execution.status(), StageStatus.SKIPPED);
            return next.withStage(execution.skipped(skipped.reason(), skipped.occurredAt()));
        }
        if (event instanceof StageAwaitingFeedback) {
            StageAwaitingFeedback awaiting = (StageAwaitingFeedback) event;
            StageExecution execution = requireAttempt(next, awaiting.stageId(), awaiting.attempt());
            StageTransition.validate(execution.status(), StageStatus.AWAITING_FEEDBACK);
            return next.withStage(execution.awaitingFeedback(awaiting.candidates()))
                .withTokenUsage(next.tokenUsage().plus(awaiting.tokenUsage()));
        }
        if (event instanceof UserFeedbackRecorded) {
            UserFeedbackRecorded feedback = (UserFeedbackRecorded) event;
            StageExecution execution = next.stage(feedback.stageId());
            if (execution.status() != StageStatus.AWAITING_FEEDBACK) {
                throw new IllegalStateException(
                    "Feedback recorded for stage not awaiting feedback: " + feedback.stageId() + " (" + execution.status() + ")"
                );
            }
            return next.withStage(execution.feedbackRecorded(feedback.text()));
        }
        if (event instanceof RunCompleted) {
            return next.withStatus(RunTransition.transition(state.status(), RunStatus.COMPLETED));
        }
        if (event instanceof RunFailed) {
            RunFailed failed = (RunFailed) event;
            return cancelActiveStages(next, failed.occurredAt())
                .withStatus(RunTransition.transition(state.status(), RunStatus.FAILED))
                .withFailureReason(failed.reason());
        }
        if (event instanceof RunCancelled) {
            RunCancelled cancelled = (RunCancelled) event;
            return cancelActiveStages(next, cancelled.occurredAt())
                .withStatus(RunTransition.transition(state.status(), RunStatus.CANCELLED))
                .withInFlightAtCancel(cancelled.inFlight());
        }

        throw new IllegalStateException("Unsupported event type: " + event.type());
    }

    private RunState applyCreated(RunState state, RunCreated created) {
        if (!created.isBranch()) {
            if (state != null) {
                throw new IllegalStateException("Duplicate RunCreated for run " + created.runId());
            }
            Map<StageId, StageExecution> stages = new LinkedHashMap<>();
            for (StageId stageId : created.stageIds()) {
                stages.put(stageId, StageExecution.waiting(stageId));
            }
            return new RunState(created.runId(), created.templateId(), created.templateVersion(), created.inputs(),
                RunStatus.PENDING, created.occurredAt(), stages, null, List.of(), List.of(), null, null,
                created.sequence());
        }

        if (state == null) {
            throw new IllegalStateException(
                "Branched run " + created.runId() + " requires the parent prefix state of " + created.origin().parentRunId()
            );
        }
        requireNext(state, created);
        return state.branchedAs(created.runId(), created.origin(), created.occurredAt())
            .withLastSequence(created.sequence());
    }

    private RunState applyStageStarted(RunState state, StageStarted started) {
        StageExecution execution = state.stage(started.stageId());
        if (execution.status() == StageStatus.FAILED && !execution.retryScheduled()) {
            throw new IllegalStateException("Stage " + started.stageId() + " failed without a scheduled retry");
        }
        if (started.attempt() != execution.attempt() + 1) {
            throw new IllegalStateException(
                String.format("Stage %s attempt out of order: expected %d, got %d",
                    started.stageId().getValue(), execution.attempt() + 1, started.attempt())
            );
        }
        StageTransition.validate(execution.status(), StageStatus.RUNNING);
        return state.withStage(execution.started(started.attempt(), started.occurredAt()));
    }

    private RunState applyStageCompleted(RunState state, StageCompleted completed) {
        StageExecution execution = requireAttempt(state, completed.stageId(), completed.attempt());
        StageTransition.validate(execution.status(), StageStatus.COMPLETED);
        return state.withStage(execution.completed(completed.output(), completed.occurredAt()))
            .withTokenUsage(state.tokenUsage().plus(completed.output().tokenUsage()));
    }

    private static StageExecution requireAttempt(RunState state, StageId stageId, int attempt) {
        StageExecution execution = state.stage(stageId);
        if (execution.attempt() != attempt) {
            throw new IllegalStateException(
                String.format("Stage %s event for attempt %d does not match current attempt %d",
                    stageId.getValue(), attempt, execution.attempt())
            );
        }
        return execution;
    }

    private static RunState cancelActiveStages(RunState state, Instant at) {
        Map<StageId, StageExecution> stages = new LinkedHashMap<>(state.stages());
        boolean changed = false;
        for (StageExecution execution : state.stages().values()) {
            if (execution.isActive()) {
                stages.put(execution.stageId(), execution.cancelled(at));
                changed = true;
            }
        }
        return changed ? state.withStages(stages) : state;
    }

    private static void requireNext(RunState state, RunEvent event) {
        if (event.sequence() != state.lastSequence() + 1) {
            throw new IllegalStateException(
                String.format("Non-contiguous sequence for run %s: expected %d, got %d",
                    event.runId().getValue(), state.lastSequence() + 1, event.sequence())
            );
        }
        if (!(event instanceof RunCreated) && !state.runId().equals(event.runId())) {
            throw new IllegalStateException(
                "Event of run " + event.runId() + " cannot be applied to run " + state.runId()
            );
        }
    }
}

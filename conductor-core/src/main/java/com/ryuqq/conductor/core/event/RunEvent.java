package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;

import java.time.Instant;

/**
 * Run 이벤트 로그에 기록되는 불변 사실(fact).
 *
 * <p>모든 이벤트는 Run 범위에서 1부터 시작해 빈틈없이 증가하는 시퀀스 번호를 가지며,
 * 기록된 뒤에는 수정되거나 삭제되지 않습니다. Run 상태는 오직 이 이벤트들을
 * 순서대로 접어서 유도됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface RunEvent permits RunCreated, RunStarted, RunPaused, RunResumed,
    StageStarted, StageCompleted, StageFailed, StageRetried, StageSkipped,
    StageAwaitingFeedback, UserFeedbackRecorded,
    RunCompleted, RunFailed, RunCancelled, StateSnapshot {

    /**
     * 이벤트가 속한 Run.
     *
     * @return Run ID
     */
    RunId runId();

    /**
     * Run 범위 시퀀스 번호 (1부터 시작).
     *
     * @return 시퀀스 번호
     */
    long sequence();

    /**
     * 발생 시각.
     *
     * @return 발생 시각
     */
    Instant occurredAt();

    /**
     * 이벤트 종류.
     *
     * @return 이벤트 종류
     */
    EventType type();
}

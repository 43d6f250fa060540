package com.ryuqq.conductor.core.state;

import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.statemachine.StageStatus;

import java.time.Instant;
import java.util.List;

/**
 * Run 내부의 Stage별 실행 기록 (불변).
 *
 * <p>상태 변경은 항상 새 인스턴스를 반환하며, 오직 {@link RunStateProjector}만
 * 이벤트를 접으면서 호출합니다.</p>
 *
 * @param stageId Stage ID
 * @param status 현재 상태
 * @param attempt 마지막 시도 번호 (시작 전 0)
 * @param retryScheduled FAILED 상태에서 재시도가 예약되었는지 여부
 * @param startedAt 마지막 시도 시작 시각 (nullable)
 * @param finishedAt 종료 시각 (nullable)
 * @param output 출력 (COMPLETED일 때만)
 * @param candidates 사용자 선택 후보 (USER_SELECTION)
 * @param feedback 기록된 사용자 선택 텍스트 (nullable)
 * @param error 마지막 오류 (nullable)
 * @param skipReason 건너뛴 이유 (SKIPPED일 때만)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageExecution(
    StageId stageId,
    StageStatus status,
    int attempt,
    boolean retryScheduled,
    Instant startedAt,
    Instant finishedAt,
    StageOutput output,
    List<String> candidates,
    String feedback,
    StageError error,
    SkipReason skipReason
) {

    public StageExecution {
        if (stageId == null) {
            throw new IllegalArgumentException("stageId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative (current: " + attempt + ")");
        }
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    /**
     * 대기 상태의 초기 기록.
     *
     * @param stageId Stage ID
     * @return WAITING 상태 StageExecution
     */
    public static StageExecution waiting(StageId stageId) {
        return new StageExecution(stageId, StageStatus.WAITING, 0, false, null, null, null, List.of(), null, null, null);
    }

    /**
     * 더 이상 변하지 않는 상태인지 확인.
     *
     * <p>재시도가 예약된 FAILED는 아직 정착하지 않은 것으로 봅니다.</p>
     *
     * @return 종료 상태이고 재시도 예약이 없으면 true
     */
    public boolean isSettled() {
        return status.isTerminal() && !retryScheduled;
    }

    /**
     * 진행 중 상태인지 확인 (RUNNING, AWAITING_FEEDBACK, 재시도 대기 FAILED).
     *
     * @return 진행 중이면 true
     */
    public boolean isActive() {
        return status == StageStatus.RUNNING
            || status == StageStatus.AWAITING_FEEDBACK
            || (status == StageStatus.FAILED && retryScheduled);
    }

    StageExecution started(int attempt, Instant at) {
        return new StageExecution(stageId, StageStatus.RUNNING, attempt, false, at, null, null, List.of(), null, error, null);
    }

    StageExecution completed(StageOutput output, Instant at) {
        return new StageExecution(stageId, StageStatus.COMPLETED, attempt, false, startedAt, at, output, candidates, feedback, error, null);
    }

    StageExecution failed(StageError error, boolean retryScheduled, Instant at) {
        return new StageExecution(stageId, StageStatus.FAILED, attempt, retryScheduled, startedAt, at, null, List.of(), null, error, null);
    }

    StageExecution skipped(SkipReason reason, Instant at) {
        return new StageExecution(stageId, StageStatus.SKIPPED, attempt, false, startedAt, at, null, candidates, feedback, error, reason);
    }

    StageExecution awaitingFeedback(List<String> candidates) {
        return new StageExecution(stageId, StageStatus.AWAITING_FEEDBACK, attempt, false, startedAt, null, null, candidates, null, error, null);
    }

    StageExecution feedbackRecorded(String text) {
        return new StageExecution(stageId, status, attempt, false, startedAt, finishedAt, output, candidates, text, error, null);
    }

    StageExecution cancelled(Instant at) {
        return new StageExecution(stageId, StageStatus.CANCELLED, attempt, false, startedAt, at, null, candidates, feedback, error, null);
    }

    /**
     * 분기 시 진행 중이던 Stage를 처음부터 다시 실행하도록 대기 상태로 되돌림.
     */
    StageExecution resetForBranch() {
        return waiting(stageId);
    }
}

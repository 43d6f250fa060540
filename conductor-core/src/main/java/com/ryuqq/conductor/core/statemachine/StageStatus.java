package com.ryuqq.conductor.core.statemachine;

/**
 * Run 내부 Stage 실행 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * WAITING ──► RUNNING ──► COMPLETED
 *    │           │
 *    │           ├─► AWAITING_FEEDBACK ──► COMPLETED
 *    │           │
 *    │           └─► FAILED ──► RUNNING (재시도, 정책 한도 내)
 *    │
 *    └─► SKIPPED (상위 필수 Stage 실패 또는 명시적 건너뛰기)
 *
 * RUNNING / AWAITING_FEEDBACK / FAILED(재시도 대기) ──► CANCELLED (Run 종료 시)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StageStatus {

    /**
     * 의존성 대기 중.
     */
    WAITING,

    /**
     * 실행 중 (생성 호출 또는 변환 진행 중).
     */
    RUNNING,

    /**
     * 후보 생성 완료, 사용자 선택 대기 중.
     */
    AWAITING_FEEDBACK,

    /**
     * 완료.
     */
    COMPLETED,

    /**
     * 실패. 재시도가 예약된 경우 다시 RUNNING으로 전이 가능.
     */
    FAILED,

    /**
     * 건너뜀.
     */
    SKIPPED,

    /**
     * Run 종료로 인해 중단됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>FAILED는 종료 상태로 취급되지만, 재시도 예약 여부는
     * {@code StageExecution#isSettled()}에서 함께 판단합니다.</p>
     *
     * @return COMPLETED, FAILED, SKIPPED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }
}

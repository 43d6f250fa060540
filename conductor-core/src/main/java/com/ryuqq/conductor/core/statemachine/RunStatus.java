package com.ryuqq.conductor.core.statemachine;

/**
 * Run의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ▼ (시작)
 * RUNNING ◄──► PAUSED
 *    │
 *    ├─► COMPLETED (그래프 소진)
 *    ├─► FAILED (필수 Stage 최종 실패, 이벤트 싱크 장애)
 *    └─► CANCELLED (협력적 취소)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunStatus {

    /**
     * 생성됨 (아직 시작 안 됨).
     */
    PENDING,

    /**
     * 실행 중.
     */
    RUNNING,

    /**
     * 일시 정지 (새 Stage 시작 안 함, 진행 중 Stage는 계속).
     */
    PAUSED,

    /**
     * 완료 (성공).
     */
    COMPLETED,

    /**
     * 실패 (영구).
     */
    FAILED,

    /**
     * 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}

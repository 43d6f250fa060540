package com.ryuqq.conductor.core.state;

/**
 * Stage를 건너뛴 이유.
 *
 * <p>EXPLICIT으로 건너뛴 Stage는 하위 Stage의 의존성을 만족시키지만,
 * UPSTREAM_FAILED는 하위로 다시 전파됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SkipReason {

    /**
     * 상위 필수 Stage가 최종 실패함 (재시도 없음).
     */
    UPSTREAM_FAILED,

    /**
     * 호출자가 명시적으로 건너뜀.
     */
    EXPLICIT
}

package com.ryuqq.conductor.core.template;

/**
 * Stage 종류.
 *
 * <p>Stage 종류마다 하나의 핸들러 구현이 존재하며, 오케스트레이터는
 * 종류 값으로 핸들러를 찾아 위임합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StageKind {

    /**
     * 외부 생성 기능을 호출해 텍스트를 생성 (캐시 대상).
     */
    GENERATE,

    /**
     * 여러 후보를 생성한 뒤 사용자의 선택을 기다림.
     */
    USER_SELECTION,

    /**
     * 이름으로 등록된 로컬 결정적 함수 적용.
     */
    TRANSFORM
}

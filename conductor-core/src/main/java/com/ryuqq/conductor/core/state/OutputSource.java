package com.ryuqq.conductor.core.state;

/**
 * Stage 출력의 출처.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum OutputSource {

    /**
     * 외부 생성 기능을 새로 호출한 결과.
     */
    FRESH,

    /**
     * 응답 캐시에서 재사용한 결과.
     */
    CACHE,

    /**
     * 사용자가 후보 중 선택했거나 직접 입력한 결과.
     */
    FEEDBACK,

    /**
     * 로컬 변환 함수의 결과.
     */
    TRANSFORM
}

package com.ryuqq.conductor.adapter.runner.stage;

/**
 * TRANSFORM Stage에서 쓰는 결정적 로컬 함수.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StageTransform {

    /**
     * @param input 렌더링된 프롬프트
     * @return 변환 결과
     */
    String apply(String input);
}

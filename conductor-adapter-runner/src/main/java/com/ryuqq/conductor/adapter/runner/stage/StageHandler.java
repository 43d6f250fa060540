package com.ryuqq.conductor.adapter.runner.stage;

import com.ryuqq.conductor.core.outcome.StageOutcome;
import com.ryuqq.conductor.core.template.StageKind;

import java.util.concurrent.CompletableFuture;

/**
 * Stage 종류별 실행 전략.
 *
 * <p>구현체는 즉시 반환하고 작업은 비동기로 진행해야 합니다. 반환된 Future가
 * 예외로 끝나면 Run 루프가 {@link StageFailures#classify}로 재시도 여부를 판정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StageHandler {

    /**
     * 처리하는 Stage 종류.
     */
    StageKind kind();

    /**
     * 시도 하나 실행.
     *
     * @param context 렌더링된 실행 입력
     * @return Ok 또는 AwaitFeedback으로 끝나는 Future
     */
    CompletableFuture<StageOutcome> execute(StageContext context);
}

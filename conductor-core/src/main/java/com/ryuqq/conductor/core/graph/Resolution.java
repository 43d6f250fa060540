package com.ryuqq.conductor.core.graph;

import com.ryuqq.conductor.core.model.StageId;

import java.util.List;

/**
 * 의존성 해석 결과.
 *
 * @param runnable 지금 시작할 Stage (선언 순서, 가용 슬롯 수로 잘림)
 * @param skipped 상위 Stage 실패로 건너뛰어야 할 Stage
 * @param failedRequired 재시도가 남지 않은 필수 Stage 실패 목록
 * @param exhausted 대기 중인 Stage도, 진행 중인 Stage도 없음
 * @param stuck 대기 중인 Stage가 있으나 시작할 수도 건너뛸 수도 없고 진행 중인 것도 없음
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Resolution(
    List<StageId> runnable,
    List<Skip> skipped,
    List<StageId> failedRequired,
    boolean exhausted,
    boolean stuck
) {

    public Resolution {
        runnable = runnable == null ? List.of() : List.copyOf(runnable);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
        failedRequired = failedRequired == null ? List.of() : List.copyOf(failedRequired);
    }

    /**
     * 건너뛰기 결정.
     *
     * @param stageId 건너뛸 Stage
     * @param cause 원인이 된 상위 Stage
     */
    public record Skip(StageId stageId, StageId cause) {

        public Skip {
            if (stageId == null) {
                throw new IllegalArgumentException("stageId cannot be null");
            }
            if (cause == null) {
                throw new IllegalArgumentException("cause cannot be null");
            }
        }
    }

    /**
     * 이번 해석으로 상태가 진전되는지 확인.
     *
     * @return 시작하거나 건너뛸 Stage가 있으면 true
     */
    public boolean hasProgress() {
        return !runnable.isEmpty() || !skipped.isEmpty();
    }
}

package com.ryuqq.conductor.core.outcome;

import com.ryuqq.conductor.core.state.StageError;

/**
 * 재시도 불가능한 영구적 실패.
 *
 * <p>잘못된 요청, 취소, 알 수 없는 변환 함수처럼 다시 시도해도 결과가 같은 경우입니다.</p>
 *
 * @param error 오류 상세
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail(StageError error) implements StageOutcome {

    public Fail {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}

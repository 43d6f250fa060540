package com.ryuqq.conductor.core.outcome;

import com.ryuqq.conductor.core.state.StageError;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p>일시적인 오류로 실패했으나 다시 시도하면 성공할 가능성이 있는 경우입니다.
 * 재시도 여부와 대기 시간은 Stage의 재시도 정책이 결정합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>생성 호출 타임아웃</li>
 *   <li>외부 서비스 일시 장애</li>
 *   <li>Rate Limit 초과</li>
 * </ul>
 *
 * @param error 오류 상세
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Retry(StageError error) implements StageOutcome {

    public Retry {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}

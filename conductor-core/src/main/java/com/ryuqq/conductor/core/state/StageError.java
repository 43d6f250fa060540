package com.ryuqq.conductor.core.state;

import com.ryuqq.conductor.core.model.StageId;

/**
 * Stage 시도 하나의 오류 상세.
 *
 * <p>Run 실패 시 노출되는 오류 체인의 원소입니다.</p>
 *
 * @param stageId 실패한 Stage
 * @param attempt 실패한 시도 번호 (1 이상)
 * @param code 오류 코드
 * @param message 오류 메시지
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageError(StageId stageId, int attempt, String code, String message) {

    public static final String GENERATION_FAILED = "GENERATION_FAILED";
    public static final String TIMEOUT = "TIMEOUT";
    public static final String CANCELLED = "CANCELLED";
    public static final String TRANSFORM_FAILED = "TRANSFORM_FAILED";
    public static final String INTERNAL = "INTERNAL";

    public StageError {
        if (stageId == null) {
            throw new IllegalArgumentException("stageId cannot be null");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        message = message == null ? "" : message;
    }

    @Override
    public String toString() {
        return stageId.getValue() + "#" + attempt + " " + code + ": " + message;
    }
}

package com.ryuqq.conductor.core.exception;

/**
 * 외부 생성 기능(Generation capability) 호출 실패.
 *
 * <p>{@code retryable}이 true이면 Stage의 재시도 정책에 따라 재시도되고,
 * false이면 즉시 StageFailed로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StageExecutionException extends ConductorException {

    private final String errorCode;
    private final boolean retryable;

    public StageExecutionException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, retryable, null);
    }

    public StageExecutionException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

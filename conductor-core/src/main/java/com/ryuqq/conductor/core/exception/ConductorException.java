package com.ryuqq.conductor.core.exception;

/**
 * Conductor 예외 계층의 최상위 타입.
 *
 * <p>모든 예외는 unchecked이며, 하위 타입이 오류 분류(taxonomy)를 표현합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConductorException extends RuntimeException {

    public ConductorException(String message) {
        super(message);
    }

    public ConductorException(String message, Throwable cause) {
        super(message, cause);
    }
}

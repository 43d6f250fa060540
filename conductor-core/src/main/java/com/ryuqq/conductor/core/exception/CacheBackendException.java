package com.ryuqq.conductor.core.exception;

/**
 * 영속 캐시 계층(Tier 2) 장애.
 *
 * <p>응답 캐시는 이 예외를 로그로 남기고 메모리 계층만으로 동작을 이어갑니다.
 * Stage 호출자에게는 전파되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CacheBackendException extends ConductorException {

    public CacheBackendException(String message) {
        super(message);
    }

    public CacheBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.ryuqq.conductor.core.exception;

/**
 * 이벤트 싱크 내구성 실패.
 *
 * <p>재생(replay) 정확성이 내구성에 의존하므로 해당 Run에 치명적입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EventSinkException extends ConductorException {

    public EventSinkException(String message) {
        super(message);
    }

    public EventSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}

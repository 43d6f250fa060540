package com.ryuqq.conductor.adapter.runner.stage;

import com.ryuqq.conductor.core.template.StageKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 종류 → 실행 전략 매핑.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StageHandlers {

    private final Map<StageKind, StageHandler> handlers = new EnumMap<>(StageKind.class);

    /**
     * 생성자.
     *
     * @param handlers 종류마다 정확히 하나의 전략
     * @throws IllegalArgumentException 종류가 중복되거나 빠진 경우
     */
    public StageHandlers(List<StageHandler> handlers) {
        if (handlers == null) {
            throw new IllegalArgumentException("handlers cannot be null");
        }
        for (StageHandler handler : handlers) {
            if (this.handlers.put(handler.kind(), handler) != null) {
                throw new IllegalArgumentException("Duplicate handler for stage kind " + handler.kind());
            }
        }
        for (StageKind kind : StageKind.values()) {
            if (!this.handlers.containsKey(kind)) {
                throw new IllegalArgumentException("No handler for stage kind " + kind);
            }
        }
    }

    public StageHandler forKind(StageKind kind) {
        return handlers.get(kind);
    }
}

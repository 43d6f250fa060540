package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;

import java.time.Instant;

/**
 * 의존성 그래프가 소진되어 Run이 완료됨.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunCompleted(RunId runId, long sequence, Instant occurredAt) implements RunEvent {

    public RunCompleted {
        Events.requireHeader(runId, sequence, occurredAt);
    }

    @Override
    public EventType type() {
        return EventType.RUN_COMPLETED;
    }
}

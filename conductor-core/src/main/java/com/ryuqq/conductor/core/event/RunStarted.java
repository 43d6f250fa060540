package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;

import java.time.Instant;

/**
 * Run 실행 시작.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunStarted(RunId runId, long sequence, Instant occurredAt) implements RunEvent {

    public RunStarted {
        Events.requireHeader(runId, sequence, occurredAt);
    }

    @Override
    public EventType type() {
        return EventType.RUN_STARTED;
    }
}

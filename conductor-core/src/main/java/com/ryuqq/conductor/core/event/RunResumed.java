package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;

import java.time.Instant;

/**
 * 일시 정지된 Run 재개.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunResumed(RunId runId, long sequence, Instant occurredAt) implements RunEvent {

    public RunResumed {
        Events.requireHeader(runId, sequence, occurredAt);
    }

    @Override
    public EventType type() {
        return EventType.RUN_RESUMED;
    }
}

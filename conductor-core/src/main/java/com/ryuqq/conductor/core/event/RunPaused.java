package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;

import java.time.Instant;

/**
 * Run 일시 정지. 새 Stage는 시작되지 않지만 진행 중 Stage는 계속됩니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunPaused(RunId runId, long sequence, Instant occurredAt) implements RunEvent {

    public RunPaused {
        Events.requireHeader(runId, sequence, occurredAt);
    }

    @Override
    public EventType type() {
        return EventType.RUN_PAUSED;
    }
}

package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;

import java.time.Instant;

/**
 * Stage 시도 시작. 시도마다 정확히 하나 기록됩니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageStarted(RunId runId, long sequence, Instant occurredAt, StageId stageId, int attempt)
    implements RunEvent {

    public StageStarted {
        Events.requireHeader(runId, sequence, occurredAt);
        Events.requireStage(stageId, attempt);
    }

    @Override
    public EventType type() {
        return EventType.STAGE_STARTED;
    }
}

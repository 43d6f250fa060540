package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.state.SkipReason;

import java.time.Instant;

/**
 * Stage 건너뜀.
 *
 * @param reason 건너뛴 이유
 * @param cause 원인이 된 상위 Stage (EXPLICIT이면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageSkipped(RunId runId, long sequence, Instant occurredAt, StageId stageId, SkipReason reason,
                           StageId cause) implements RunEvent {

    public StageSkipped {
        Events.requireHeader(runId, sequence, occurredAt);
        if (stageId == null) {
            throw new IllegalArgumentException("stageId cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
    }

    @Override
    public EventType type() {
        return EventType.STAGE_SKIPPED;
    }
}

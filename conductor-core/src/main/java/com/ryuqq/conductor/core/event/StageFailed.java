package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.state.StageError;

import java.time.Instant;

/**
 * Stage 최종 실패 (재시도 소진 또는 영구 오류).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageFailed(RunId runId, long sequence, Instant occurredAt, StageId stageId, int attempt,
                          StageError error) implements RunEvent {

    public StageFailed {
        Events.requireHeader(runId, sequence, occurredAt);
        Events.requireStage(stageId, attempt);
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    @Override
    public EventType type() {
        return EventType.STAGE_FAILED;
    }
}

package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.state.StageOutput;

import java.time.Instant;

/**
 * Stage 완료. 출력의 출처(source)가 캐시인지 새 생성인지 함께 기록됩니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageCompleted(RunId runId, long sequence, Instant occurredAt, StageId stageId, int attempt,
                             StageOutput output) implements RunEvent {

    public StageCompleted {
        Events.requireHeader(runId, sequence, occurredAt);
        Events.requireStage(stageId, attempt);
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
    }

    @Override
    public EventType type() {
        return EventType.STAGE_COMPLETED;
    }
}

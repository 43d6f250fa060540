package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.state.StageError;

import java.time.Instant;

/**
 * Stage 시도 실패 후 재시도 예약.
 *
 * @param attempt 실패한 시도 번호
 * @param delayMs 다음 시도까지 대기 시간 (밀리초)
 * @param error 실패 원인
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageRetried(RunId runId, long sequence, Instant occurredAt, StageId stageId, int attempt,
                           long delayMs, StageError error) implements RunEvent {

    public StageRetried {
        Events.requireHeader(runId, sequence, occurredAt);
        Events.requireStage(stageId, attempt);
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be non-negative (current: " + delayMs + ")");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    @Override
    public EventType type() {
        return EventType.STAGE_RETRIED;
    }
}

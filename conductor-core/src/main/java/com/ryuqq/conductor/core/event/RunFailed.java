package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.state.StageError;

import java.time.Instant;
import java.util.List;

/**
 * Run 최종 실패.
 *
 * @param reason 실패 사유
 * @param errors 실패까지 누적된 Stage 오류 체인
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunFailed(RunId runId, long sequence, Instant occurredAt, String reason, List<StageError> errors)
    implements RunEvent {

    public RunFailed {
        Events.requireHeader(runId, sequence, occurredAt);
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    @Override
    public EventType type() {
        return EventType.RUN_FAILED;
    }
}

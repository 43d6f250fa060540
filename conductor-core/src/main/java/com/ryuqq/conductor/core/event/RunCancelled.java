package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;

import java.time.Instant;
import java.util.List;

/**
 * Run 취소.
 *
 * @param inFlight 취소 요청 시점에 진행 중이던 Stage 목록
 * @param reason 취소 사유 (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunCancelled(RunId runId, long sequence, Instant occurredAt, List<StageId> inFlight, String reason)
    implements RunEvent {

    public RunCancelled {
        Events.requireHeader(runId, sequence, occurredAt);
        inFlight = inFlight == null ? List.of() : List.copyOf(inFlight);
    }

    @Override
    public EventType type() {
        return EventType.RUN_CANCELLED;
    }
}

package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.state.RunState;

import java.time.Instant;

/**
 * 직전 시퀀스까지 접힌 Run 상태의 스냅샷.
 *
 * <p>재생 시 가장 가까운 스냅샷에서 시작해 이후 이벤트만 접으면 되므로
 * 재생 비용이 Run의 나이와 무관하게 스냅샷 간격으로 제한됩니다.</p>
 *
 * @param state {@code sequence - 1}까지 접힌 상태
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StateSnapshot(RunId runId, long sequence, Instant occurredAt, RunState state) implements RunEvent {

    public StateSnapshot {
        Events.requireHeader(runId, sequence, occurredAt);
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (state.lastSequence() != sequence - 1) {
            throw new IllegalArgumentException(
                "snapshot state must be folded up to the previous sequence (sequence: " + sequence
                    + ", state: " + state.lastSequence() + ")"
            );
        }
    }

    @Override
    public EventType type() {
        return EventType.STATE_SNAPSHOT;
    }
}

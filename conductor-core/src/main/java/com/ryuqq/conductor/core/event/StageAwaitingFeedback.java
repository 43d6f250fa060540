package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.model.TokenUsage;

import java.time.Instant;
import java.util.List;

/**
 * 후보 생성 완료, 사용자 선택 대기 시작.
 *
 * @param candidates 사용자에게 제시할 후보 (1개 이상)
 * @param tokenUsage 후보 생성에 사용한 토큰
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageAwaitingFeedback(RunId runId, long sequence, Instant occurredAt, StageId stageId, int attempt,
                                    List<String> candidates, TokenUsage tokenUsage) implements RunEvent {

    public StageAwaitingFeedback {
        Events.requireHeader(runId, sequence, occurredAt);
        Events.requireStage(stageId, attempt);
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("candidates cannot be null or empty");
        }
        candidates = List.copyOf(candidates);
        tokenUsage = tokenUsage == null ? TokenUsage.zero() : tokenUsage;
    }

    @Override
    public EventType type() {
        return EventType.STAGE_AWAITING_FEEDBACK;
    }
}

package com.ryuqq.conductor.core.outcome;

import com.ryuqq.conductor.core.model.TokenUsage;

import java.util.List;

/**
 * 사용자 선택 대기.
 *
 * @param candidates 선택 후보 (1개 이상)
 * @param tokenUsage 후보 생성에 쓴 토큰 사용량
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AwaitFeedback(List<String> candidates, TokenUsage tokenUsage) implements StageOutcome {

    public AwaitFeedback {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("candidates cannot be null or empty");
        }
        candidates = List.copyOf(candidates);
        tokenUsage = tokenUsage == null ? TokenUsage.zero() : tokenUsage;
    }
}

package com.ryuqq.conductor.core.model;

/**
 * 생성 호출의 토큰 사용량.
 *
 * @param promptTokens 프롬프트 토큰 수 (0 이상)
 * @param completionTokens 생성 토큰 수 (0 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TokenUsage(long promptTokens, long completionTokens) {

    private static final TokenUsage ZERO = new TokenUsage(0, 0);

    public TokenUsage {
        if (promptTokens < 0) {
            throw new IllegalArgumentException("promptTokens must be non-negative (current: " + promptTokens + ")");
        }
        if (completionTokens < 0) {
            throw new IllegalArgumentException("completionTokens must be non-negative (current: " + completionTokens + ")");
        }
    }

    /**
     * 사용량 없음.
     *
     * @return 0/0 TokenUsage
     */
    public static TokenUsage zero() {
        return ZERO;
    }

    /**
     * 전체 토큰 수.
     *
     * @return promptTokens + completionTokens
     */
    public long total() {
        return promptTokens + completionTokens;
    }

    /**
     * 두 사용량의 합.
     *
     * @param other 더할 사용량
     * @return 합산된 새 TokenUsage
     */
    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return new TokenUsage(promptTokens + other.promptTokens, completionTokens + other.completionTokens);
    }
}

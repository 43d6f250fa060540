package com.ryuqq.conductor.core.state;

import com.ryuqq.conductor.core.cache.CacheKey;
import com.ryuqq.conductor.core.model.TokenUsage;

/**
 * 완료된 Stage의 출력.
 *
 * @param text 출력 텍스트
 * @param source 출처 (FRESH, CACHE, FEEDBACK, TRANSFORM)
 * @param model 사용한 모델 (생성 Stage가 아니면 null)
 * @param cacheKey 캐시 키 (캐시 대상이 아니면 null)
 * @param tokenUsage 토큰 사용량
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageOutput(String text, OutputSource source, String model, CacheKey cacheKey, TokenUsage tokenUsage) {

    public StageOutput {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        tokenUsage = tokenUsage == null ? TokenUsage.zero() : tokenUsage;
    }

    public static StageOutput fresh(String text, String model, CacheKey cacheKey, TokenUsage usage) {
        return new StageOutput(text, OutputSource.FRESH, model, cacheKey, usage);
    }

    public static StageOutput cached(String text, String model, CacheKey cacheKey, TokenUsage usage) {
        return new StageOutput(text, OutputSource.CACHE, model, cacheKey, usage);
    }

    public static StageOutput feedback(String text) {
        return new StageOutput(text, OutputSource.FEEDBACK, null, null, TokenUsage.zero());
    }

    public static StageOutput transformed(String text) {
        return new StageOutput(text, OutputSource.TRANSFORM, null, null, TokenUsage.zero());
    }
}

package com.ryuqq.conductor.core.cache;

import com.ryuqq.conductor.core.model.ScopeId;
import com.ryuqq.conductor.core.model.TokenUsage;

import java.time.Duration;
import java.time.Instant;

/**
 * 응답 캐시 항목 (불변).
 *
 * <p>덮어쓰기는 항목 전체를 교체하며, 부분 수정은 없습니다.
 * 접근 시각/횟수 갱신도 새 인스턴스를 만듭니다.</p>
 *
 * @param key 캐시 키
 * @param scope 격리 범위
 * @param text 생성된 텍스트
 * @param model 생성에 사용된 모델
 * @param tokenUsage 토큰 사용량
 * @param createdAt 생성 시각
 * @param lastAccessedAt 마지막 접근 시각
 * @param accessCount 접근 횟수
 * @param expiresAt 만료 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CacheEntry(
    CacheKey key,
    ScopeId scope,
    String text,
    String model,
    TokenUsage tokenUsage,
    Instant createdAt,
    Instant lastAccessedAt,
    long accessCount,
    Instant expiresAt
) {

    public CacheEntry {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (createdAt == null || lastAccessedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("timestamps cannot be null");
        }
        if (accessCount < 0) {
            throw new IllegalArgumentException("accessCount must be non-negative (current: " + accessCount + ")");
        }
        tokenUsage = tokenUsage == null ? TokenUsage.zero() : tokenUsage;
    }

    /**
     * 새 항목 생성.
     *
     * @param key 캐시 키
     * @param scope 격리 범위
     * @param text 텍스트
     * @param model 모델
     * @param usage 토큰 사용량
     * @param now 현재 시각
     * @param ttl 유효 기간
     * @return CacheEntry
     */
    public static CacheEntry create(CacheKey key, ScopeId scope, String text, String model, TokenUsage usage,
                                    Instant now, Duration ttl) {
        return new CacheEntry(key, scope, text, model, usage, now, now, 0, now.plus(ttl));
    }

    /**
     * 만료 여부.
     *
     * @param now 현재 시각
     * @return now가 expiresAt 이상이면 true
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * 접근 기록을 갱신한 새 항목.
     *
     * @param now 접근 시각
     * @return 갱신된 CacheEntry
     */
    public CacheEntry touched(Instant now) {
        return new CacheEntry(key, scope, text, model, tokenUsage, createdAt, now, accessCount + 1, expiresAt);
    }

    /**
     * 만료 시각만 바꾼 새 항목.
     *
     * @param expiresAt 새 만료 시각
     * @return CacheEntry
     */
    public CacheEntry expiringAt(Instant expiresAt) {
        return new CacheEntry(key, scope, text, model, tokenUsage, createdAt, lastAccessedAt, accessCount, expiresAt);
    }
}

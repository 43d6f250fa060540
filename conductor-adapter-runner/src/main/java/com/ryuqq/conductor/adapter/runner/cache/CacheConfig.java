package com.ryuqq.conductor.adapter.runner.cache;

import java.time.Duration;

/**
 * 응답 캐시 설정 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param memoryCapacity 1계층(메모리) 최대 항목 수 (1 이상)
 * @param ttl 항목 유효 기간 (양수)
 * @param enabled false이면 조회는 항상 miss, 저장은 무시
 */
public record CacheConfig(int memoryCapacity, Duration ttl, boolean enabled) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: memoryCapacity=1000, ttl=24h, enabled=true</p>
     */
    public CacheConfig() {
        this(1000, Duration.ofHours(24), true);
    }

    public CacheConfig {
        if (memoryCapacity <= 0) {
            throw new IllegalArgumentException(
                "memoryCapacity must be positive (current: " + memoryCapacity + ")"
            );
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
    }

    public CacheConfig withMemoryCapacity(int memoryCapacity) {
        return new CacheConfig(memoryCapacity, ttl, enabled);
    }

    public CacheConfig withTtl(Duration ttl) {
        return new CacheConfig(memoryCapacity, ttl, enabled);
    }

    public CacheConfig withEnabled(boolean enabled) {
        return new CacheConfig(memoryCapacity, ttl, enabled);
    }
}

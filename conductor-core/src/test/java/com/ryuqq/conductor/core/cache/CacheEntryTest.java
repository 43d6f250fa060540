package com.ryuqq.conductor.core.cache;

import com.ryuqq.conductor.core.model.ScopeId;
import com.ryuqq.conductor.core.model.TokenUsage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CacheEntry 테스트")
class CacheEntryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    @DisplayName("TTL이 지나면 만료된다")
    void isExpiredAt_afterTtl() {
        // given
        ScopeId scope = ScopeId.of("ws");
        CacheEntry entry = CacheEntry.create(CacheKey.derive("p", "m", null, scope), scope, "text", "m",
            TokenUsage.zero(), NOW, Duration.ofHours(24));

        // when & then
        assertThat(entry.isExpiredAt(NOW.plus(Duration.ofHours(23)))).isFalse();
        assertThat(entry.isExpiredAt(NOW.plus(Duration.ofHours(24)))).isTrue();
    }

    @Test
    @DisplayName("touched()는 접근 기록만 갱신한 새 항목을 만든다")
    void touched_updatesAccessOnly() {
        // given
        ScopeId scope = ScopeId.of("ws");
        CacheEntry entry = CacheEntry.create(CacheKey.derive("p", "m", null, scope), scope, "text", "m",
            new TokenUsage(1, 2), NOW, Duration.ofMinutes(5));

        // when
        CacheEntry touched = entry.touched(NOW.plusSeconds(30));

        // then
        assertThat(touched.accessCount()).isEqualTo(1);
        assertThat(touched.lastAccessedAt()).isEqualTo(NOW.plusSeconds(30));
        assertThat(touched.createdAt()).isEqualTo(entry.createdAt());
        assertThat(touched.expiresAt()).isEqualTo(entry.expiresAt());
        assertThat(entry.accessCount()).isZero();
    }
}

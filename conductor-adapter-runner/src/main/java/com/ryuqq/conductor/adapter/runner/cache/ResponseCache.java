package com.ryuqq.conductor.adapter.runner.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.ryuqq.conductor.core.cache.CacheEntry;
import com.ryuqq.conductor.core.cache.CacheKey;
import com.ryuqq.conductor.core.cache.CacheStats;
import com.ryuqq.conductor.core.model.ScopeId;
import com.ryuqq.conductor.core.model.TokenUsage;
import com.ryuqq.conductor.core.spi.CacheBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 2계층 응답 캐시.
 *
 * <p><strong>계층:</strong></p>
 * <ul>
 *   <li>Tier 1: Caffeine 메모리 캐시 (용량 제한, 빈도/최근성 기반 축출)</li>
 *   <li>Tier 2: {@link CacheBackend} (선택, 재시작 후에도 유지)</li>
 * </ul>
 *
 * <p><strong>조회 흐름:</strong></p>
 * <pre>
 * lookup(key)
 *   ↓
 * Tier 1 적중 (만료 아님) → 반환
 *   ↓
 * Tier 2 적중 (만료 아님) → Tier 1로 승격 후 반환
 *   ↓
 * miss
 * </pre>
 *
 * <p><strong>일관성:</strong></p>
 * <ul>
 *   <li>저장은 Tier 1에 동기로, Tier 2에 비동기로 기록</li>
 *   <li>무효화는 두 계층 모두에서 동기로 제거하며, 무효화 이전에 시작된
 *       Tier 2 쓰기는 세대(epoch) 표식으로 걸러짐</li>
 *   <li>Tier 2 장애는 경고 로그와 통계만 남기고 miss로 처리</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final CacheConfig config;
    private final CacheBackend backend;
    private final Executor tier2Executor;
    private final Clock clock;
    private final Cache<CacheKey, CacheEntry> memory;

    private final ReadWriteLock invalidationLock = new ReentrantReadWriteLock();
    private final AtomicLong epoch = new AtomicLong();
    private final Map<CacheKey, Long> keyTombstones = new ConcurrentHashMap<>();
    private final Map<ScopeId, Long> scopeTombstones = new ConcurrentHashMap<>();
    private final AtomicInteger pendingWrites = new AtomicInteger();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong tier2Hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong tier2Errors = new AtomicLong();

    /**
     * 생성자.
     *
     * @param config 캐시 설정
     * @param backend Tier 2 저장소 (nullable, null이면 메모리만 사용)
     * @param tier2Executor Tier 2 쓰기 실행자
     * @param clock 만료 판정 시각
     * @throws IllegalArgumentException 필수 의존성이 null인 경우
     */
    public ResponseCache(CacheConfig config, CacheBackend backend, Executor tier2Executor, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (tier2Executor == null) {
            throw new IllegalArgumentException("tier2Executor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.backend = backend;
        this.tier2Executor = tier2Executor;
        this.clock = clock;
        this.memory = Caffeine.newBuilder()
            .maximumSize(config.memoryCapacity())
            .executor(Runnable::run)
            .<CacheKey, CacheEntry>evictionListener((key, value, cause) -> {
                if (cause == RemovalCause.SIZE) {
                    evictions.incrementAndGet();
                }
            })
            .build();
    }

    /**
     * 캐시 조회.
     *
     * @param key 캐시 키
     * @return 살아 있는 항목 (접근 기록 갱신됨), 없거나 비활성화되어 있으면 empty
     */
    public Optional<CacheEntry> lookup(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (!config.enabled()) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        CacheEntry fromMemory = memory.asMap().computeIfPresent(key,
            (k, entry) -> entry.isExpiredAt(now) ? null : entry.touched(now));
        if (fromMemory != null) {
            hits.incrementAndGet();
            return Optional.of(fromMemory);
        }

        if (backend != null) {
            invalidationLock.readLock().lock();
            try {
                Optional<CacheEntry> fromBackend = readBackend(key, now);
                if (fromBackend.isPresent()) {
                    CacheEntry promoted = fromBackend.get().touched(now);
                    memory.put(key, promoted);
                    hits.incrementAndGet();
                    tier2Hits.incrementAndGet();
                    return Optional.of(promoted);
                }
            } finally {
                invalidationLock.readLock().unlock();
            }
        }

        misses.incrementAndGet();
        return Optional.empty();
    }

    /**
     * 생성 결과 저장.
     *
     * <p>Tier 1에는 즉시 기록하고, Tier 2 기록은 실행자에 맡깁니다.</p>
     *
     * @return 저장된 항목 (비활성화되어 있으면 empty)
     */
    public Optional<CacheEntry> store(CacheKey key, ScopeId scope, String text, String model, TokenUsage usage) {
        if (!config.enabled()) {
            return Optional.empty();
        }
        CacheEntry entry = CacheEntry.create(key, scope, text, model, usage, clock.instant(), config.ttl());

        long writeEpoch;
        invalidationLock.readLock().lock();
        try {
            writeEpoch = epoch.get();
            memory.put(key, entry);
            if (backend != null) {
                pendingWrites.incrementAndGet();
            }
        } finally {
            invalidationLock.readLock().unlock();
        }

        if (backend != null) {
            try {
                tier2Executor.execute(() -> writeBackend(entry, writeEpoch));
            } catch (RejectedExecutionException e) {
                pendingWrites.decrementAndGet();
                log.warn("Tier 2 write of {} rejected; entry kept in memory only", key);
            }
        }
        return Optional.of(entry);
    }

    /**
     * 항목 하나를 두 계층에서 제거.
     *
     * <p>반환 이후의 조회는 제거 이전 값을 돌려주지 않습니다.</p>
     *
     * @param key 캐시 키
     */
    public void invalidate(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        invalidationLock.writeLock().lock();
        try {
            keyTombstones.put(key, epoch.incrementAndGet());
            memory.invalidate(key);
            if (backend != null) {
                try {
                    backend.invalidate(key);
                } catch (RuntimeException e) {
                    tier2Errors.incrementAndGet();
                    log.warn("Tier 2 invalidation of {} failed", key, e);
                }
            }
        } finally {
            invalidationLock.writeLock().unlock();
        }
        log.debug("Cache entry {} invalidated", key);
    }

    /**
     * 격리 범위 전체를 두 계층에서 제거.
     *
     * @param scope 격리 범위
     */
    public void invalidateScope(ScopeId scope) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        int removed = 0;
        invalidationLock.writeLock().lock();
        try {
            scopeTombstones.put(scope, epoch.incrementAndGet());
            Iterator<CacheEntry> iterator = memory.asMap().values().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().scope().equals(scope)) {
                    iterator.remove();
                    removed++;
                }
            }
            if (backend != null) {
                try {
                    backend.invalidateScope(scope);
                } catch (RuntimeException e) {
                    tier2Errors.incrementAndGet();
                    log.warn("Tier 2 invalidation of scope {} failed", scope, e);
                }
            }
        } finally {
            invalidationLock.writeLock().unlock();
        }
        log.info("Cache scope {} invalidated: {} entries removed from memory", scope, removed);
    }

    /**
     * Tier 1의 만료 항목 정리.
     *
     * @return 제거된 항목 수
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<CacheKey, CacheEntry> entry : memory.asMap().entrySet()) {
            if (entry.getValue().isExpiredAt(now) && memory.asMap().remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Cache cleanup removed {} expired entries", removed);
        }
        return removed;
    }

    public CacheStats stats() {
        memory.cleanUp();
        return new CacheStats(hits.get(), tier2Hits.get(), misses.get(), evictions.get(), tier2Errors.get(),
            memory.estimatedSize());
    }

    /**
     * 아직 끝나지 않은 Tier 2 쓰기 수.
     */
    public int pendingTier2Writes() {
        return pendingWrites.get();
    }

    public CacheConfig config() {
        return config;
    }

    private Optional<CacheEntry> readBackend(CacheKey key, Instant now) {
        try {
            Optional<CacheEntry> entry = backend.get(key);
            if (entry.isPresent() && entry.get().isExpiredAt(now)) {
                return Optional.empty();
            }
            return entry;
        } catch (RuntimeException e) {
            tier2Errors.incrementAndGet();
            log.warn("Tier 2 read of {} failed; treating as miss", key, e);
            return Optional.empty();
        }
    }

    private void writeBackend(CacheEntry entry, long writeEpoch) {
        try {
            invalidationLock.readLock().lock();
            try {
                if (isInvalidatedSince(entry, writeEpoch)) {
                    log.debug("Tier 2 write of {} dropped after invalidation", entry.key());
                    return;
                }
                Duration ttl = Duration.between(clock.instant(), entry.expiresAt());
                if (ttl.isZero() || ttl.isNegative()) {
                    return;
                }
                backend.put(entry, ttl);
            } finally {
                invalidationLock.readLock().unlock();
            }
        } catch (RuntimeException e) {
            tier2Errors.incrementAndGet();
            log.warn("Tier 2 write of {} failed; entry kept in memory only", entry.key(), e);
        } finally {
            if (pendingWrites.decrementAndGet() == 0) {
                pruneTombstones();
            }
        }
    }

    private boolean isInvalidatedSince(CacheEntry entry, long writeEpoch) {
        Long keyEpoch = keyTombstones.get(entry.key());
        Long scopeEpoch = scopeTombstones.get(entry.scope());
        return (keyEpoch != null && keyEpoch > writeEpoch) || (scopeEpoch != null && scopeEpoch > writeEpoch);
    }

    private void pruneTombstones() {
        if (!invalidationLock.writeLock().tryLock()) {
            return;
        }
        try {
            if (pendingWrites.get() == 0) {
                keyTombstones.clear();
                scopeTombstones.clear();
            }
        } finally {
            invalidationLock.writeLock().unlock();
        }
    }
}

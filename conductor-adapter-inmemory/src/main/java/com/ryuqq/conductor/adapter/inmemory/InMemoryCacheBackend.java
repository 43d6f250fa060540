package com.ryuqq.conductor.adapter.inmemory;

import com.ryuqq.conductor.core.cache.CacheEntry;
import com.ryuqq.conductor.core.cache.CacheKey;
import com.ryuqq.conductor.core.model.ScopeId;
import com.ryuqq.conductor.core.spi.CacheBackend;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CacheBackend} SPI.
 *
 * <p>Stands in for a persistent second tier in tests. Expiry is evaluated lazily
 * on {@link #get} against the injected {@link Clock}.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Unbounded: expired entries stay until read or invalidated</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryCacheBackend implements CacheBackend {

    private final ConcurrentHashMap<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheBackend() {
        this(Clock.systemUTC());
    }

    public InMemoryCacheBackend(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * {@inheritDoc}
     *
     * <p>The stored expiry is {@code clock.now + ttl}, regardless of the entry's own expiry.</p>
     */
    @Override
    public void put(CacheEntry entry, Duration ttl) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        Instant expiresAt = clock.instant().plus(ttl);
        entries.put(entry.key(), entry.expiringAt(expiresAt));
    }

    @Override
    public void invalidate(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        entries.remove(key);
    }

    @Override
    public void invalidateScope(ScopeId scope) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        entries.values().removeIf(entry -> scope.equals(entry.scope()));
    }

    /**
     * Number of stored entries, expired ones included.
     *
     * @return entry count
     */
    public int size() {
        return entries.size();
    }

    /**
     * Removes every entry.
     */
    public void clear() {
        entries.clear();
    }
}

package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.cache.CacheEntry;
import com.ryuqq.conductor.core.cache.CacheKey;
import com.ryuqq.conductor.core.model.ScopeId;

import java.time.Duration;
import java.util.Optional;

/**
 * Persistent Cache Backend SPI (tier 2 of the response cache).
 *
 * <p>Every method may throw {@link com.ryuqq.conductor.core.exception.CacheBackendException}.
 * The response cache catches it, logs it and keeps serving from memory.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Expired entries are never returned from {@link #get}</li>
 *   <li>{@link #put} replaces any existing entry wholesale</li>
 *   <li>Thread-safe for concurrent access to distinct and identical keys</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CacheBackend {

    /**
     * Reads a live entry.
     *
     * @param key cache key
     * @return entry, or empty if absent or expired
     */
    Optional<CacheEntry> get(CacheKey key);

    /**
     * Stores an entry.
     *
     * @param entry entry to store
     * @param ttl time to live from now
     */
    void put(CacheEntry entry, Duration ttl);

    /**
     * Removes one entry.
     *
     * @param key cache key
     */
    void invalidate(CacheKey key);

    /**
     * Removes every entry of an isolation scope.
     *
     * @param scope isolation scope
     */
    void invalidateScope(ScopeId scope);
}

/**
 * Two-tier response cache.
 *
 * <p>Tier 1 is a bounded Caffeine cache; tier 2 is an optional
 * {@link com.ryuqq.conductor.core.spi.CacheBackend}. Tier 2 failures degrade to memory-only
 * operation and are reported through {@link com.ryuqq.conductor.core.cache.CacheStats}.</p>
 */
package com.ryuqq.conductor.adapter.runner.cache;

/**
 * Cache key derivation and cache entry value type.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.cache;

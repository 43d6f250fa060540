/**
 * In-memory adapters for the orchestrator SPIs.
 *
 * <p>Reference implementations used by Contract Tests, by the runner's own tests
 * and by embedders that do not need durability.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.adapter.inmemory.InMemoryEventSink}:
 *       per-run append-only lists implementing {@link com.ryuqq.conductor.core.spi.EventSink}</li>
 *   <li>{@link com.ryuqq.conductor.adapter.inmemory.InMemoryCacheBackend}:
 *       clock-driven implementation of {@link com.ryuqq.conductor.core.spi.CacheBackend}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @see com.ryuqq.conductor.core.spi.EventSink
 * @see com.ryuqq.conductor.core.spi.CacheBackend
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.adapter.inmemory;

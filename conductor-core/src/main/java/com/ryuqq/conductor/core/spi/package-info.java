/**
 * Service Provider Interfaces consumed by the orchestrator.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.spi.GenerationCapability} - external streamed text generation</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.EventSink} - durable, append-only run event log</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.CacheBackend} - persistent response cache tier</li>
 * </ul>
 *
 * <h2>Supporting Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.spi.GenerationResult} - terminal generation result</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.StreamCallback} - partial chunk receiver</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.CancellationToken} - cooperative cancellation</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <p>In-memory implementations live in {@code conductor-adapter-inmemory}, durable file
 * implementations in {@code conductor-adapter-file}. Both are verified by the abstract
 * contract tests in {@code conductor-testkit}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.spi;

/**
 * Exception taxonomy.
 *
 * <h2>Error Classes</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.exception.TemplateValidationException} - bad template or graph at load, run never starts</li>
 *   <li>{@link com.ryuqq.conductor.core.exception.InputValidationException} - missing or invalid run inputs</li>
 *   <li>{@link com.ryuqq.conductor.core.exception.StageExecutionException} - generation capability failure, retried per policy</li>
 *   <li>{@link com.ryuqq.conductor.core.exception.CacheBackendException} - persistent cache tier unavailable, degrades to memory</li>
 *   <li>{@link com.ryuqq.conductor.core.exception.EventSinkException} - durability failure, fatal to the run</li>
 * </ul>
 *
 * <p>An upstream required stage failing is not an exception: it is recorded as a
 * {@code StageSkipped} event with reason {@code UPSTREAM_FAILED} and never retried.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.exception;

/**
 * Stage dependency graph: validation, analysis and runtime resolution.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.graph.TemplateValidator} - structural validation at template load</li>
 *   <li>{@link com.ryuqq.conductor.core.graph.DependencyGraph} - topological order, execution groups, critical path</li>
 *   <li>{@link com.ryuqq.conductor.core.graph.DependencyResolver} - runnable / skipped stages for a run state</li>
 * </ul>
 *
 * <h2>Tie-break</h2>
 * <p>Simultaneously eligible stages are ordered by template declaration order. The
 * concurrency limit truncates that order, so serialization always falls back to it.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.graph;

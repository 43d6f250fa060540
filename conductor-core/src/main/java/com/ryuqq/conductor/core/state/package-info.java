/**
 * Derived run state and the pure projector that folds events into it.
 *
 * <p>{@link com.ryuqq.conductor.core.state.RunState} is never mutated by the runtime. The
 * {@link com.ryuqq.conductor.core.state.RunStateProjector} is the only producer of new states.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.state;

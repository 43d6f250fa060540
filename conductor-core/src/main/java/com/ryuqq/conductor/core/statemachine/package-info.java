/**
 * Run and stage state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.statemachine.RunStatus} - Run lifecycle states</li>
 *   <li>{@link com.ryuqq.conductor.core.statemachine.StageStatus} - Stage execution states</li>
 *   <li>{@link com.ryuqq.conductor.core.statemachine.RunTransition} - Run transition validation</li>
 *   <li>{@link com.ryuqq.conductor.core.statemachine.StageTransition} - Stage transition validation</li>
 * </ul>
 *
 * <h2>Run Transitions</h2>
 * <pre>
 * PENDING → RUNNING ⇄ PAUSED
 * RUNNING → COMPLETED | FAILED | CANCELLED
 * </pre>
 *
 * <h2>Stage Transitions</h2>
 * <pre>
 * WAITING → RUNNING → COMPLETED | FAILED | AWAITING_FEEDBACK
 * FAILED → RUNNING (retry)
 * WAITING → SKIPPED
 * </pre>
 *
 * <p>Transitions are never applied directly by the runtime. They are validated
 * inside the pure projector while folding events.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.statemachine;

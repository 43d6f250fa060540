/**
 * Stage attempt outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for the result of a single
 * stage attempt. The run loop maps each outcome onto exactly one event.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.outcome.Ok} - completed with output (StageCompleted)</li>
 *   <li>{@link com.ryuqq.conductor.core.outcome.Retry} - temporary failure (StageRetried or StageFailed)</li>
 *   <li>{@link com.ryuqq.conductor.core.outcome.Fail} - permanent failure (StageFailed)</li>
 *   <li>{@link com.ryuqq.conductor.core.outcome.AwaitFeedback} - candidates produced (StageAwaitingFeedback)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.outcome;

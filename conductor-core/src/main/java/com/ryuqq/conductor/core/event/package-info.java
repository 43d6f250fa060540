/**
 * Run event model.
 *
 * <p>{@link com.ryuqq.conductor.core.event.RunEvent} is a sealed interface over immutable
 * records. Every event carries a run-scoped, contiguous sequence number starting at 1.
 * A branched run starts its own log at {@code branchSequence + 1} with a
 * {@link com.ryuqq.conductor.core.event.RunCreated} that points at its parent.</p>
 *
 * <h2>Event Types</h2>
 * <ul>
 *   <li>Run lifecycle: RunCreated, RunStarted, RunPaused, RunResumed, RunCompleted, RunFailed, RunCancelled</li>
 *   <li>Stage lifecycle: StageStarted, StageCompleted, StageFailed, StageRetried, StageSkipped</li>
 *   <li>Human feedback: StageAwaitingFeedback, UserFeedbackRecorded</li>
 *   <li>Replay bound: StateSnapshot</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.event;

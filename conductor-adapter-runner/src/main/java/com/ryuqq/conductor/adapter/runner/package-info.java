/**
 * Run execution runtime.
 *
 * <p>{@link com.ryuqq.conductor.adapter.runner.DefaultOrchestrator} is the composition root: it owns
 * the template registry, the run registry and one {@code RunLoop} per active run. Each loop is the
 * single writer of its run's event log; external generation calls run asynchronously and report back
 * to the loop as signals.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.DefaultOrchestrator}: control surface</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.RunRecoverer}: restart recovery scan</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.BackoffCalculator}: retry delays</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.SingleFlightGuard}: one in-flight call per attempt</li>
 *   <li>{@link com.ryuqq.conductor.adapter.runner.EventBroadcaster}: ordered, de-duplicated subscriptions</li>
 * </ul>
 */
package com.ryuqq.conductor.adapter.runner;

/**
 * Abstract contract tests for the orchestrator SPIs.
 *
 * <h2>Contracts</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.testkit.contract.AbstractEventSinkContractTest} - event sink ordering, contiguity, snapshots, branches</li>
 *   <li>{@link com.ryuqq.conductor.testkit.contract.AbstractCacheBackendContractTest} - cache backend round trip, TTL, invalidation</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * class InMemoryEventSinkContractTest extends AbstractEventSinkContractTest {
 *     {@literal @}Override
 *     protected EventSink createSink() {
 *         return new InMemoryEventSink();
 *     }
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.testkit.contract;

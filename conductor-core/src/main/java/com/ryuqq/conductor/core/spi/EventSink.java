package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.event.StateSnapshot;
import com.ryuqq.conductor.core.model.RunId;

import java.util.List;
import java.util.Optional;

/**
 * Durable Event Sink SPI.
 *
 * <p>The event log of every run is the sole source of truth. Run state is always
 * derived by folding the events returned from this sink.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Append-only storage of immutable events, per run</li>
 *   <li>Ordered reads from a sequence number</li>
 *   <li>Fast lookup of the latest {@link StateSnapshot}</li>
 *   <li>Listing of known runs for recovery after a restart</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Durability: {@link #append} returns only after the event is durable</li>
 *   <li>Contiguity: an event whose sequence is not exactly one past the last stored
 *       sequence of the run must be rejected</li>
 *   <li>Thread-safe: appends for different runs may happen concurrently; appends for
 *       one run are serialized by the caller</li>
 *   <li>Partial writes: an undeserializable trailing event is treated as absent</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventSink {

    /**
     * Durably appends one event to the run's log.
     *
     * <p>A branched run's log starts at {@code branchSequence + 1}; its first append
     * must be the branched {@code RunCreated} with that sequence.</p>
     *
     * @param runId the run
     * @param event the next event
     * @throws IllegalArgumentException if runId or event is null, or the event belongs to another run
     * @throws com.ryuqq.conductor.core.exception.EventSinkException if the sequence is not contiguous
     *         or the write could not be made durable
     */
    void append(RunId runId, RunEvent event);

    /**
     * Reads the run's own events with {@code sequence >= fromSequence}, in order.
     *
     * @param runId the run
     * @param fromSequence first sequence to return (1 or more)
     * @return ordered, finite list (empty for unknown runs)
     * @throws com.ryuqq.conductor.core.exception.EventSinkException if the log cannot be read
     */
    List<RunEvent> readFrom(RunId runId, long fromSequence);

    /**
     * Reads the latest snapshot stored in the run's own log.
     *
     * @param runId the run
     * @return latest snapshot, or empty if none
     * @throws com.ryuqq.conductor.core.exception.EventSinkException if the log cannot be read
     */
    Optional<StateSnapshot> readLatestSnapshot(RunId runId);

    /**
     * Lists every run with at least one stored event.
     *
     * @return run ids, in no particular order
     */
    List<RunId> runIds();
}

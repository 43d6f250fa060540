package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.event.RunCreated;
import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.exception.EventSinkException;
import com.ryuqq.conductor.core.model.RunId;

/**
 * Append rules shared by {@link EventSink} implementations.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventSequencing {

    private EventSequencing() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Verifies that {@code event} may be appended to the run's log.
     *
     * @param runId target run
     * @param event event to append
     * @param lastStoredSequence last stored sequence, or 0 if the log is empty
     * @throws IllegalArgumentException if an argument is null or the event belongs to another run
     * @throws EventSinkException if the sequence does not continue the log
     */
    public static void checkAppend(RunId runId, RunEvent event, long lastStoredSequence) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (!runId.equals(event.runId())) {
            throw new IllegalArgumentException(
                "Event of run " + event.runId() + " cannot be appended to run " + runId
            );
        }

        if (lastStoredSequence == 0) {
            if (!(event instanceof RunCreated)) {
                throw new EventSinkException(String.format(
                    "Log of run %s must start with RunCreated (got %s at %d)",
                    runId.getValue(), event.type(), event.sequence()));
            }
            // RunCreated already sits at 1 or right after its branch point
            return;
        }
        if (event.sequence() != lastStoredSequence + 1) {
            throw new EventSinkException(String.format(
                "Non-contiguous append to run %s: expected %d, got %d",
                runId.getValue(), lastStoredSequence + 1, event.sequence()));
        }
    }
}

package com.ryuqq.conductor.adapter.inmemory;

import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.event.StateSnapshot;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.spi.EventSequencing;
import com.ryuqq.conductor.core.spi.EventSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link EventSink} SPI for testing and reference purposes.
 *
 * <p>Each run owns an append-only list guarded by its own monitor, so appends to
 * different runs never contend. The latest snapshot is tracked next to the list
 * for O(1) lookup.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EventSink sink = new InMemoryEventSink();
 * Orchestrator orchestrator = DefaultOrchestrator.builder()
 *     .eventSink(sink)
 *     .generation(generation)
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventSink implements EventSink {

    private final ConcurrentHashMap<RunId, RunLog> logs = new ConcurrentHashMap<>();

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Contiguity is checked under the run's monitor</li>
     *   <li>Rejected events leave the log unchanged</li>
     * </ul>
     */
    @Override
    public void append(RunId runId, RunEvent event) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        RunLog log = logs.computeIfAbsent(runId, id -> new RunLog());
        synchronized (log) {
            EventSequencing.checkAppend(runId, event, log.lastSequence());
            log.events.add(event);
            if (event instanceof StateSnapshot) {
                log.latestSnapshot = (StateSnapshot) event;
            }
        }
    }

    @Override
    public List<RunEvent> readFrom(RunId runId, long fromSequence) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        RunLog log = logs.get(runId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            List<RunEvent> result = new ArrayList<>();
            for (RunEvent event : log.events) {
                if (event.sequence() >= fromSequence) {
                    result.add(event);
                }
            }
            return result;
        }
    }

    @Override
    public Optional<StateSnapshot> readLatestSnapshot(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        RunLog log = logs.get(runId);
        if (log == null) {
            return Optional.empty();
        }
        synchronized (log) {
            return Optional.ofNullable(log.latestSnapshot);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Runs whose first append was rejected are not listed.</p>
     */
    @Override
    public List<RunId> runIds() {
        List<RunId> result = new ArrayList<>();
        logs.forEach((runId, log) -> {
            synchronized (log) {
                if (!log.events.isEmpty()) {
                    result.add(runId);
                }
            }
        });
        return result;
    }

    /**
     * Removes every stored log.
     */
    public void clear() {
        logs.clear();
    }

    private static final class RunLog {
        private final List<RunEvent> events = new ArrayList<>();
        private StateSnapshot latestSnapshot;

        private long lastSequence() {
            return events.isEmpty() ? 0 : events.get(events.size() - 1).sequence();
        }
    }
}

package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.event.StateSnapshot;
import com.ryuqq.conductor.core.exception.EventSinkException;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.spi.EventSink;
import com.ryuqq.conductor.core.state.RunState;
import com.ryuqq.conductor.core.state.RunStateProjector;
import com.ryuqq.conductor.testkit.support.EventFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test for {@link EventSink} implementations.
 *
 * <p>Every adapter subclasses this test and supplies a fresh sink. Adapters with
 * durable storage also override {@link #reopen()} so that the durability checks
 * read through a new instance over the same storage.</p>
 *
 * <p><strong>Verified Contract:</strong></p>
 * <ul>
 *   <li>Ordered reads from any sequence</li>
 *   <li>Rejection of non-contiguous, duplicate and foreign-run events</li>
 *   <li>Latest snapshot lookup</li>
 *   <li>Branched logs starting after the branch point</li>
 *   <li>Every event type survives storage unchanged</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractEventSinkContractTest {

    protected EventSink sink;

    /**
     * Creates a sink over empty storage.
     */
    protected abstract EventSink createSink() throws Exception;

    /**
     * Returns a sink over the same storage, as after a process restart.
     */
    protected EventSink reopen() throws Exception {
        return sink;
    }

    /**
     * Releases storage created by {@link #createSink()}.
     */
    protected void cleanup() throws Exception {
    }

    @BeforeEach
    void setUpSink() throws Exception {
        sink = createSink();
    }

    @AfterEach
    void tearDownSink() throws Exception {
        cleanup();
    }

    protected void appendAll(List<? extends RunEvent> events) {
        for (RunEvent event : events) {
            sink.append(event.runId(), event);
        }
    }

    // ========== Ordered reads ==========

    @Test
    void append_thenReadFrom_returnsEventsInOrder() {
        // given
        EventFixtures events = EventFixtures.forRun("run-order");
        List<RunEvent> log = List.of(events.created("a"), events.started(), events.stageStarted("a", 1),
            events.stageCompleted("a", 1, "done"), events.completed());

        // when
        appendAll(log);

        // then
        assertThat(sink.readFrom(events.runId(), 1)).containsExactlyElementsOf(log);
        assertThat(sink.readFrom(events.runId(), 3)).containsExactlyElementsOf(log.subList(2, 5));
        assertThat(sink.readFrom(events.runId(), 6)).isEmpty();
    }

    @Test
    void readFrom_unknownRun_returnsEmpty() {
        assertThat(sink.readFrom(RunId.of("nobody"), 1)).isEmpty();
        assertThat(sink.readLatestSnapshot(RunId.of("nobody"))).isEmpty();
    }

    @Test
    void everyEventType_survivesStorageUnchanged() throws Exception {
        // given
        List<RunEvent> log = EventFixtures.everyEventType("run-types");

        // when
        appendAll(log);
        EventSink reopened = reopen();

        // then
        List<RunEvent> read = reopened.readFrom(RunId.of("run-types"), 1);
        assertThat(read).containsExactlyElementsOf(log);
        assertThat(new RunStateProjector().replay(read)).isEqualTo(new RunStateProjector().replay(log));
    }

    // ========== Rejections ==========

    @Test
    void append_nonContiguousSequence_rejected() {
        // given
        EventFixtures events = EventFixtures.forRun("run-gap");
        sink.append(events.runId(), events.created("a"));
        events.started();
        RunEvent gap = events.stageStarted("a", 1);

        // when & then
        assertThatThrownBy(() -> sink.append(events.runId(), gap)).isInstanceOf(EventSinkException.class);
        assertThat(sink.readFrom(events.runId(), 1)).hasSize(1);
    }

    @Test
    void append_duplicateSequence_rejected() {
        // given
        EventFixtures events = EventFixtures.forRun("run-dup");
        RunEvent created = events.created("a");
        sink.append(events.runId(), created);

        // when & then
        assertThatThrownBy(() -> sink.append(events.runId(), created)).isInstanceOf(EventSinkException.class);
    }

    @Test
    void append_firstEventNotAtStart_rejected() {
        // given
        EventFixtures events = EventFixtures.forRun("run-late-start");
        events.created("a");
        RunEvent started = events.started();

        // when & then
        assertThatThrownBy(() -> sink.append(events.runId(), started)).isInstanceOf(EventSinkException.class);
    }

    @Test
    void append_eventOfAnotherRun_rejected() {
        // given
        RunEvent created = EventFixtures.forRun("run-a").created("a");

        // when & then
        assertThatThrownBy(() -> sink.append(RunId.of("run-b"), created)).isInstanceOf(IllegalArgumentException.class);
    }

    // ========== Snapshots ==========

    @Test
    void readLatestSnapshot_returnsMostRecent() {
        // given
        EventFixtures events = EventFixtures.forRun("run-snap");
        RunStateProjector projector = new RunStateProjector();
        List<RunEvent> log = new ArrayList<>();
        log.add(events.created("a", "b"));
        log.add(events.started());
        log.add(events.snapshot(projector.replay(log)));
        log.add(events.stageStarted("a", 1));
        log.add(events.stageCompleted("a", 1, "A"));
        StateSnapshot latest = events.snapshot(projector.replay(log));
        log.add(latest);
        log.add(events.stageStarted("b", 1));

        // when
        appendAll(log);
        Optional<StateSnapshot> snapshot = sink.readLatestSnapshot(events.runId());

        // then
        assertThat(snapshot).contains(latest);
        assertThat(snapshot.get().sequence()).isEqualTo(6);
    }

    @Test
    void readLatestSnapshot_noSnapshot_returnsEmpty() {
        // given
        EventFixtures events = EventFixtures.forRun("run-nosnap");
        appendAll(List.of(events.created("a"), events.started()));

        // when & then
        assertThat(sink.readLatestSnapshot(events.runId())).isEmpty();
    }

    // ========== Branches and listing ==========

    @Test
    void branchLog_startsAfterBranchPoint() {
        // given
        EventFixtures parent = EventFixtures.forRun("run-parent");
        appendAll(List.of(parent.created("a"), parent.started(), parent.stageStarted("a", 1)));
        EventFixtures child = EventFixtures.forBranch("run-child", 2);

        // when
        RunEvent branchCreated = child.branchCreated(parent.runId(), "a");
        RunEvent childStarted = child.started();
        appendAll(List.of(branchCreated, childStarted));

        // then
        assertThat(sink.readFrom(child.runId(), 1)).containsExactly(branchCreated, childStarted);
        assertThat(sink.readFrom(parent.runId(), 1)).hasSize(3);
    }

    @Test
    void runIds_listsEveryRunWithEvents() {
        // given
        appendAll(List.of(EventFixtures.forRun("run-x").created("a")));
        appendAll(List.of(EventFixtures.forRun("run-y").created("a")));

        // when & then
        assertThat(sink.runIds()).contains(RunId.of("run-x"), RunId.of("run-y"));
    }

    @Test
    void concurrentAppends_differentRuns_allStored() throws Exception {
        // given
        ExecutorService executor = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();

        // when
        try {
            for (int i = 0; i < 8; i++) {
                String runId = "run-concurrent-" + i;
                futures.add(executor.submit(() -> {
                    EventFixtures events = EventFixtures.forRun(runId);
                    appendAll(List.of(events.created("a"), events.started(), events.stageStarted("a", 1),
                        events.stageCompleted("a", 1, runId), events.completed()));
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        // then
        for (int i = 0; i < 8; i++) {
            RunState state = new RunStateProjector().replay(sink.readFrom(RunId.of("run-concurrent-" + i), 1));
            assertThat(state.isTerminal()).isTrue();
        }
    }
}

package com.ryuqq.conductor.adapter.runner.journal;

import com.ryuqq.conductor.core.event.RunCreated;
import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.event.StateSnapshot;
import com.ryuqq.conductor.core.exception.EventSinkException;
import com.ryuqq.conductor.core.exception.RunNotFoundException;
import com.ryuqq.conductor.core.model.BranchOrigin;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.spi.EventSink;
import com.ryuqq.conductor.core.state.RunState;
import com.ryuqq.conductor.core.state.RunStateProjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 이벤트 소싱 상태 저장소.
 *
 * <p>{@link EventSink}에 기록된 이벤트를 접어 Run 상태를 유도하고,
 * Run 하나에 대한 기록 통로({@link RunAppender})를 엽니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>최신 스냅샷 + 이후 이벤트 재생으로 현재 상태 로드</li>
 *   <li>임의 시퀀스 시점의 상태 재구성 (시간 여행)</li>
 *   <li>분기 Run의 부모 접두부 해석 (부모 로그는 복사하지 않음)</li>
 *   <li>스냅샷 간격 관리</li>
 * </ul>
 *
 * <p><strong>재생 비용:</strong></p>
 * <pre>
 * load(runId)
 *   ↓
 * readLatestSnapshot → StateSnapshot(seq = s)
 *   ↓
 * readFrom(s + 1) → 최대 snapshotInterval 개의 이벤트
 *   ↓
 * projector.replay(snapshot.state, suffix)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunJournal {

    private static final Logger log = LoggerFactory.getLogger(RunJournal.class);

    private final EventSink eventSink;
    private final RunStateProjector projector;
    private final Clock clock;
    private final int snapshotInterval;

    /**
     * 생성자.
     *
     * @param eventSink 이벤트 저장소
     * @param projector 상태 접기 함수
     * @param clock 이벤트 시각
     * @param snapshotInterval 스냅샷 사이의 이벤트 수 (1 이상)
     * @throws IllegalArgumentException 의존성이 null이거나 간격이 양수가 아닌 경우
     */
    public RunJournal(EventSink eventSink, RunStateProjector projector, Clock clock, int snapshotInterval) {
        if (eventSink == null) {
            throw new IllegalArgumentException("eventSink cannot be null");
        }
        if (projector == null) {
            throw new IllegalArgumentException("projector cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (snapshotInterval <= 0) {
            throw new IllegalArgumentException(
                "snapshotInterval must be positive (current: " + snapshotInterval + ")"
            );
        }
        this.eventSink = eventSink;
        this.projector = projector;
        this.clock = clock;
        this.snapshotInterval = snapshotInterval;
    }

    /**
     * 새 Run 로그 시작.
     *
     * <p>첫 이벤트는 RunCreated여야 합니다. 분기 Run이면 {@code base}가 부모의
     * 분기 시점 상태이고, RunCreated의 시퀀스는 분기 시퀀스 + 1입니다.</p>
     *
     * @param base 분기 Run의 시작 상태 (새 Run이면 null)
     * @param created RunCreated 생성 함수
     * @param onAppend 기록된 이벤트 수신자
     * @return 기록 통로
     */
    public RunAppender begin(RunState base, EventFactory created, Consumer<RunEvent> onAppend) {
        RunAppender appender = new RunAppender(base, 0, onAppend);
        RunEvent first = appender.append(created);
        if (!(first instanceof RunCreated)) {
            throw new IllegalStateException("A run log must begin with RunCreated (got " + first.type() + ")");
        }
        return appender;
    }

    /**
     * 기존 Run 로그에 이어 쓰는 통로 열기.
     *
     * @param runId Run ID
     * @param onAppend 기록된 이벤트 수신자
     * @return 현재 상태에서 시작하는 기록 통로
     * @throws RunNotFoundException 로그가 없는 경우
     */
    public RunAppender open(RunId runId, Consumer<RunEvent> onAppend) {
        Loaded loaded = loadInternal(runId);
        return new RunAppender(loaded.state, loaded.eventsSinceSnapshot, onAppend);
    }

    /**
     * 현재 상태 로드.
     *
     * @param runId Run ID
     * @return 최신 상태
     * @throws RunNotFoundException 로그가 없는 경우
     */
    public RunState load(RunId runId) {
        return loadInternal(runId).state;
    }

    /**
     * 특정 시퀀스 시점의 상태.
     *
     * @param runId Run ID
     * @param sequence 1 이상, 마지막 시퀀스 이하
     * @return 해당 시퀀스까지 접힌 상태
     * @throws IllegalArgumentException 시퀀스가 범위를 벗어난 경우
     */
    public RunState stateAt(RunId runId, long sequence) {
        List<RunEvent> own = readOwn(runId);
        RunEvent last = own.get(own.size() - 1);
        if (sequence < 1 || sequence > last.sequence()) {
            throw new IllegalArgumentException(
                "sequence out of range for " + runId + " (requested: " + sequence + ", last: " + last.sequence() + ")"
            );
        }

        Optional<BranchOrigin> origin = originOf(own);
        if (origin.isPresent() && sequence <= origin.get().branchSequence()) {
            return stateAt(origin.get().parentRunId(), sequence);
        }

        // 요청 시퀀스 이하의 가장 가까운 스냅샷부터 재생
        int start = 0;
        for (int i = 0; i < own.size() && own.get(i).sequence() <= sequence; i++) {
            if (own.get(i) instanceof StateSnapshot) {
                start = i;
            }
        }
        RunState base = null;
        if (start == 0 && origin.isPresent()) {
            base = stateAt(origin.get().parentRunId(), origin.get().branchSequence());
        }
        List<RunEvent> window = new ArrayList<>();
        for (RunEvent event : own.subList(start, own.size())) {
            if (event.sequence() > sequence) {
                break;
            }
            window.add(event);
        }
        return projector.replay(base, window);
    }

    /**
     * 전체 이력 (분기 Run은 부모 접두부 포함).
     *
     * @param runId Run ID
     * @return 시퀀스 순서의 이벤트
     */
    public List<RunEvent> history(RunId runId) {
        List<RunEvent> own = readOwn(runId);
        Optional<BranchOrigin> origin = originOf(own);
        if (origin.isEmpty()) {
            return own;
        }
        List<RunEvent> merged = new ArrayList<>();
        for (RunEvent event : history(origin.get().parentRunId())) {
            if (event.sequence() <= origin.get().branchSequence()) {
                merged.add(event);
            }
        }
        merged.addAll(own);
        return merged;
    }

    /**
     * Run 로그 존재 여부.
     *
     * @param runId Run ID
     * @return 이벤트가 하나라도 있으면 true
     */
    public boolean exists(RunId runId) {
        return !eventSink.readFrom(runId, 1).isEmpty();
    }

    private Loaded loadInternal(RunId runId) {
        Optional<StateSnapshot> snapshot = eventSink.readLatestSnapshot(runId);
        if (snapshot.isPresent()) {
            List<RunEvent> suffix = eventSink.readFrom(runId, snapshot.get().sequence() + 1);
            RunState base = projector.apply(null, snapshot.get());
            return new Loaded(projector.replay(base, suffix), suffix.size());
        }

        List<RunEvent> own = readOwn(runId);
        Optional<BranchOrigin> origin = originOf(own);
        RunState base = origin.isPresent()
            ? stateAt(origin.get().parentRunId(), origin.get().branchSequence())
            : null;
        return new Loaded(projector.replay(base, own), own.size());
    }

    private List<RunEvent> readOwn(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        List<RunEvent> own = eventSink.readFrom(runId, 1);
        if (own.isEmpty()) {
            throw new RunNotFoundException(runId);
        }
        return own;
    }

    private static Optional<BranchOrigin> originOf(List<RunEvent> own) {
        RunEvent first = own.get(0);
        if (!(first instanceof RunCreated)) {
            throw new IllegalStateException("Run log of " + first.runId() + " does not begin with RunCreated");
        }
        return Optional.ofNullable(((RunCreated) first).origin());
    }

    private static final class Loaded {
        private final RunState state;
        private final int eventsSinceSnapshot;

        private Loaded(RunState state, int eventsSinceSnapshot) {
            this.state = state;
            this.eventsSinceSnapshot = eventsSinceSnapshot;
        }
    }

    /**
     * Run 하나의 기록 통로.
     *
     * <p>시퀀스 부여, 상태 검증(적용 후 기록), 내구 기록, 스냅샷을 한 번에 처리합니다.
     * 한 Run의 기록은 이 객체를 통해 직렬화됩니다.</p>
     */
    public final class RunAppender {

        private final Consumer<RunEvent> onAppend;
        private RunState state;
        private int eventsSinceSnapshot;

        private RunAppender(RunState state, int eventsSinceSnapshot, Consumer<RunEvent> onAppend) {
            this.state = state;
            this.eventsSinceSnapshot = eventsSinceSnapshot;
            this.onAppend = onAppend == null ? event -> { } : onAppend;
        }

        /**
         * 이벤트 하나를 기록.
         *
         * <p>상태에 적용할 수 없는 이벤트는 기록하지 않고 {@link IllegalStateException}을 던집니다.
         * 저장소 실패는 {@link com.ryuqq.conductor.core.exception.EventSinkException}으로 전파되며
         * 상태는 바뀌지 않습니다.</p>
         *
         * @param factory 이벤트 생성 함수
         * @return 기록된 이벤트
         */
        public synchronized RunEvent append(EventFactory factory) {
            long sequence = state == null ? 1 : state.lastSequence() + 1;
            RunEvent event = factory.create(sequence, clock.instant());
            RunState next = projector.apply(state, event);
            eventSink.append(event.runId(), event);
            state = next;
            eventsSinceSnapshot++;
            onAppend.accept(event);

            if (eventsSinceSnapshot >= snapshotInterval || event.type().isRunTerminal()) {
                snapshot();
            }
            return event;
        }

        private void snapshot() {
            StateSnapshot snapshot = new StateSnapshot(state.runId(), state.lastSequence() + 1, clock.instant(), state);
            RunState next = projector.apply(state, snapshot);
            try {
                eventSink.append(snapshot.runId(), snapshot);
            } catch (EventSinkException e) {
                // 다음 이벤트에서 다시 시도
                log.warn("Snapshot of {} at sequence {} not written", snapshot.runId(), snapshot.sequence(), e);
                return;
            }
            state = next;
            eventsSinceSnapshot = 0;
            onAppend.accept(snapshot);
        }

        public synchronized RunState state() {
            return state;
        }
    }
}

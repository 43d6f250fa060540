package com.ryuqq.conductor.core.state;

import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.event.StateSnapshot;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.statemachine.RunStatus;
import com.ryuqq.conductor.core.statemachine.StageStatus;
import com.ryuqq.conductor.core.support.RunEvents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RunStateProjector 테스트")
class RunStateProjectorTest {

    private final RunStateProjector projector = new RunStateProjector();

    // ============================================================
    // 기본 흐름
    // ============================================================

    @Test
    @DisplayName("생성부터 완료까지 접으면 모든 Stage가 완료되고 토큰이 합산된다")
    void replay_happyPath() {
        // given
        RunEvents events = RunEvents.forRun("run-1");
        List<RunEvent> log = List.of(
            events.created("a", "b"),
            events.started(),
            events.stageStarted("a", 1),
            events.stageStarted("b", 1),
            events.stageCompleted("b", 1, "B"),
            events.stageCompleted("a", 1, "A"),
            events.completed());

        // when
        RunState state = projector.replay(log);

        // then
        assertThat(state.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(state.stagesWith(StageStatus.COMPLETED)).containsExactly(StageId.of("a"), StageId.of("b"));
        assertThat(state.outputOf(StageId.of("a"))).contains("A");
        assertThat(state.tokenUsage().total()).isEqualTo(60);
        assertThat(state.lastSequence()).isEqualTo(7);
    }

    @Test
    @DisplayName("같은 이벤트 열을 다시 접으면 항상 같은 상태가 나온다")
    void replay_isIdempotent() {
        // given
        RunEvents events = RunEvents.forRun("run-1");
        List<RunEvent> log = List.of(
            events.created("a"),
            events.started(),
            events.stageStarted("a", 1),
            events.stageRetried("a", 1),
            events.stageStarted("a", 2),
            events.stageCompleted("a", 2, "done"));

        // when
        RunState first = projector.replay(log);
        RunState second = projector.replay(new ArrayList<>(log));

        // then
        assertThat(first).isEqualTo(second);
        for (int n = 1; n <= log.size(); n++) {
            assertThat(projector.replay(log.subList(0, n))).isEqualTo(projector.replay(log.subList(0, n)));
        }
    }

    @Test
    @DisplayName("재시도는 시도 번호를 올리고 오류 체인을 남긴다")
    void retry_incrementsAttemptAndKeepsErrors() {
        // given
        RunEvents events = RunEvents.forRun("run-1");
        List<RunEvent> log = List.of(
            events.created("a"),
            events.started(),
            events.stageStarted("a", 1),
            events.stageRetried("a", 1),
            events.stageStarted("a", 2),
            events.stageFailed("a", 2));

        // when
        RunState state = projector.replay(log);

        // then
        StageExecution a = state.stage(StageId.of("a"));
        assertThat(a.status()).isEqualTo(StageStatus.FAILED);
        assertThat(a.attempt()).isEqualTo(2);
        assertThat(a.isSettled()).isTrue();
        assertThat(state.errors()).extracting(StageError::attempt).containsExactly(1, 2);
        assertThat(state.failedStage()).map(StageExecution::stageId).contains(StageId.of("a"));
    }

    @Test
    @DisplayName("사용자 선택 흐름: 대기 → 기록 → 완료")
    void feedbackFlow() {
        // given
        RunEvents events = RunEvents.forRun("run-1");
        List<RunEvent> log = List.of(
            events.created("pick"),
            events.started(),
            events.stageStarted("pick", 1),
            events.awaitingFeedback("pick", 1, "one", "two"),
            events.feedback("pick", 1, "two"));

        // when
        RunState state = projector.replay(log);

        // then
        StageExecution pick = state.stage(StageId.of("pick"));
        assertThat(pick.status()).isEqualTo(StageStatus.AWAITING_FEEDBACK);
        assertThat(pick.candidates()).containsExactly("one", "two");
        assertThat(pick.feedback()).isEqualTo("two");
    }

    // ============================================================
    // 종료와 늦은 이벤트
    // ============================================================

    @Test
    @DisplayName("취소는 진행 중인 Stage를 CANCELLED로 만들고 늦은 완료는 무시된다")
    void cancel_thenLateCompletionIgnored() {
        // given
        RunEvents events = RunEvents.forRun("run-1");
        List<RunEvent> log = List.of(
            events.created("a", "b"),
            events.started(),
            events.stageStarted("a", 1),
            events.cancelled("a"),
            events.stageCompleted("a", 1, "late"));

        // when
        RunState state = projector.replay(log);

        // then
        assertThat(state.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(state.stage(StageId.of("a")).status()).isEqualTo(StageStatus.CANCELLED);
        assertThat(state.stage(StageId.of("b")).status()).isEqualTo(StageStatus.WAITING);
        assertThat(state.inFlightAtCancel()).containsExactly(StageId.of("a"));
        assertThat(state.lastSequence()).isEqualTo(5);
    }

    @Test
    @DisplayName("일시정지 후 재개할 수 있다")
    void pauseAndResume() {
        // given
        RunEvents events = RunEvents.forRun("run-1");

        // when
        RunState paused = projector.replay(List.of(events.created("a"), events.started(), events.paused()));
        RunState resumed = projector.apply(paused, events.resumed());

        // then
        assertThat(paused.status()).isEqualTo(RunStatus.PAUSED);
        assertThat(resumed.status()).isEqualTo(RunStatus.RUNNING);
    }

    // ============================================================
    // 손상된 로그
    // ============================================================

    @Test
    @DisplayName("시퀀스에 빈틈이 있으면 거부된다")
    void nonContiguous_rejected() {
        // given
        RunEvents events = RunEvents.forRun("run-1");
        RunEvent created = events.created("a");
        events.started();
        RunEvent gap = events.stageStarted("a", 1);

        // when & then
        assertThatThrownBy(() -> projector.replay(List.of(created, gap)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Non-contiguous");
    }

    @Test
    @DisplayName("시도 번호를 건너뛰면 거부된다")
    void attemptOutOfOrder_rejected() {
        // given
        RunEvents events = RunEvents.forRun("run-1");
        List<RunEvent> log = List.of(events.created("a"), events.started(), events.stageStarted("a", 2));

        // when & then
        assertThatThrownBy(() -> projector.replay(log))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("attempt out of order");
    }

    @Test
    @DisplayName("재시도 예약 없이 실패한 Stage는 다시 시작할 수 없다")
    void restartAfterSettledFailure_rejected() {
        // given
        RunEvents events = RunEvents.forRun("run-1");
        List<RunEvent> log = List.of(events.created("a"), events.started(),
            events.stageStarted("a", 1), events.stageFailed("a", 1), events.stageStarted("a", 2));

        // when & then
        assertThatThrownBy(() -> projector.replay(log)).isInstanceOf(IllegalStateException.class);
    }

    // ============================================================
    // 스냅샷
    // ============================================================

    @Test
    @DisplayName("시퀀스 50의 스냅샷에서 10개 이벤트를 더 접은 상태는 전체 재생과 같다")
    void snapshotReplay_equalsFullReplay() {
        // given
        RunEvents events = RunEvents.forRun("run-1");
        List<String> stages = new ArrayList<>();
        for (int i = 1; i <= 30; i++) {
            stages.add("s" + i);
        }
        List<RunEvent> log = new ArrayList<>();
        log.add(events.created(stages.toArray(new String[0])));
        log.add(events.started());
        for (int i = 1; i <= 23; i++) {
            log.add(events.stageStarted("s" + i, 1));
            log.add(events.stageCompleted("s" + i, 1, "out-" + i));
        }
        log.add(events.stageStarted("s24", 1));
        StateSnapshot snapshot = events.snapshot(projector.replay(log));
        log.add(snapshot);
        List<RunEvent> suffix = new ArrayList<>();
        suffix.add(events.stageCompleted("s24", 1, "out-24"));
        for (int i = 25; i <= 28; i++) {
            suffix.add(events.stageStarted("s" + i, 1));
            suffix.add(events.stageCompleted("s" + i, 1, "out-" + i));
        }
        suffix.add(events.stageStarted("s29", 1));
        log.addAll(suffix);

        // when
        RunState full = projector.replayWithoutSnapshots(log);
        List<RunEvent> fromSnapshot = new ArrayList<>();
        fromSnapshot.add(snapshot);
        fromSnapshot.addAll(suffix);
        RunState viaSnapshot = projector.replay(fromSnapshot);

        // then
        assertThat(snapshot.sequence()).isEqualTo(50);
        assertThat(suffix).hasSize(10);
        assertThat(viaSnapshot).isEqualTo(full);
        assertThat(full.lastSequence()).isEqualTo(60);
    }

    @Test
    @DisplayName("원시 재생은 스냅샷 내용을 무시하고 시퀀스만 전진시킨다")
    void replayWithoutSnapshots_ignoresStaleSnapshot() {
        // given
        RunEvents earlier = RunEvents.forRun("run-1");
        RunState stale = projector.replay(List.of(earlier.created("a", "b"), earlier.started()));
        RunEvents events = RunEvents.forRun("run-1");
        List<RunEvent> log = List.of(
            events.created("a", "b"),
            events.started(),
            events.stageStarted("a", 1),
            events.stageCompleted("a", 1, "A"),
            events.snapshot(stale),
            events.stageStarted("b", 1));

        // when
        RunState raw = projector.replayWithoutSnapshots(log);
        RunState trusting = projector.replay(log);

        // then
        assertThat(raw.stage(StageId.of("a")).status()).isEqualTo(StageStatus.COMPLETED);
        assertThat(raw.stage(StageId.of("b")).status()).isEqualTo(StageStatus.RUNNING);
        assertThat(raw.lastSequence()).isEqualTo(6);
        assertThat(trusting.stage(StageId.of("a")).status()).isEqualTo(StageStatus.WAITING);
        assertThat(trusting).isNotEqualTo(raw);
    }

    @Test
    @DisplayName("원시 재생은 스냅샷으로 시작하는 이벤트 열을 거부한다")
    void replayWithoutSnapshots_rejectsLeadingSnapshot() {
        // given
        RunEvents events = RunEvents.forRun("run-1");
        RunState state = projector.replay(List.of(events.created("a"), events.started()));
        StateSnapshot snapshot = events.snapshot(state);

        // when & then
        assertThatThrownBy(() -> projector.replayWithoutSnapshots(List.of(snapshot)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("RunCreated");
    }

    // ============================================================
    // 분기
    // ============================================================

    @Test
    @DisplayName("분기 Run은 부모 접두부 상태에서 완료된 Stage만 유지하고 나머지를 다시 대기시킨다")
    void branch_keepsCompletedResetsRest() {
        // given
        RunEvents parent = RunEvents.forRun("parent");
        List<RunEvent> parentLog = List.of(
            parent.created("a", "b"),
            parent.started(),
            parent.stageStarted("a", 1),
            parent.stageCompleted("a", 1, "A"),
            parent.stageStarted("b", 1));
        RunState prefix = projector.replay(parentLog);
        RunEvents child = RunEvents.branchOf("child", 5);

        // when
        RunState branched = projector.replay(prefix, List.of(child.branchCreated("parent", "a", "b"), child.started()));

        // then
        assertThat(branched.runId()).isEqualTo(RunId.of("child"));
        assertThat(branched.origin().parentRunId()).isEqualTo(RunId.of("parent"));
        assertThat(branched.origin().branchSequence()).isEqualTo(5);
        assertThat(branched.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(branched.stage(StageId.of("a")).status()).isEqualTo(StageStatus.COMPLETED);
        assertThat(branched.stage(StageId.of("b")).status()).isEqualTo(StageStatus.WAITING);
        assertThat(branched.stage(StageId.of("b")).attempt()).isZero();
        assertThat(branched.lastSequence()).isEqualTo(7);
        assertThat(prefix.stage(StageId.of("b")).status()).isEqualTo(StageStatus.RUNNING);
    }

    @Test
    @DisplayName("부모 상태 없이 분기 생성 이벤트를 접을 수 없다")
    void branchWithoutPrefix_rejected() {
        // given
        RunEvents child = RunEvents.branchOf("child", 3);

        // when & then
        assertThatThrownBy(() -> projector.replay(List.of(child.branchCreated("parent", "a"))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("parent prefix");
    }
}

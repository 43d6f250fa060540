package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.orchestrator.RunListener;
import com.ryuqq.conductor.application.orchestrator.Subscription;
import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.testkit.support.EventFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EventBroadcaster 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class EventBroadcasterTest {

    private EventBroadcaster broadcaster;
    private EventFixtures events;
    private RunId runId;

    @BeforeEach
    void setUp() {
        broadcaster = new EventBroadcaster();
        events = EventFixtures.forRun("run-1");
        runId = events.runId();
    }

    // ============================================================
    // 1. 이력 재생과 실시간 전달
    // ============================================================

    @Test
    @DisplayName("구독하면 기존 이력을 먼저 받고 이후 이벤트를 이어서 받는다")
    void subscribe_replaysThenStreams() {
        // given
        List<RunEvent> history = List.of(events.created("outline"), events.started());
        List<RunEvent> received = new ArrayList<>();

        // when
        broadcaster.subscribe(runId, received::add, () -> history);
        RunEvent live = events.stageStarted("outline", 1);
        broadcaster.publish(live);

        // then
        assertThat(received).containsExactly(history.get(0), history.get(1), live);
    }

    @Test
    @DisplayName("이력을 읽는 동안 발행된 이벤트는 중복 없이 이력 뒤에 전달된다")
    void publishDuringReplay_bufferedWithoutDuplicates() {
        // given
        RunEvent created = events.created("outline");
        RunEvent started = events.started();
        RunEvent stageStarted = events.stageStarted("outline", 1);
        List<RunEvent> received = new ArrayList<>();

        // when
        broadcaster.subscribe(runId, received::add, () -> {
            // 이력 조회 도중 기록된 이벤트: 하나는 이력에도 포함되고 하나는 포함되지 않음
            broadcaster.publish(started);
            broadcaster.publish(stageStarted);
            return List.of(created, started);
        });

        // then
        assertThat(received).containsExactly(created, started, stageStarted);
    }

    @Test
    @DisplayName("다른 Run의 이벤트는 전달되지 않는다")
    void publish_otherRunIgnored() {
        // given
        List<RunEvent> received = new ArrayList<>();
        broadcaster.subscribe(runId, received::add, List::of);

        // when
        broadcaster.publish(EventFixtures.forRun("run-2").created("outline"));

        // then
        assertThat(received).isEmpty();
    }

    // ============================================================
    // 2. 수신자 격리와 해지
    // ============================================================

    @Test
    @DisplayName("예외를 던지는 수신자는 다른 수신자에게 영향을 주지 않는다")
    void failingListener_isolated() {
        // given
        List<RunEvent> received = new ArrayList<>();
        broadcaster.subscribe(runId, event -> {
            throw new IllegalStateException("listener bug");
        }, List::of);
        broadcaster.subscribe(runId, received::add, List::of);
        RunEvent created = events.created("outline");

        // when
        broadcaster.publish(created);

        // then
        assertThat(received).containsExactly(created);
    }

    @Test
    @DisplayName("구독을 닫으면 더 이상 전달되지 않는다")
    void close_stopsDelivery() {
        // given
        List<RunEvent> received = new ArrayList<>();
        Subscription subscription = broadcaster.subscribe(runId, received::add, List::of);

        // when
        subscription.close();
        broadcaster.publish(events.created("outline"));

        // then
        assertThat(received).isEmpty();
        assertThat(subscription.isActive()).isFalse();
        assertThat(broadcaster.subscriberCount(runId)).isZero();
    }

    @Test
    @DisplayName("부분 출력은 활성 구독에만 전달된다")
    void publishChunk_deliveredToActiveSubscribers() {
        // given
        List<String> chunks = new ArrayList<>();
        broadcaster.subscribe(runId, new RunListener() {
            @Override
            public void onEvent(RunEvent event) {
            }

            @Override
            public void onChunk(StageId stageId, int attempt, String chunk) {
                chunks.add(stageId.getValue() + "#" + attempt + ":" + chunk);
            }
        }, List::of);

        // when
        broadcaster.publishChunk(runId, StageId.of("outline"), 1, "Hel");
        broadcaster.publishChunk(runId, StageId.of("outline"), 1, "lo");

        // then
        assertThat(chunks).containsExactly("outline#1:Hel", "outline#1:lo");
    }

    @Test
    @DisplayName("이력 조회가 실패하면 구독은 등록되지 않는다")
    void historyFailure_subscriptionRemoved() {
        // when & then
        assertThatThrownBy(() -> broadcaster.subscribe(runId, event -> { }, () -> {
            throw new IllegalStateException("sink down");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(broadcaster.subscriberCount(runId)).isZero();
    }
}

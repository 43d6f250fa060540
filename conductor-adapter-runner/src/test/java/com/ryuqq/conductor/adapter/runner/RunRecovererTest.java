package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.adapter.inmemory.InMemoryEventSink;
import com.ryuqq.conductor.core.event.EventType;
import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.event.StageRetried;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.model.TemplateId;
import com.ryuqq.conductor.core.state.RunState;
import com.ryuqq.conductor.core.state.StageError;
import com.ryuqq.conductor.core.statemachine.RunStatus;
import com.ryuqq.conductor.core.statemachine.StageStatus;
import com.ryuqq.conductor.testkit.support.ScriptedGenerationCapability;
import com.ryuqq.conductor.testkit.support.TemplateFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 재시작 후 Run 복구 테스트.
 *
 * <p>같은 이벤트 저장소를 공유하는 두 오케스트레이터로 프로세스 재시작을 흉내냅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RunRecovererTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private InMemoryEventSink eventSink;
    private ScriptedGenerationCapability beforeRestart;
    private ScriptedGenerationCapability afterRestart;
    private DefaultOrchestrator first;
    private DefaultOrchestrator second;

    @BeforeEach
    void setUp() {
        eventSink = new InMemoryEventSink();
        beforeRestart = new ScriptedGenerationCapability().hang("slow work after");
        afterRestart = new ScriptedGenerationCapability();
        first = orchestrator(beforeRestart);
        second = orchestrator(afterRestart);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        first.shutdown();
        second.shutdown();
        beforeRestart.close();
        afterRestart.close();
    }

    private DefaultOrchestrator orchestrator(ScriptedGenerationCapability generation) {
        return DefaultOrchestrator.builder()
            .eventSink(eventSink)
            .generation(generation)
            .config(new OrchestratorConfig().withCancelTimeoutMs(500).withDrainTimeoutMs(100))
            .template(TemplateFixtures.slowMiddle())
            .template(TemplateFixtures.independent())
            .build();
    }

    private RunId interruptedRun() throws InterruptedException {
        RunId runId = first.startRun(TemplateId.of("slow-middle"), Map.of());
        assertThat(beforeRestart.awaitStarted("slow work after", TIMEOUT)).isTrue();
        first.shutdown();
        return runId;
    }

    @Test
    @DisplayName("종료 전에 멈춘 Run은 로그상 실행 중으로 남는다")
    void shutdown_leavesRunInFlight() throws Exception {
        // when
        RunId runId = interruptedRun();

        // then
        RunState state = second.getRunState(runId);
        assertThat(state.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(state.stage(StageId.of("slow")).status()).isEqualTo(StageStatus.RUNNING);
        assertThatThrownBy(() -> second.awaitTermination(runId, TIMEOUT))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("recover");
    }

    @Test
    @DisplayName("복구하면 중단된 시도를 다시 실행하여 Run을 완료한다")
    void recoverRun_rerunsInterruptedAttempt() throws Exception {
        // given
        RunId runId = interruptedRun();

        // when
        RunState recovered = second.recoverRun(runId);
        RunState state = second.awaitTermination(runId, TIMEOUT);

        // then
        assertThat(recovered.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(state.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(state.stage(StageId.of("slow")).attempt()).isEqualTo(2);
        assertThat(state.stage(StageId.of("prep")).attempt()).isEqualTo(1);
        assertThat(afterRestart.invocationCount("prep work")).isZero();

        StageRetried retried = (StageRetried) second.history(runId).stream()
            .filter(event -> event instanceof StageRetried)
            .findFirst()
            .orElseThrow();
        assertThat(retried.error().code()).isEqualTo(StageError.INTERNAL);
        assertThat(retried.delayMs()).isZero();
    }

    @Test
    @DisplayName("이미 종료된 Run의 복구는 상태만 돌려주고 실행하지 않는다")
    void recoverRun_terminalRunNotRelaunched() throws Exception {
        // given
        RunId runId = second.startRun(TemplateId.of("independent"), Map.of("topic", "cats"));
        RunState completed = second.awaitTermination(runId, TIMEOUT);

        // when
        RunState recovered = first.recoverRun(runId);

        // then
        assertThat(recovered).isEqualTo(completed);
        assertThat(first.isActive(runId)).isFalse();
    }

    @Test
    @DisplayName("복구 스캔은 끝나지 않은 Run만 다시 실행한다")
    void recoverAll_onlyUnfinishedRuns() throws Exception {
        // given
        RunId finished = second.startRun(TemplateId.of("independent"), Map.of("topic", "cats"));
        second.awaitTermination(finished, TIMEOUT);
        RunId interrupted = interruptedRun();
        DefaultOrchestrator restarted = orchestrator(afterRestart);

        try {
            // when
            int recovered = new RunRecoverer(restarted).recoverAll();

            // then
            assertThat(recovered).isEqualTo(1);
            assertThat(restarted.awaitTermination(interrupted, TIMEOUT).status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(restarted.getRunState(finished).status()).isEqualTo(RunStatus.COMPLETED);
        } finally {
            restarted.shutdown();
        }
    }

    @Test
    @DisplayName("실행 중이 아닌 Run을 취소하면 취소 이벤트가 바로 기록된다")
    void cancelInactiveRun_recordedDirectly() throws Exception {
        // given
        RunId runId = interruptedRun();

        // when
        second.cancelRun(runId);

        // then
        RunState state = second.getRunState(runId);
        assertThat(state.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(state.stage(StageId.of("slow")).status()).isEqualTo(StageStatus.CANCELLED);
        assertThat(state.inFlightAtCancel()).containsExactly(StageId.of("slow"));
        assertThat(second.recoverRun(runId).status()).isEqualTo(RunStatus.CANCELLED);
        RunEvent last = second.history(runId).get(second.history(runId).size() - 1);
        assertThat(last.type()).isEqualTo(EventType.STATE_SNAPSHOT);
    }

    @Test
    @DisplayName("종료된 오케스트레이터는 새 Run을 받지 않는다")
    void shutdown_rejectsNewRuns() throws Exception {
        // given
        first.shutdown();

        // when & then
        assertThatThrownBy(() -> first.startRun(TemplateId.of("independent"), Map.of("topic", "cats")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("shut down");
    }
}

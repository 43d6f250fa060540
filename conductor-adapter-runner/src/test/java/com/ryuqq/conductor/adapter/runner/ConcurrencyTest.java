package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.adapter.inmemory.InMemoryEventSink;
import com.ryuqq.conductor.core.event.EventType;
import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.event.StageStarted;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.model.TemplateId;
import com.ryuqq.conductor.core.state.RunState;
import com.ryuqq.conductor.core.statemachine.RunStatus;
import com.ryuqq.conductor.core.template.PipelineTemplate;
import com.ryuqq.conductor.core.template.StageDefinition;
import com.ryuqq.conductor.testkit.support.ScriptedGenerationCapability;
import com.ryuqq.conductor.testkit.support.TemplateFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 동시성 제어 통합 테스트.
 *
 * <p>Run 실행 루프의 동시 접근 처리를 검증합니다:</p>
 * <ul>
 *   <li>동시 실행 Stage 수 상한</li>
 *   <li>(Run, Stage, 시도) 당 StageStarted 정확히 한 번</li>
 *   <li>여러 Run 동시 실행</li>
 *   <li>여러 스레드의 동시 제어 요청</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConcurrencyTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    private ScriptedGenerationCapability generation;
    private DefaultOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        generation = new ScriptedGenerationCapability().withLatency(Duration.ofMillis(20));
        orchestrator = DefaultOrchestrator.builder()
            .eventSink(new InMemoryEventSink())
            .generation(generation)
            .config(new OrchestratorConfig().withMaxConcurrentStages(2))
            .template(wide(8))
            .template(TemplateFixtures.independent())
            .build();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        orchestrator.shutdown();
        generation.close();
    }

    private static PipelineTemplate wide(int width) {
        List<StageDefinition> stages = new ArrayList<>();
        for (int i = 0; i < width; i++) {
            stages.add(StageDefinition.generate("s" + i, "wide task " + i + " on {{ inputs.topic }}")
                .withRetryPolicy(TemplateFixtures.FAST_RETRY));
        }
        return PipelineTemplate.of("wide", 1, stages);
    }

    // ============================================================
    // 1. 동시 실행 상한
    // ============================================================

    @Test
    void 동시에_실행되는_Stage_수는_설정된_상한을_넘지_않음() throws Exception {
        // given
        RunId runId = orchestrator.startRun(TemplateId.of("wide"), Map.of("topic", "cats"));

        // when
        RunState state = orchestrator.awaitTermination(runId, TIMEOUT);

        // then
        assertThat(state.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(generation.invocationCount()).isEqualTo(8);
        assertThat(generation.maxConcurrentInvocations()).isLessThanOrEqualTo(2);
    }

    // ============================================================
    // 2. Single-flight
    // ============================================================

    @Test
    void 재시도가_섞여도_Stage_시도마다_StageStarted는_한_번만_기록됨() throws Exception {
        // given
        generation.failTimes("wide task 3", 2, true).failTimes("wide task 5", 1, true);
        RunId runId = orchestrator.startRun(TemplateId.of("wide"), Map.of("topic", "dogs"));

        // when
        RunState state = orchestrator.awaitTermination(runId, TIMEOUT);

        // then
        assertThat(state.status()).isEqualTo(RunStatus.COMPLETED);
        Set<String> attempts = new HashSet<>();
        int started = 0;
        for (RunEvent event : orchestrator.history(runId)) {
            if (event instanceof StageStarted) {
                StageStarted stageStarted = (StageStarted) event;
                attempts.add(stageStarted.stageId().getValue() + "#" + stageStarted.attempt());
                started++;
            }
        }
        assertThat(started).isEqualTo(attempts.size());
        assertThat(started).isEqualTo(8 + 3);
        assertThat(state.stage(StageId.of("s3")).attempt()).isEqualTo(3);
    }

    // ============================================================
    // 3. 여러 Run 동시 실행
    // ============================================================

    @Test
    void 여러_스레드에서_동시에_시작한_Run이_모두_완료됨() throws Exception {
        // given
        int threadCount = 6;
        CountDownLatch ready = new CountDownLatch(threadCount);
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        List<Future<RunId>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < threadCount; i++) {
            String topic = "topic-" + i;
            futures.add(executorService.submit(() -> {
                ready.countDown();
                ready.await();
                return orchestrator.startRun(TemplateId.of("independent"), Map.of("topic", topic));
            }));
        }

        // then
        Set<RunId> runIds = new HashSet<>();
        for (Future<RunId> future : futures) {
            RunId runId = future.get(10, TimeUnit.SECONDS);
            runIds.add(runId);
            assertThat(orchestrator.awaitTermination(runId, TIMEOUT).status()).isEqualTo(RunStatus.COMPLETED);
        }
        executorService.shutdown();
        assertThat(runIds).hasSize(threadCount);
        assertThat(generation.invocationCount()).isEqualTo(threadCount * 3);
    }

    // ============================================================
    // 4. 동시 제어 요청
    // ============================================================

    @Test
    void 여러_스레드의_동시_취소_요청은_한_번만_기록됨() throws Exception {
        // given
        generation.hang("wide task");
        RunId runId = orchestrator.startRun(TemplateId.of("wide"), Map.of("topic", "birds"));
        assertThat(generation.awaitStarted("wide task", TIMEOUT)).isTrue();

        int threadCount = 5;
        CountDownLatch ready = new CountDownLatch(threadCount);
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < threadCount; i++) {
            futures.add(executorService.submit(() -> {
                ready.countDown();
                try {
                    ready.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                orchestrator.cancelRun(runId);
            }));
        }
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executorService.shutdown();
        RunState state = orchestrator.awaitTermination(runId, TIMEOUT);

        // then
        assertThat(state.status()).isEqualTo(RunStatus.CANCELLED);
        long cancelled = orchestrator.history(runId).stream()
            .filter(event -> event.type() == EventType.RUN_CANCELLED)
            .count();
        assertThat(cancelled).isEqualTo(1);
        assertThat(state.inFlightAtCancel()).hasSize(2);
    }
}

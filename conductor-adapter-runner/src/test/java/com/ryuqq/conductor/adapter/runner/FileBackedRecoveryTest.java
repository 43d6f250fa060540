package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.adapter.file.FileEventSink;
import com.ryuqq.conductor.adapter.file.json.ConductorJson;
import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.event.StageCompleted;
import com.ryuqq.conductor.core.event.StageRetried;
import com.ryuqq.conductor.core.event.StageStarted;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.model.TemplateId;
import com.ryuqq.conductor.core.model.TokenUsage;
import com.ryuqq.conductor.core.state.RunState;
import com.ryuqq.conductor.core.state.StageError;
import com.ryuqq.conductor.core.state.StageOutput;
import com.ryuqq.conductor.core.statemachine.RunStatus;
import com.ryuqq.conductor.testkit.support.ScriptedGenerationCapability;
import com.ryuqq.conductor.testkit.support.TemplateFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 파일 이벤트 저장소 위에서의 재시작 복구 테스트.
 *
 * <p>StageCompleted를 쓰던 중 프로세스가 죽어 마지막 줄이 잘린 로그를
 * 다른 오케스트레이터가 이어받아 복구하는 상황을 재현합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FileBackedRecoveryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path directory;

    private ScriptedGenerationCapability beforeRestart;
    private ScriptedGenerationCapability afterRestart;
    private DefaultOrchestrator first;
    private DefaultOrchestrator second;

    @BeforeEach
    void setUp() {
        beforeRestart = new ScriptedGenerationCapability().hang("slow work after");
        afterRestart = new ScriptedGenerationCapability();
        first = orchestrator(beforeRestart);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        first.shutdown();
        if (second != null) {
            second.shutdown();
        }
        beforeRestart.close();
        afterRestart.close();
    }

    private DefaultOrchestrator orchestrator(ScriptedGenerationCapability generation) {
        return DefaultOrchestrator.builder()
            .eventSink(new FileEventSink(directory))
            .generation(generation)
            .config(new OrchestratorConfig().withCancelTimeoutMs(500).withDrainTimeoutMs(100))
            .template(TemplateFixtures.slowMiddle())
            .build();
    }

    @Test
    @DisplayName("잘린 StageCompleted 줄은 버려지고 해당 Stage를 다시 실행하여 Run을 완료한다")
    void tornStageCompleted_stageRerunOnRecovery() throws Exception {
        // given
        RunId runId = first.startRun(TemplateId.of("slow-middle"), Map.of());
        assertThat(beforeRestart.awaitStarted("slow work after", TIMEOUT)).isTrue();
        first.shutdown();

        List<RunEvent> beforeCrash = new FileEventSink(directory).readFrom(runId, 1);
        RunEvent lastWritten = beforeCrash.get(beforeCrash.size() - 1);
        assertThat(lastWritten).isInstanceOf(StageStarted.class);
        appendTornStageCompleted(runId, lastWritten.sequence() + 1);

        // when
        second = orchestrator(afterRestart);
        RunState recovered = second.recoverRun(runId);
        RunState state = second.awaitTermination(runId, TIMEOUT);

        // then
        assertThat(recovered.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(state.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(state.stage(StageId.of("slow")).attempt()).isEqualTo(2);
        assertThat(afterRestart.invocationCount("slow work after")).isEqualTo(1);
        assertThat(afterRestart.invocationCount("prep work")).isZero();

        List<RunEvent> history = second.history(runId);
        for (int i = 0; i < history.size(); i++) {
            assertThat(history.get(i).sequence()).isEqualTo(i + 1);
        }
        assertThat(history.subList(0, beforeCrash.size())).containsExactlyElementsOf(beforeCrash);
        RunEvent afterCrash = history.get(beforeCrash.size());
        assertThat(afterCrash).isInstanceOf(StageRetried.class);
        assertThat(((StageRetried) afterCrash).error().code()).isEqualTo(StageError.INTERNAL);
        assertThat(history.stream()
            .filter(event -> event instanceof StageCompleted)
            .map(event -> (StageCompleted) event)
            .filter(completed -> completed.stageId().equals(StageId.of("slow")))
            .map(StageCompleted::attempt))
            .containsExactly(2);
    }

    private void appendTornStageCompleted(RunId runId, long sequence) throws Exception {
        StageCompleted completed = new StageCompleted(runId, sequence, Instant.now(), StageId.of("slow"), 1,
            StageOutput.fresh("lost output", "gpt-test", null, new TokenUsage(1, 1)));
        byte[] line = ConductorJson.createObjectMapper().writerFor(RunEvent.class)
            .writeValueAsString(completed)
            .getBytes(StandardCharsets.UTF_8);
        Files.write(directory.resolve(runId.getValue() + ".jsonl"), Arrays.copyOf(line, line.length / 2),
            StandardOpenOption.APPEND);
    }
}

package com.ryuqq.conductor.testkit.support;

import com.ryuqq.conductor.core.exception.StageExecutionException;
import com.ryuqq.conductor.core.spi.CancellationToken;
import com.ryuqq.conductor.core.spi.GenerationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptedGenerationCapabilityTest {

    private final ScriptedGenerationCapability generation = new ScriptedGenerationCapability();

    @AfterEach
    void tearDown() {
        generation.close();
    }

    @Test
    void respond_streamsChunksThatJoinToText() throws Exception {
        // given
        generation.respond("outline", "one two three");
        List<String> chunks = new CopyOnWriteArrayList<>();

        // when
        GenerationResult result = generation.invoke("write an outline", List.of("gpt-4o"), chunks::add,
            new CancellationToken()).get(5, TimeUnit.SECONDS);

        // then
        assertThat(result.text()).isEqualTo("one two three");
        assertThat(result.model()).isEqualTo("gpt-4o");
        assertThat(String.join("", chunks)).isEqualTo("one two three");
        assertThat(chunks).hasSize(3);
        assertThat(generation.invocationCount("outline")).isEqualTo(1);
    }

    @Test
    void failTimes_thenFallsThroughToNextRule() throws Exception {
        // given
        generation.failTimes("draft", 1, true).respond("draft", "ok");

        // when
        CompletableFuture<GenerationResult> first = generation.invoke("draft", List.of("m"), chunk -> { },
            new CancellationToken());
        CompletableFuture<GenerationResult> second = generation.invoke("draft", List.of("m"), chunk -> { },
            new CancellationToken());

        // then
        assertThatThrownBy(() -> first.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(StageExecutionException.class);
        assertThat(second.get(5, TimeUnit.SECONDS).text()).isEqualTo("ok");
    }

    @Test
    void hang_endsOnlyWhenCancelled() throws Exception {
        // given
        generation.hang("slow");
        CancellationToken token = new CancellationToken();
        CompletableFuture<GenerationResult> future = generation.invoke("slow call", List.of("m"), chunk -> { }, token);

        // when
        assertThat(generation.awaitStarted("slow", Duration.ofSeconds(5))).isTrue();
        boolean doneBeforeCancel = future.isDone();
        token.cancel();

        // then
        assertThat(doneBeforeCancel).isFalse();
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(CancellationException.class);
    }

    @Test
    void unmatchedPrompt_isEchoed() throws Exception {
        // when
        GenerationResult result = generation.invoke("hello", List.of(), chunk -> { }, new CancellationToken())
            .get(5, TimeUnit.SECONDS);

        // then
        assertThat(result.text()).isEqualTo("echo: hello");
        assertThat(result.model()).isEqualTo("scripted");
    }
}

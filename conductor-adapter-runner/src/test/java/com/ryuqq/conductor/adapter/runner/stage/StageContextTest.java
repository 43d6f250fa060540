package com.ryuqq.conductor.adapter.runner.stage;

import com.ryuqq.conductor.core.spi.CancellationToken;
import com.ryuqq.conductor.core.state.RunState;
import com.ryuqq.conductor.core.state.RunStateProjector;
import com.ryuqq.conductor.core.template.PipelineTemplate;
import com.ryuqq.conductor.core.template.StageDefinition;
import com.ryuqq.conductor.testkit.support.EventFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * StageContext 렌더링 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StageContextTest {

    private RunState state;

    @BeforeEach
    void setUp() {
        // topic=cats 입력, outline 완료
        EventFixtures events = EventFixtures.forRun("run-1");
        state = new RunStateProjector().replay(List.of(
            events.created("outline", "draft"),
            events.started(),
            events.stageStarted("outline", 1),
            events.stageCompleted("outline", 1, "an outline")
        ));
    }

    private static PipelineTemplate templateWith(StageDefinition draft) {
        return PipelineTemplate.of("fixture", 1, List.of(StageDefinition.generate("outline", "Outline"), draft))
            .withDefaults(Map.of("tone", "formal"));
    }

    @Test
    @DisplayName("입력, 이전 Stage 출력, 기본값 참조가 모두 치환된다")
    void render_resolvesAllNamespaces() {
        // given
        StageDefinition draft = StageDefinition.generate("draft",
                "Write about {{ inputs.topic }}{{ inputs.missing }} from {{ steps.outline }} in {{ defaults.tone }}")
            .withDependsOn("outline");

        // when
        StageContext context = StageContext.render(state, templateWith(draft), draft, 1,
            "gpt-4o-mini", new CancellationToken(), null);

        // then
        assertThat(context.prompt()).isEqualTo("Write about cats from an outline in formal");
        assertThat(context.stageId()).isEqualTo(draft.id());
        assertThat(context.runId()).isEqualTo(state.runId());
        assertThat(context.attempt()).isEqualTo(1);
    }

    @Test
    @DisplayName("모델 선호 목록도 렌더링되고 빈 항목은 제외된다")
    void render_modelPreference() {
        // given
        StageDefinition draft = StageDefinition.generate("draft", "Draft")
            .withModelPreference("{{ inputs.model }}", "gpt-4o", "{{ inputs.topic }}-model");

        // when
        StageContext context = StageContext.render(state, templateWith(draft), draft, 1,
            "gpt-4o-mini", new CancellationToken(), null);

        // then
        assertThat(context.models()).containsExactly("gpt-4o", "cats-model");
    }

    @Test
    @DisplayName("선호 목록이 비면 기본 모델을 사용한다")
    void render_defaultModelFallback() {
        // given
        StageDefinition draft = StageDefinition.generate("draft", "Draft").withModelPreference("{{ inputs.model }}");

        // when
        StageContext context = StageContext.render(state, templateWith(draft), draft, 1,
            "gpt-4o-mini", new CancellationToken(), null);

        // then
        assertThat(context.models()).containsExactly("gpt-4o-mini");
    }

    @Test
    @DisplayName("캐시 컨텍스트는 입력을 우선하고 없으면 기본값을 사용한다")
    void render_cacheContext() {
        // given
        StageDefinition draft = StageDefinition.generate("draft", "Draft").withContextKeys("topic", "tone", "absent");

        // when
        StageContext context = StageContext.render(state, templateWith(draft), draft, 2,
            "gpt-4o-mini", new CancellationToken(), null);

        // then
        assertThat(context.cacheContext()).containsExactly(Map.entry("topic", "cats"), Map.entry("tone", "formal"));
        assertThat(context.chunks()).isNotNull();
    }
}

package com.ryuqq.conductor.core.graph;

import com.ryuqq.conductor.core.exception.TemplateValidationException;
import com.ryuqq.conductor.core.template.InputSpec;
import com.ryuqq.conductor.core.template.PipelineTemplate;
import com.ryuqq.conductor.core.template.StageDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TemplateValidator 테스트")
class TemplateValidatorTest {

    // ============================================================
    // 그래프 구조
    // ============================================================

    @Test
    @DisplayName("순환이 있는 템플릿은 경로와 함께 거부된다")
    void cycle_rejectedWithPath() {
        // given
        PipelineTemplate template = PipelineTemplate.of("cyclic", 1, List.of(
            StageDefinition.generate("a", "A").withDependsOn("c"),
            StageDefinition.generate("b", "B").withDependsOn("a"),
            StageDefinition.generate("c", "C").withDependsOn("b")));

        // when & then
        assertThatThrownBy(() -> TemplateValidator.validate(template))
            .isInstanceOf(TemplateValidationException.class)
            .hasMessageContaining("cyclic@1")
            .hasMessageContaining("dependency cycle: a -> c -> b -> a");
    }

    @Test
    @DisplayName("자기 자신에 대한 의존도 순환이다")
    void selfDependency_rejected() {
        // given
        PipelineTemplate template = PipelineTemplate.of("self", 1, List.of(
            StageDefinition.generate("a", "A").withDependsOn("a")));

        // when
        List<String> problems = TemplateValidator.problemsOf(template);

        // then
        assertThat(problems).containsExactly("dependency cycle: a -> a");
    }

    @Test
    @DisplayName("존재하지 않는 Stage에 대한 의존은 거부된다")
    void unknownDependency_rejected() {
        // given
        PipelineTemplate template = PipelineTemplate.of("dangling", 1, List.of(
            StageDefinition.generate("a", "A").withDependsOn("ghost")));

        // when
        List<String> problems = TemplateValidator.problemsOf(template);

        // then
        assertThat(problems).containsExactly("stage 'a' depends on unknown stage 'ghost'");
    }

    @Test
    @DisplayName("중복 Stage ID는 거부된다")
    void duplicateStageId_rejected() {
        // given
        PipelineTemplate template = PipelineTemplate.of("dup", 1, List.of(
            StageDefinition.generate("a", "A"),
            StageDefinition.generate("a", "A again")));

        // when & then
        assertThat(TemplateValidator.problemsOf(template)).containsExactly("duplicate stage id 'a'");
    }

    // ============================================================
    // 변수 참조
    // ============================================================

    @Test
    @DisplayName("의존하지 않는 Stage의 출력 참조는 거부된다")
    void stepsReference_mustBeUpstream() {
        // given
        PipelineTemplate template = PipelineTemplate.of("refs", 1, List.of(
            StageDefinition.generate("outline", "Outline"),
            StageDefinition.generate("title", "Title"),
            StageDefinition.generate("draft", "Use {{ steps.outline }} and {{ steps.title }}").withDependsOn("outline")));

        // when
        List<String> problems = TemplateValidator.problemsOf(template);

        // then
        assertThat(problems).hasSize(1);
        assertThat(problems.get(0)).contains("'title'").contains("not one of its dependencies");
    }

    @Test
    @DisplayName("전이적 의존 Stage의 출력은 참조할 수 있다")
    void stepsReference_transitiveAllowed() {
        // given
        PipelineTemplate template = PipelineTemplate.of("chain", 1, List.of(
            StageDefinition.generate("a", "A"),
            StageDefinition.generate("b", "B {{ steps.a }}").withDependsOn("a"),
            StageDefinition.generate("c", "C {{ steps.a }} {{ steps.b }}").withDependsOn("b")));

        // when & then
        assertThatCode(() -> TemplateValidator.validate(template)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("선언되지 않은 입력, 기본값, 네임스페이스는 모두 보고된다")
    void undeclaredReferences_allReported() {
        // given
        PipelineTemplate template = PipelineTemplate.of("vars", 1, List.of(
                StageDefinition.generate("a", "{{ inputs.topic }} {{ inputs.missing }} {{ defaults.tone }} {{ env.HOME }}")
                    .withModelPreference("{{ defaults.model }}")))
            .withInputs(InputSpec.required("topic"))
            .withDefaults(Map.of("tone", "formal"));

        // when
        List<String> problems = TemplateValidator.problemsOf(template);

        // then
        assertThat(problems).hasSize(3);
        assertThat(problems).anyMatch(p -> p.contains("undeclared input 'missing'"));
        assertThat(problems).anyMatch(p -> p.contains("unknown placeholder namespace {{ env.HOME }}"));
        assertThat(problems).anyMatch(p -> p.contains("undeclared default 'model'"));
    }
}

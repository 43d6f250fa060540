package com.ryuqq.conductor.core.graph;

import com.ryuqq.conductor.core.exception.TemplateValidationException;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.template.PipelineTemplate;
import com.ryuqq.conductor.core.template.StageDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DependencyGraph 테스트")
class DependencyGraphTest {

    // outline -> (title, draft) -> review, summary 독립
    private final PipelineTemplate template = PipelineTemplate.of("article", 1, List.of(
        StageDefinition.generate("review", "R").withDependsOn("title", "draft"),
        StageDefinition.generate("outline", "O"),
        StageDefinition.generate("draft", "D").withDependsOn("outline"),
        StageDefinition.generate("title", "T").withDependsOn("outline"),
        StageDefinition.generate("summary", "S")));

    @Test
    @DisplayName("위상 정렬은 동률일 때 선언 순서를 따른다")
    void topologicalOrder_declarationTieBreak() {
        // when
        DependencyGraph graph = DependencyGraph.of(template);

        // then
        assertThat(graph.topologicalOrder()).containsExactly(
            id("outline"), id("draft"), id("title"), id("review"), id("summary"));
    }

    @Test
    @DisplayName("실행 그룹은 의존 깊이별로 나뉜다")
    void executionGroups_byLevel() {
        // when
        DependencyGraph graph = DependencyGraph.of(template);

        // then
        assertThat(graph.executionGroups()).containsExactly(
            List.of(id("outline"), id("summary")),
            List.of(id("draft"), id("title")),
            List.of(id("review")));
    }

    @Test
    @DisplayName("임계 경로는 가장 긴 의존 체인이다")
    void criticalPath_longestChain() {
        // when
        DependencyGraph graph = DependencyGraph.of(template);

        // then
        assertThat(graph.criticalPath()).containsExactly(id("outline"), id("draft"), id("review"));
    }

    @Test
    @DisplayName("직접/전이적 의존과 하위 Stage를 조회한다")
    void relations() {
        // when
        DependencyGraph graph = DependencyGraph.of(template);

        // then
        assertThat(graph.dependentsOf(id("outline"))).containsExactly(id("draft"), id("title"));
        assertThat(graph.dependenciesOf(id("review"))).containsExactly(id("title"), id("draft"));
        assertThat(graph.transitiveDependenciesOf(id("review")))
            .containsExactlyInAnyOrder(id("title"), id("draft"), id("outline"));
        assertThat(graph.transitiveDependenciesOf(id("summary"))).isEmpty();
    }

    @Test
    @DisplayName("유효하지 않은 템플릿으로는 그래프를 만들 수 없다")
    void of_invalidTemplate_throws() {
        // given
        PipelineTemplate cyclic = PipelineTemplate.of("c", 1, List.of(
            StageDefinition.generate("a", "A").withDependsOn("b"),
            StageDefinition.generate("b", "B").withDependsOn("a")));

        // when & then
        assertThatThrownBy(() -> DependencyGraph.of(cyclic)).isInstanceOf(TemplateValidationException.class);
    }

    private static StageId id(String value) {
        return StageId.of(value);
    }
}

package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.adapter.runner.stage.TransformRegistry;
import com.ryuqq.conductor.core.exception.TemplateNotFoundException;
import com.ryuqq.conductor.core.exception.TemplateValidationException;
import com.ryuqq.conductor.core.graph.DependencyGraph;
import com.ryuqq.conductor.core.model.TemplateId;
import com.ryuqq.conductor.core.template.PipelineTemplate;
import com.ryuqq.conductor.core.template.StageDefinition;
import com.ryuqq.conductor.testkit.support.TemplateFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TemplateRegistry 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TemplateRegistryTest {

    private TemplateRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TemplateRegistry(TransformRegistry.withDefaults());
    }

    private static PipelineTemplate chainV2() {
        return PipelineTemplate.of("chain", 2, List.of(
            StageDefinition.generate("only", "only stage")));
    }

    @Test
    @DisplayName("등록한 템플릿을 버전별로 조회하고 최신 버전을 돌려준다")
    void register_versionsAndLatest() {
        // given
        registry.register(TemplateFixtures.chain());
        DependencyGraph v2 = registry.register(chainV2());

        // when
        DependencyGraph latest = registry.latest(TemplateId.of("chain"));

        // then
        assertThat(latest).isSameAs(v2);
        assertThat(registry.get(TemplateId.of("chain"), 1).template()).isEqualTo(TemplateFixtures.chain());
        assertThat(registry.versionsOf(TemplateId.of("chain"))).containsExactly(1, 2);
        assertThat(registry.versionsOf(TemplateId.of("missing"))).isEmpty();
    }

    @Test
    @DisplayName("같은 내용의 재등록은 기존 그래프를 돌려준다")
    void register_sameContentIdempotent() {
        // given
        DependencyGraph first = registry.register(TemplateFixtures.article());

        // when
        DependencyGraph again = registry.register(TemplateFixtures.article());

        // then
        assertThat(again).isSameAs(first);
    }

    @Test
    @DisplayName("같은 버전을 다른 내용으로 등록하면 거부된다")
    void register_conflictingContentRejected() {
        // given
        registry.register(TemplateFixtures.chain());
        PipelineTemplate changed = TemplateFixtures.chain().withName("renamed");

        // when & then
        assertThatThrownBy(() -> registry.register(changed))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("different content");
    }

    @Test
    @DisplayName("등록되지 않은 변환을 쓰는 템플릿은 거부된다")
    void register_unknownTransformRejected() {
        // given
        PipelineTemplate template = PipelineTemplate.of("bad", 1, List.of(
            StageDefinition.transform("shout", "reverse", "plain text")));

        // when & then
        assertThatThrownBy(() -> registry.register(template))
            .isInstanceOf(TemplateValidationException.class)
            .hasMessageContaining("reverse");
        assertThat(registry.versionsOf(TemplateId.of("bad"))).isEmpty();
    }

    @Test
    @DisplayName("등록되지 않은 템플릿과 버전은 찾을 수 없다")
    void lookup_unknownTemplate() {
        // given
        registry.register(TemplateFixtures.chain());

        // when & then
        assertThatThrownBy(() -> registry.latest(TemplateId.of("missing")))
            .isInstanceOf(TemplateNotFoundException.class);
        assertThatThrownBy(() -> registry.get(TemplateId.of("chain"), 7))
            .isInstanceOf(TemplateNotFoundException.class)
            .hasMessageContaining("chain@7");
    }
}

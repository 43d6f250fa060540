package com.ryuqq.conductor.testkit.support;

import com.ryuqq.conductor.core.template.InputSpec;
import com.ryuqq.conductor.core.template.PipelineTemplate;
import com.ryuqq.conductor.core.template.RetryPolicy;
import com.ryuqq.conductor.core.template.StageDefinition;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Ready-made pipeline templates for orchestrator tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TemplateFixtures {

    /**
     * Three attempts with millisecond backoff and no jitter.
     */
    public static final RetryPolicy FAST_RETRY = new RetryPolicy(3, 1, 5, 0.0);

    private TemplateFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Three stages with no dependencies.
     */
    public static PipelineTemplate independent() {
        return PipelineTemplate.of("independent", 1, List.of(
                StageDefinition.generate("alpha", "alpha about {{ inputs.topic }}").withRetryPolicy(FAST_RETRY),
                StageDefinition.generate("beta", "beta about {{ inputs.topic }}").withRetryPolicy(FAST_RETRY),
                StageDefinition.generate("gamma", "gamma about {{ inputs.topic }}").withRetryPolicy(FAST_RETRY)))
            .withInputs(InputSpec.required("topic"));
    }

    /**
     * {@code first -> second}; the second stage renders the first one's output.
     */
    public static PipelineTemplate chain() {
        return PipelineTemplate.of("chain", 1, List.of(
                StageDefinition.generate("first", "first about {{ inputs.topic }}").withRetryPolicy(FAST_RETRY),
                StageDefinition.generate("second", "second using {{ steps.first }}")
                    .withDependsOn("first")
                    .withRetryPolicy(FAST_RETRY)))
            .withInputs(InputSpec.required("topic"));
    }

    /**
     * {@code prep -> slow -> after}.
     */
    public static PipelineTemplate slowMiddle() {
        return PipelineTemplate.of("slow-middle", 1, List.of(
            StageDefinition.generate("prep", "prep work").withRetryPolicy(FAST_RETRY),
            StageDefinition.generate("slow", "slow work after {{ steps.prep }}")
                .withDependsOn("prep")
                .withRetryPolicy(FAST_RETRY),
            StageDefinition.generate("after", "after {{ steps.slow }}")
                .withDependsOn("slow")
                .withRetryPolicy(FAST_RETRY)));
    }

    /**
     * Outline, a user-picked title, a draft and a transform that assembles them.
     *
     * <pre>
     * outline -> title (USER_SELECTION, 3 candidates) -> article (TRANSFORM trim)
     * outline -> draft --------------------------------/
     * </pre>
     */
    public static PipelineTemplate article() {
        return PipelineTemplate.of("article", 1, List.of(
                StageDefinition.generate("outline", "Outline an article about {{ inputs.topic }} in a {{ inputs.tone }} tone")
                    .withModelPreference("{{ defaults.model }}", "gpt-4o-mini")
                    .withContextKeys("tone")
                    .withRetryPolicy(FAST_RETRY),
                StageDefinition.userSelection("title", "Title for {{ steps.outline }}", 3)
                    .withDependsOn("outline")
                    .withRetryPolicy(FAST_RETRY),
                StageDefinition.generate("draft", "Draft from {{ steps.outline }}")
                    .withDependsOn("outline")
                    .withRetryPolicy(FAST_RETRY),
                StageDefinition.transform("article", "trim", "# {{ steps.title }}\n\n{{ steps.draft }}")
                    .withDependsOn("title", "draft")))
            .withName("Article writer")
            .withInputs(InputSpec.required("topic"), InputSpec.choice("tone", "formal", "casual").withDefaultValue("formal"))
            .withDefaults(Map.of("model", "gpt-4o"));
    }

    /**
     * A single stage with a short per-attempt timeout.
     */
    public static PipelineTemplate timeBoxed(Duration timeout) {
        return PipelineTemplate.of("time-boxed", 1, List.of(
            StageDefinition.generate("only", "slow single stage")
                .withRetryPolicy(FAST_RETRY.withMaxAttempts(2))
                .withTimeout(timeout)));
    }
}

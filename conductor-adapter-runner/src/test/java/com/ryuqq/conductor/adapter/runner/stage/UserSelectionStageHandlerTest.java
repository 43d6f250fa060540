package com.ryuqq.conductor.adapter.runner.stage;

import com.ryuqq.conductor.adapter.runner.cache.CacheConfig;
import com.ryuqq.conductor.adapter.runner.cache.ResponseCache;
import com.ryuqq.conductor.core.model.ScopeId;
import com.ryuqq.conductor.core.model.TokenUsage;
import com.ryuqq.conductor.core.outcome.AwaitFeedback;
import com.ryuqq.conductor.core.outcome.StageOutcome;
import com.ryuqq.conductor.core.spi.CancellationToken;
import com.ryuqq.conductor.core.spi.GenerationCapability;
import com.ryuqq.conductor.core.spi.GenerationResult;
import com.ryuqq.conductor.core.state.RunState;
import com.ryuqq.conductor.core.state.RunStateProjector;
import com.ryuqq.conductor.core.template.PipelineTemplate;
import com.ryuqq.conductor.core.template.StageDefinition;
import com.ryuqq.conductor.testkit.support.EventFixtures;
import com.ryuqq.conductor.testkit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * UserSelectionStageHandler 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class UserSelectionStageHandlerTest {

    @Mock
    private GenerationCapability generation;

    private ResponseCache cache;
    private UserSelectionStageHandler handler;
    private StageContext context;

    @BeforeEach
    void setUp() {
        cache = new ResponseCache(new CacheConfig(), null, Runnable::run, new MutableClock(EventFixtures.BASE));
        handler = new UserSelectionStageHandler(generation, cache, ScopeId.of("test"));

        EventFixtures events = EventFixtures.forRun("run-1");
        RunState state = new RunStateProjector().replay(List.of(events.created("title"), events.started()));
        StageDefinition title = StageDefinition.userSelection("title", "Title for {{ inputs.topic }}", 3);
        context = StageContext.render(state, PipelineTemplate.of("fixture", 1, List.of(title)), title, 1,
            "gpt-4o-mini", new CancellationToken(), null);
    }

    private static CompletableFuture<GenerationResult> result(String text) {
        return CompletableFuture.completedFuture(new GenerationResult(text, "gpt-4o-mini", new TokenUsage(5, 3)));
    }

    @Test
    @DisplayName("후보를 순서대로 생성하고 사용자 선택을 기다린다")
    void execute_generatesCandidatesInOrder() {
        // given
        when(generation.invoke(any(), any(), any(), any()))
            .thenReturn(result("Cats rule"), result("Why cats"), result("Cat facts"));

        // when
        StageOutcome outcome = handler.execute(context).join();

        // then
        assertThat(outcome).isInstanceOf(AwaitFeedback.class);
        AwaitFeedback awaiting = (AwaitFeedback) outcome;
        assertThat(awaiting.candidates()).containsExactly("Cats rule", "Why cats", "Cat facts");
        assertThat(awaiting.tokenUsage()).isEqualTo(new TokenUsage(15, 9));
    }

    @Test
    @DisplayName("후보마다 캐시 키가 달라 재실행 시 후보 순서 그대로 캐시에서 제공된다")
    void execute_candidatesCachedSeparately() {
        // given
        when(generation.invoke(any(), any(), any(), any()))
            .thenReturn(result("Cats rule"), result("Why cats"), result("Cat facts"));
        handler.execute(context).join();

        // when
        AwaitFeedback again = (AwaitFeedback) handler.execute(context).join();

        // then
        assertThat(cache.stats().size()).isEqualTo(3);
        assertThat(again.candidates()).containsExactly("Cats rule", "Why cats", "Cat facts");
        assertThat(again.tokenUsage()).isEqualTo(TokenUsage.zero());
        verify(generation, times(3)).invoke(any(), any(), any(), any());
    }
}

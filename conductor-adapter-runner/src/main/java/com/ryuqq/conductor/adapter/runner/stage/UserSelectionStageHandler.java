package com.ryuqq.conductor.adapter.runner.stage;

import com.ryuqq.conductor.adapter.runner.cache.ResponseCache;
import com.ryuqq.conductor.core.model.ScopeId;
import com.ryuqq.conductor.core.model.TokenUsage;
import com.ryuqq.conductor.core.outcome.AwaitFeedback;
import com.ryuqq.conductor.core.outcome.StageOutcome;
import com.ryuqq.conductor.core.spi.GenerationCapability;
import com.ryuqq.conductor.core.state.StageOutput;
import com.ryuqq.conductor.core.template.StageKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * USER_SELECTION Stage: 후보를 생성한 뒤 사용자 선택을 기다림.
 *
 * <p>후보는 순서대로 하나씩 생성되며, 후보 인덱스가 캐시 컨텍스트에 포함되므로
 * 후보마다 캐시 키가 다릅니다. 선택은 {@code supplyFeedback}으로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class UserSelectionStageHandler implements StageHandler {

    static final String CANDIDATE_CONTEXT_KEY = "candidate";

    private final GenerationCall call;

    public UserSelectionStageHandler(GenerationCapability generation, ResponseCache cache, ScopeId scope) {
        this.call = new GenerationCall(generation, cache, scope);
    }

    @Override
    public StageKind kind() {
        return StageKind.USER_SELECTION;
    }

    @Override
    public CompletableFuture<StageOutcome> execute(StageContext context) {
        int count = context.definition().candidateCount();
        CompletableFuture<List<StageOutput>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (int i = 0; i < count; i++) {
            Map<String, String> candidateContext = new LinkedHashMap<>(context.cacheContext());
            candidateContext.put(CANDIDATE_CONTEXT_KEY, Integer.toString(i));
            chain = chain.thenCompose(outputs -> call.generate(context, candidateContext).thenApply(output -> {
                outputs.add(output);
                return outputs;
            }));
        }
        return chain.thenApply(outputs -> {
            List<String> candidates = new ArrayList<>();
            TokenUsage usage = TokenUsage.zero();
            for (StageOutput output : outputs) {
                candidates.add(output.text());
                usage = usage.plus(output.tokenUsage());
            }
            return new AwaitFeedback(candidates, usage);
        });
    }
}

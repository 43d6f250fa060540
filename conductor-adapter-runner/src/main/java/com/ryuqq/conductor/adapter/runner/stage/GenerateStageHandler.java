package com.ryuqq.conductor.adapter.runner.stage;

import com.ryuqq.conductor.adapter.runner.cache.ResponseCache;
import com.ryuqq.conductor.core.model.ScopeId;
import com.ryuqq.conductor.core.outcome.Ok;
import com.ryuqq.conductor.core.outcome.StageOutcome;
import com.ryuqq.conductor.core.spi.GenerationCapability;
import com.ryuqq.conductor.core.template.StageKind;

import java.util.concurrent.CompletableFuture;

/**
 * GENERATE Stage: 캐시 조회 후 miss이면 외부 생성 호출.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GenerateStageHandler implements StageHandler {

    private final GenerationCall call;

    public GenerateStageHandler(GenerationCapability generation, ResponseCache cache, ScopeId scope) {
        this.call = new GenerationCall(generation, cache, scope);
    }

    @Override
    public StageKind kind() {
        return StageKind.GENERATE;
    }

    @Override
    public CompletableFuture<StageOutcome> execute(StageContext context) {
        return call.generate(context, context.cacheContext()).thenApply(Ok::new);
    }
}

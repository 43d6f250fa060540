package com.ryuqq.conductor.adapter.runner.stage;

import com.ryuqq.conductor.adapter.runner.cache.ResponseCache;
import com.ryuqq.conductor.core.cache.CacheEntry;
import com.ryuqq.conductor.core.cache.CacheKey;
import com.ryuqq.conductor.core.model.ScopeId;
import com.ryuqq.conductor.core.model.TokenUsage;
import com.ryuqq.conductor.core.spi.GenerationCapability;
import com.ryuqq.conductor.core.spi.GenerationResult;
import com.ryuqq.conductor.core.state.StageOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * 캐시를 거치는 생성 호출 (read-through / write-through).
 *
 * <p>캐시 키는 렌더링된 프롬프트, 선호 모델 첫 항목, 컨텍스트, 격리 범위로 유도합니다.
 * 캐시 적중 출력의 토큰 사용량은 0으로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class GenerationCall {

    private static final Logger log = LoggerFactory.getLogger(GenerationCall.class);

    private final GenerationCapability generation;
    private final ResponseCache cache;
    private final ScopeId scope;

    GenerationCall(GenerationCapability generation, ResponseCache cache, ScopeId scope) {
        if (generation == null) {
            throw new IllegalArgumentException("generation cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        this.generation = generation;
        this.cache = cache;
        this.scope = scope;
    }

    CompletableFuture<StageOutput> generate(StageContext context, Map<String, String> cacheContext) {
        if (context.cancellation().isCancelled()) {
            return CompletableFuture.failedFuture(new CancellationException("Stage " + context.stageId() + " cancelled"));
        }

        CacheKey key = CacheKey.derive(context.prompt(), context.models().get(0), cacheContext, scope);
        Optional<CacheEntry> hit = cache.lookup(key);
        if (hit.isPresent()) {
            log.debug("Cache hit for stage {} of {} (key {})", context.stageId(), context.runId(), key);
            CacheEntry entry = hit.get();
            return CompletableFuture.completedFuture(
                StageOutput.cached(entry.text(), entry.model(), key, TokenUsage.zero())
            );
        }

        CompletableFuture<GenerationResult> call;
        try {
            call = generation.invoke(context.prompt(), context.models(), context.chunks(), context.cancellation());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (call == null) {
            return CompletableFuture.failedFuture(
                new IllegalStateException("Generation capability returned no future for stage " + context.stageId())
            );
        }
        return call.thenApply(result -> {
            cache.store(key, scope, result.text(), result.model(), result.tokenUsage());
            return StageOutput.fresh(result.text(), result.model(), key, result.tokenUsage());
        });
    }
}

package com.ryuqq.conductor.adapter.runner.stage;

import com.ryuqq.conductor.core.exception.StageExecutionException;
import com.ryuqq.conductor.core.outcome.Ok;
import com.ryuqq.conductor.core.outcome.StageOutcome;
import com.ryuqq.conductor.core.state.StageError;
import com.ryuqq.conductor.core.state.StageOutput;
import com.ryuqq.conductor.core.template.StageKind;

import java.util.concurrent.CompletableFuture;

/**
 * TRANSFORM Stage: 렌더링된 프롬프트에 로컬 변환 함수를 적용.
 *
 * <p>변환은 결정적이므로 실패는 재시도하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransformStageHandler implements StageHandler {

    private final TransformRegistry registry;

    public TransformStageHandler(TransformRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    @Override
    public StageKind kind() {
        return StageKind.TRANSFORM;
    }

    @Override
    public CompletableFuture<StageOutcome> execute(StageContext context) {
        String name = context.definition().transformName();
        StageTransform transform = registry.find(name).orElse(null);
        if (transform == null) {
            return CompletableFuture.failedFuture(new StageExecutionException(
                StageError.TRANSFORM_FAILED, "Unknown transform '" + name + "'", false));
        }
        try {
            String text = transform.apply(context.prompt());
            if (text == null) {
                throw new StageExecutionException(
                    StageError.TRANSFORM_FAILED, "Transform '" + name + "' returned null", false);
            }
            return CompletableFuture.completedFuture(new Ok(StageOutput.transformed(text)));
        } catch (StageExecutionException e) {
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new StageExecutionException(
                StageError.TRANSFORM_FAILED, "Transform '" + name + "' failed: " + e.getMessage(), false, e));
        }
    }
}

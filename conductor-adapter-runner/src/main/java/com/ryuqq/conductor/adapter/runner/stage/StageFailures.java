package com.ryuqq.conductor.adapter.runner.stage;

import com.ryuqq.conductor.core.exception.StageExecutionException;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.outcome.Fail;
import com.ryuqq.conductor.core.outcome.Retry;
import com.ryuqq.conductor.core.outcome.StageOutcome;
import com.ryuqq.conductor.core.state.StageError;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 시도 실패 분류.
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ul>
 *   <li>{@link CancellationException} → Fail(CANCELLED)</li>
 *   <li>{@link TimeoutException} → Retry(TIMEOUT)</li>
 *   <li>{@link StageExecutionException} → retryable 플래그에 따라 Retry 또는 Fail</li>
 *   <li>그 외 예외 → Retry(GENERATION_FAILED)</li>
 * </ul>
 *
 * <p>Retry는 재시도 예산이 남아 있을 때만 재시도로 이어집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StageFailures {

    private StageFailures() {
    }

    public static StageOutcome classify(StageId stageId, int attempt, Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof CancellationException) {
            return new Fail(new StageError(stageId, attempt, StageError.CANCELLED, messageOf(cause, "cancelled")));
        }
        if (cause instanceof TimeoutException) {
            return new Retry(new StageError(stageId, attempt, StageError.TIMEOUT, messageOf(cause, "attempt timed out")));
        }
        if (cause instanceof StageExecutionException) {
            StageExecutionException e = (StageExecutionException) cause;
            StageError error = new StageError(stageId, attempt, e.getErrorCode(), messageOf(e, e.getErrorCode()));
            return e.isRetryable() ? new Retry(error) : new Fail(error);
        }
        return new Retry(new StageError(stageId, attempt, StageError.GENERATION_FAILED,
            messageOf(cause, cause.getClass().getSimpleName())));
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable throwable, String fallback) {
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? fallback : message;
    }
}

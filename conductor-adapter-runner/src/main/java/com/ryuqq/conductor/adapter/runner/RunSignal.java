package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.orchestrator.FeedbackSelection;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.outcome.StageOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Run 루프에 전달되는 신호.
 *
 * <p>Run 상태를 바꾸는 모든 요청은 신호로 큐에 들어가고, 루프 스레드 하나가 순서대로 처리합니다.
 * 응답이 필요한 신호는 {@code ack}로 처리 결과(또는 거부 사유)를 돌려줍니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
sealed interface RunSignal {

    /**
     * 응답이 필요한 신호.
     */
    sealed interface Acknowledged extends RunSignal {
        CompletableFuture<Void> ack();
    }

    /**
     * 시도 하나가 끝남 (결과 또는 분류된 실패).
     */
    record AttemptSettled(StageId stageId, int attempt, StageOutcome outcome) implements RunSignal {
    }

    /**
     * 재시도 지연이 끝남.
     */
    record RetryDue(StageId stageId, int failedAttempt) implements RunSignal {
    }

    record FeedbackSupplied(StageId stageId, FeedbackSelection selection, CompletableFuture<Void> ack)
        implements Acknowledged {
    }

    record CancelRequested(String reason) implements RunSignal {
    }

    record PauseRequested(CompletableFuture<Void> ack) implements Acknowledged {
    }

    record ResumeRequested(CompletableFuture<Void> ack) implements Acknowledged {
    }

    record SkipRequested(StageId stageId, CompletableFuture<Void> ack) implements Acknowledged {
    }

    /**
     * 종료 이벤트 없이 루프 중지 (프로세스 종료).
     */
    record Stop() implements RunSignal {
    }
}

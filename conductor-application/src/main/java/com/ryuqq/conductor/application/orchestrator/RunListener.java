package com.ryuqq.conductor.application.orchestrator;

import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.model.StageId;

/**
 * Run 이벤트 수신자.
 *
 * <p>한 Run의 이벤트는 시퀀스 순서대로, 같은 이벤트가 두 번 전달되지 않도록 호출됩니다.
 * 수신자가 던진 예외는 로그로 남고 Run 실행에는 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RunListener {

    /**
     * 기록된 이벤트.
     *
     * @param event 이벤트
     */
    void onEvent(RunEvent event);

    /**
     * 생성 중인 부분 출력. 이벤트 로그에는 기록되지 않습니다.
     *
     * @param stageId Stage ID
     * @param attempt 시도 번호
     * @param chunk 부분 텍스트
     */
    default void onChunk(StageId stageId, int attempt, String chunk) {
    }
}

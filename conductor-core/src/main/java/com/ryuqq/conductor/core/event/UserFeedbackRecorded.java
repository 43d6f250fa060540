package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;

import java.time.Instant;

/**
 * 사용자 선택 기록.
 *
 * @param candidateIndex 선택한 후보 인덱스 (직접 입력이면 -1)
 * @param text 확정된 텍스트
 * @param comment 사용자 코멘트 (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record UserFeedbackRecorded(RunId runId, long sequence, Instant occurredAt, StageId stageId,
                                   int candidateIndex, String text, String comment) implements RunEvent {

    public UserFeedbackRecorded {
        Events.requireHeader(runId, sequence, occurredAt);
        if (stageId == null) {
            throw new IllegalArgumentException("stageId cannot be null");
        }
        if (candidateIndex < -1) {
            throw new IllegalArgumentException("candidateIndex must be >= -1 (current: " + candidateIndex + ")");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
    }

    @Override
    public EventType type() {
        return EventType.USER_FEEDBACK_RECORDED;
    }
}

package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;

import java.time.Instant;

/**
 * 이벤트 record 공통 검증.
 */
final class Events {

    private Events() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static void requireHeader(RunId runId, long sequence, Instant occurredAt) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
    }

    static void requireStage(StageId stageId, int attempt) {
        if (stageId == null) {
            throw new IllegalArgumentException("stageId cannot be null");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
    }
}

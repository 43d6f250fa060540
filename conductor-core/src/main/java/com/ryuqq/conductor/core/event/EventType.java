package com.ryuqq.conductor.core.event;

/**
 * Run 이벤트 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EventType {
    RUN_CREATED,
    RUN_STARTED,
    RUN_PAUSED,
    RUN_RESUMED,
    STAGE_STARTED,
    STAGE_COMPLETED,
    STAGE_FAILED,
    STAGE_RETRIED,
    STAGE_SKIPPED,
    STAGE_AWAITING_FEEDBACK,
    USER_FEEDBACK_RECORDED,
    RUN_COMPLETED,
    RUN_FAILED,
    RUN_CANCELLED,
    STATE_SNAPSHOT;

    /**
     * Run을 종료시키는 이벤트인지 확인.
     *
     * @return RUN_COMPLETED, RUN_FAILED, RUN_CANCELLED이면 true
     */
    public boolean isRunTerminal() {
        return this == RUN_COMPLETED || this == RUN_FAILED || this == RUN_CANCELLED;
    }
}

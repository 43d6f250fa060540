package com.ryuqq.conductor.application.orchestrator;

/**
 * Run 이벤트 구독 핸들.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    /**
     * 구독 해지. 여러 번 호출해도 안전합니다.
     */
    @Override
    void close();

    /**
     * 구독 활성 여부.
     *
     * @return 해지되지 않았으면 true
     */
    boolean isActive();
}

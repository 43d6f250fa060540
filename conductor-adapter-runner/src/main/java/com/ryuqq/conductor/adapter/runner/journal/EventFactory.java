package com.ryuqq.conductor.adapter.runner.journal;

import com.ryuqq.conductor.core.event.RunEvent;

import java.time.Instant;

/**
 * 시퀀스와 시각이 정해진 뒤 이벤트를 만드는 함수.
 *
 * <p>시퀀스는 {@link RunJournal}만 부여합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventFactory {

    RunEvent create(long sequence, Instant occurredAt);
}

package com.ryuqq.conductor.core.outcome;

import com.ryuqq.conductor.core.state.StageOutput;

/**
 * 성공적으로 완료된 Stage 시도.
 *
 * @param output Stage 출력
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok(StageOutput output) implements StageOutcome {

    public Ok {
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
    }
}

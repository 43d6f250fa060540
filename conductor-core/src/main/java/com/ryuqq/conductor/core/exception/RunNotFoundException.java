package com.ryuqq.conductor.core.exception;

import com.ryuqq.conductor.core.model.RunId;

/**
 * 이벤트 로그에 존재하지 않는 Run 조회.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RunNotFoundException extends ConductorException {

    private final RunId runId;

    public RunNotFoundException(RunId runId) {
        super("Run not found: " + runId);
        this.runId = runId;
    }

    public RunId getRunId() {
        return runId;
    }
}

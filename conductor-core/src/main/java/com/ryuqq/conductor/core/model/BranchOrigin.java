package com.ryuqq.conductor.core.model;

/**
 * 분기된 Run의 부모 포인터.
 *
 * <p>자식 Run은 부모 이벤트 로그의 {@code 1..branchSequence} 구간을 복사 없이
 * 공유하고, 자신의 이벤트는 {@code branchSequence + 1}부터 이어서 기록합니다.</p>
 *
 * @param parentRunId 부모 Run ID
 * @param branchSequence 분기 지점 시퀀스 번호 (1 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BranchOrigin(RunId parentRunId, long branchSequence) {

    public BranchOrigin {
        if (parentRunId == null) {
            throw new IllegalArgumentException("parentRunId cannot be null");
        }
        if (branchSequence < 1) {
            throw new IllegalArgumentException("branchSequence must be positive (current: " + branchSequence + ")");
        }
    }
}

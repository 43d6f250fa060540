package com.ryuqq.conductor.core.event;

import com.ryuqq.conductor.core.model.BranchOrigin;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.model.TemplateId;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Run 생성.
 *
 * <p>일반 Run에서는 시퀀스 1의 첫 이벤트입니다. 분기 Run에서는 {@code origin}이 부모를
 * 가리키고 시퀀스는 {@code origin.branchSequence() + 1}입니다.</p>
 *
 * @param runId Run ID
 * @param sequence 시퀀스 번호
 * @param occurredAt 발생 시각
 * @param templateId 템플릿 ID
 * @param templateVersion 템플릿 버전
 * @param inputs 해석된 입력값
 * @param stageIds 템플릿 선언 순서의 Stage ID 목록
 * @param origin 분기 원점 (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunCreated(
    RunId runId,
    long sequence,
    Instant occurredAt,
    TemplateId templateId,
    int templateVersion,
    Map<String, String> inputs,
    List<StageId> stageIds,
    BranchOrigin origin
) implements RunEvent {

    public RunCreated {
        Events.requireHeader(runId, sequence, occurredAt);
        if (templateId == null) {
            throw new IllegalArgumentException("templateId cannot be null");
        }
        if (stageIds == null || stageIds.isEmpty()) {
            throw new IllegalArgumentException("stageIds cannot be null or empty");
        }
        if (origin != null && sequence != origin.branchSequence() + 1) {
            throw new IllegalArgumentException(
                "branched RunCreated must follow the branch point (sequence: " + sequence
                    + ", branchSequence: " + origin.branchSequence() + ")"
            );
        }
        if (origin == null && sequence != 1) {
            throw new IllegalArgumentException("RunCreated must be the first event (sequence: " + sequence + ")");
        }
        inputs = inputs == null ? Map.of() : Map.copyOf(inputs);
        stageIds = List.copyOf(stageIds);
    }

    @Override
    public EventType type() {
        return EventType.RUN_CREATED;
    }

    /**
     * 분기 Run 생성 이벤트인지 확인.
     *
     * @return origin이 있으면 true
     */
    public boolean isBranch() {
        return origin != null;
    }
}

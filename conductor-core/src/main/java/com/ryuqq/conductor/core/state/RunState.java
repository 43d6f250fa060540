package com.ryuqq.conductor.core.state;

import com.ryuqq.conductor.core.model.BranchOrigin;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.model.TemplateId;
import com.ryuqq.conductor.core.model.TokenUsage;
import com.ryuqq.conductor.core.statemachine.RunStatus;
import com.ryuqq.conductor.core.statemachine.StageStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 이벤트 로그에서 유도된 Run 상태 (불변).
 *
 * <p>Run 상태는 직접 수정되지 않고, 항상 {@link RunStateProjector}가 이벤트를
 * 순서대로 접어서(fold) 만들어 냅니다. 같은 이벤트 열을 다시 접으면 항상
 * {@code equals}가 성립하는 동일한 상태가 나옵니다.</p>
 *
 * @param runId Run ID
 * @param templateId 템플릿 ID
 * @param templateVersion 템플릿 버전
 * @param inputs 해석된 입력값
 * @param status Run 상태
 * @param createdAt 생성 시각
 * @param stages Stage별 실행 기록 (템플릿 선언 순서)
 * @param origin 분기 원점 (분기 Run이 아니면 null)
 * @param errors Stage 오류 체인 (발생 순서)
 * @param inFlightAtCancel 취소 시점에 진행 중이던 Stage 목록
 * @param failureReason Run 실패 사유 (nullable)
 * @param tokenUsage 누적 토큰 사용량
 * @param lastSequence 마지막으로 접은 이벤트 시퀀스 번호
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunState(
    RunId runId,
    TemplateId templateId,
    int templateVersion,
    Map<String, String> inputs,
    RunStatus status,
    Instant createdAt,
    Map<StageId, StageExecution> stages,
    BranchOrigin origin,
    List<StageError> errors,
    List<StageId> inFlightAtCancel,
    String failureReason,
    TokenUsage tokenUsage,
    long lastSequence
) {

    public RunState {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (templateId == null) {
            throw new IllegalArgumentException("templateId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (lastSequence < 0) {
            throw new IllegalArgumentException("lastSequence must be non-negative (current: " + lastSequence + ")");
        }
        inputs = inputs == null ? Map.of() : Map.copyOf(inputs);
        stages = stages == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stages));
        errors = errors == null ? List.of() : List.copyOf(errors);
        inFlightAtCancel = inFlightAtCancel == null ? List.of() : List.copyOf(inFlightAtCancel);
        tokenUsage = tokenUsage == null ? TokenUsage.zero() : tokenUsage;
    }

    /**
     * Stage 실행 기록 조회.
     *
     * @param stageId Stage ID
     * @return 실행 기록
     * @throws IllegalStateException 존재하지 않는 Stage인 경우
     */
    public StageExecution stage(StageId stageId) {
        StageExecution execution = stages.get(stageId);
        if (execution == null) {
            throw new IllegalStateException("Unknown stage " + stageId + " in run " + runId);
        }
        return execution;
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED이면 true
     */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * 특정 상태의 Stage 목록 (선언 순서).
     *
     * @param stageStatus 상태
     * @return Stage ID 목록
     */
    public List<StageId> stagesWith(StageStatus stageStatus) {
        List<StageId> result = new ArrayList<>();
        for (StageExecution execution : stages.values()) {
            if (execution.status() == stageStatus) {
                result.add(execution.stageId());
            }
        }
        return result;
    }

    /**
     * 최종 실패한 Stage (재시도가 남지 않은 FAILED 중 마지막 것).
     *
     * @return 실패한 Stage 기록 (없으면 empty)
     */
    public Optional<StageExecution> failedStage() {
        StageExecution last = null;
        for (StageExecution execution : stages.values()) {
            if (execution.status() == StageStatus.FAILED && !execution.retryScheduled()) {
                if (last == null || isLater(execution.finishedAt(), last.finishedAt())) {
                    last = execution;
                }
            }
        }
        return Optional.ofNullable(last);
    }

    /**
     * 완료된 Stage의 출력 텍스트 조회.
     *
     * @param stageId Stage ID
     * @return 출력 텍스트 (완료되지 않았으면 empty)
     */
    public Optional<String> outputOf(StageId stageId) {
        StageExecution execution = stages.get(stageId);
        if (execution == null || execution.output() == null) {
            return Optional.empty();
        }
        return Optional.of(execution.output().text());
    }

    private static boolean isLater(Instant candidate, Instant current) {
        if (candidate == null) {
            return false;
        }
        return current == null || !candidate.isBefore(current);
    }

    RunState withStatus(RunStatus status) {
        return new RunState(runId, templateId, templateVersion, inputs, status, createdAt, stages, origin,
            errors, inFlightAtCancel, failureReason, tokenUsage, lastSequence);
    }

    RunState withStage(StageExecution execution) {
        Map<StageId, StageExecution> copy = new LinkedHashMap<>(stages);
        copy.put(execution.stageId(), execution);
        return new RunState(runId, templateId, templateVersion, inputs, status, createdAt, copy, origin,
            errors, inFlightAtCancel, failureReason, tokenUsage, lastSequence);
    }

    RunState withStages(Map<StageId, StageExecution> stages) {
        return new RunState(runId, templateId, templateVersion, inputs, status, createdAt, stages, origin,
            errors, inFlightAtCancel, failureReason, tokenUsage, lastSequence);
    }

    RunState withError(StageError error) {
        List<StageError> copy = new ArrayList<>(errors);
        copy.add(error);
        return new RunState(runId, templateId, templateVersion, inputs, status, createdAt, stages, origin,
            copy, inFlightAtCancel, failureReason, tokenUsage, lastSequence);
    }

    RunState withTokenUsage(TokenUsage tokenUsage) {
        return new RunState(runId, templateId, templateVersion, inputs, status, createdAt, stages, origin,
            errors, inFlightAtCancel, failureReason, tokenUsage, lastSequence);
    }

    RunState withFailureReason(String failureReason) {
        return new RunState(runId, templateId, templateVersion, inputs, status, createdAt, stages, origin,
            errors, inFlightAtCancel, failureReason, tokenUsage, lastSequence);
    }

    RunState withInFlightAtCancel(List<StageId> inFlightAtCancel) {
        return new RunState(runId, templateId, templateVersion, inputs, status, createdAt, stages, origin,
            errors, inFlightAtCancel, failureReason, tokenUsage, lastSequence);
    }

    /**
     * 시퀀스 번호만 변경한 새 인스턴스.
     *
     * @param lastSequence 마지막 시퀀스 번호
     * @return 새 RunState
     */
    public RunState withLastSequence(long lastSequence) {
        return new RunState(runId, templateId, templateVersion, inputs, status, createdAt, stages, origin,
            errors, inFlightAtCancel, failureReason, tokenUsage, lastSequence);
    }

    /**
     * 분기 Run의 시작 상태.
     *
     * <p>완료된 Stage와 명시적으로 건너뛴 Stage만 유지하고, 나머지는 자식 Run에서
     * 다시 실행되도록 대기 상태로 되돌립니다.</p>
     */
    RunState branchedAs(RunId childRunId, BranchOrigin childOrigin, Instant childCreatedAt) {
        Map<StageId, StageExecution> copy = new LinkedHashMap<>();
        for (StageExecution execution : stages.values()) {
            boolean keep = execution.status() == StageStatus.COMPLETED
                || (execution.status() == StageStatus.SKIPPED && execution.skipReason() == SkipReason.EXPLICIT);
            copy.put(execution.stageId(), keep ? execution : execution.resetForBranch());
        }
        return new RunState(childRunId, templateId, templateVersion, inputs, RunStatus.PENDING, childCreatedAt, copy,
            childOrigin, List.of(), List.of(), null, tokenUsage, lastSequence);
    }
}

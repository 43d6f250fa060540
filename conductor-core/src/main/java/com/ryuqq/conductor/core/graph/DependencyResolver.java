package com.ryuqq.conductor.core.graph;

import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.state.RunState;
import com.ryuqq.conductor.core.state.SkipReason;
import com.ryuqq.conductor.core.state.StageExecution;
import com.ryuqq.conductor.core.statemachine.StageStatus;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Run 상태에서 다음에 실행할 Stage를 계산.
 *
 * <p><strong>의존성 판정:</strong></p>
 * <ul>
 *   <li>충족: COMPLETED, 명시적 SKIPPED, 재시도가 남지 않은 선택(optional) Stage의 FAILED</li>
 *   <li>차단: 재시도가 남지 않은 필수 Stage의 FAILED, 상위 실패로 인한 SKIPPED, CANCELLED</li>
 *   <li>그 외(WAITING, RUNNING, AWAITING_FEEDBACK, 재시도 대기): 아직 미정</li>
 * </ul>
 *
 * <p>차단된 의존을 가진 WAITING Stage는 건너뛰기 대상이 되며, 같은 해석 안에서
 * 위상 순서로 하위 Stage까지 전파됩니다. 결과는 순수 함수로 계산되고
 * 상태를 바꾸지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DependencyResolver {

    private final DependencyGraph graph;

    public DependencyResolver(DependencyGraph graph) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        this.graph = graph;
    }

    /**
     * 다음 실행 Stage 계산.
     *
     * @param state 현재 Run 상태
     * @param availableSlots 새로 시작할 수 있는 Stage 수 (0 이하면 runnable은 비어 있음)
     * @return 해석 결과
     */
    public Resolution resolve(RunState state, int availableSlots) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }

        Set<StageId> skippedNow = new HashSet<>();
        List<Resolution.Skip> skipped = new ArrayList<>();
        List<StageId> eligible = new ArrayList<>();
        List<StageId> failedRequired = new ArrayList<>();
        int waiting = 0;
        int active = 0;

        for (StageId stageId : graph.topologicalOrder()) {
            StageExecution execution = state.stage(stageId);
            if (execution.isActive()) {
                active++;
            }
            if (execution.status() == StageStatus.FAILED && execution.isSettled()
                && !graph.definition(stageId).optional()) {
                failedRequired.add(stageId);
            }
            if (execution.status() != StageStatus.WAITING) {
                continue;
            }

            StageId blocker = null;
            boolean ready = true;
            for (StageId dependency : graph.dependenciesOf(stageId)) {
                if (skippedNow.contains(dependency) || blocks(dependency, state.stage(dependency))) {
                    blocker = dependency;
                    break;
                }
                if (!satisfies(dependency, state.stage(dependency))) {
                    ready = false;
                }
            }

            if (blocker != null) {
                skippedNow.add(stageId);
                skipped.add(new Resolution.Skip(stageId, blocker));
            } else if (ready) {
                eligible.add(stageId);
                waiting++;
            } else {
                waiting++;
            }
        }

        eligible.sort((a, b) -> Integer.compare(graph.declarationIndexOf(a), graph.declarationIndexOf(b)));
        List<StageId> runnable = availableSlots <= 0
            ? List.of()
            : eligible.subList(0, Math.min(availableSlots, eligible.size()));

        boolean exhausted = waiting == 0 && active == 0;
        boolean stuck = waiting > 0 && eligible.isEmpty() && active == 0;
        return new Resolution(runnable, skipped, failedRequired, exhausted, stuck);
    }

    private boolean satisfies(StageId stageId, StageExecution execution) {
        switch (execution.status()) {
            case COMPLETED:
                return true;
            case SKIPPED:
                return execution.skipReason() == SkipReason.EXPLICIT;
            case FAILED:
                return execution.isSettled() && graph.definition(stageId).optional();
            default:
                return false;
        }
    }

    private boolean blocks(StageId stageId, StageExecution execution) {
        switch (execution.status()) {
            case FAILED:
                return execution.isSettled() && !graph.definition(stageId).optional();
            case SKIPPED:
                return execution.skipReason() != SkipReason.EXPLICIT;
            case CANCELLED:
                return true;
            default:
                return false;
        }
    }

    public DependencyGraph graph() {
        return graph;
    }
}

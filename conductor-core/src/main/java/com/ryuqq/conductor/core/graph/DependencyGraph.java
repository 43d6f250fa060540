package com.ryuqq.conductor.core.graph;

import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.template.PipelineTemplate;
import com.ryuqq.conductor.core.template.StageDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 검증된 템플릿의 Stage 의존성 그래프 (불변).
 *
 * <p>{@link #of(PipelineTemplate)}는 {@link TemplateValidator}로 템플릿을 먼저 검증하므로,
 * 인스턴스가 존재한다면 그래프는 항상 DAG입니다.</p>
 *
 * <p><strong>제공 정보:</strong></p>
 * <ul>
 *   <li>위상 정렬 순서 (동률이면 선언 순서)</li>
 *   <li>실행 그룹 (같은 그룹의 Stage끼리는 의존 관계 없음)</li>
 *   <li>임계 경로 (가장 긴 의존 체인)</li>
 *   <li>직접/전이적 의존 및 하위 Stage</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DependencyGraph {

    private final PipelineTemplate template;
    private final Map<StageId, StageDefinition> definitions;
    private final Map<StageId, Integer> declarationIndex;
    private final Map<StageId, List<StageId>> dependents;
    private final Map<StageId, Set<StageId>> transitive;
    private final List<StageId> topologicalOrder;
    private final List<List<StageId>> executionGroups;

    private DependencyGraph(PipelineTemplate template) {
        this.template = template;

        Map<StageId, StageDefinition> defs = new LinkedHashMap<>();
        Map<StageId, Integer> index = new HashMap<>();
        Map<StageId, List<StageId>> down = new LinkedHashMap<>();
        for (StageDefinition stage : template.stages()) {
            index.put(stage.id(), defs.size());
            defs.put(stage.id(), stage);
            down.put(stage.id(), new ArrayList<>());
        }
        for (StageDefinition stage : template.stages()) {
            for (StageId dependency : stage.dependsOn()) {
                down.get(dependency).add(stage.id());
            }
        }
        Map<StageId, Set<StageId>> closure = new HashMap<>();
        for (StageId stageId : defs.keySet()) {
            closure.put(stageId, Collections.unmodifiableSet(TemplateValidator.transitiveDependencies(stageId, defs)));
        }
        Map<StageId, List<StageId>> frozenDown = new LinkedHashMap<>();
        for (Map.Entry<StageId, List<StageId>> entry : down.entrySet()) {
            frozenDown.put(entry.getKey(), List.copyOf(entry.getValue()));
        }

        this.definitions = Collections.unmodifiableMap(defs);
        this.declarationIndex = Collections.unmodifiableMap(index);
        this.dependents = Collections.unmodifiableMap(frozenDown);
        this.transitive = Collections.unmodifiableMap(closure);
        this.topologicalOrder = List.copyOf(kahn());
        this.executionGroups = groups();
    }

    /**
     * 템플릿을 검증하고 그래프 생성.
     *
     * @param template 템플릿
     * @return DependencyGraph
     * @throws com.ryuqq.conductor.core.exception.TemplateValidationException 템플릿이 유효하지 않은 경우
     */
    public static DependencyGraph of(PipelineTemplate template) {
        TemplateValidator.validate(template);
        return new DependencyGraph(template);
    }

    // Kahn 알고리즘: 진입 차수 0인 Stage 중 선언 순서가 가장 빠른 것부터
    private List<StageId> kahn() {
        Map<StageId, Integer> inDegree = new HashMap<>();
        for (StageDefinition stage : definitions.values()) {
            inDegree.put(stage.id(), stage.dependsOn().size());
        }
        List<StageId> ready = new ArrayList<>();
        for (StageId stageId : definitions.keySet()) {
            if (inDegree.get(stageId) == 0) {
                ready.add(stageId);
            }
        }
        List<StageId> order = new ArrayList<>(definitions.size());
        while (!ready.isEmpty()) {
            ready.sort((a, b) -> Integer.compare(declarationIndex.get(a), declarationIndex.get(b)));
            StageId next = ready.remove(0);
            order.add(next);
            for (StageId dependent : dependents.get(next)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }
        return order;
    }

    private List<List<StageId>> groups() {
        Map<StageId, Integer> level = new HashMap<>();
        int maxLevel = 0;
        for (StageId stageId : topologicalOrder) {
            int current = 0;
            for (StageId dependency : definitions.get(stageId).dependsOn()) {
                current = Math.max(current, level.get(dependency) + 1);
            }
            level.put(stageId, current);
            maxLevel = Math.max(maxLevel, current);
        }
        List<List<StageId>> result = new ArrayList<>();
        for (int i = 0; i <= maxLevel; i++) {
            List<StageId> group = new ArrayList<>();
            for (StageId stageId : definitions.keySet()) {
                if (level.get(stageId) == i) {
                    group.add(stageId);
                }
            }
            result.add(List.copyOf(group));
        }
        return List.copyOf(result);
    }

    /**
     * 임계 경로 (가장 긴 의존 체인, 루트 → 말단).
     *
     * <p>길이가 같으면 선언 순서가 빠른 Stage를 택합니다.</p>
     *
     * @return Stage ID 목록
     */
    public List<StageId> criticalPath() {
        Map<StageId, Integer> length = new HashMap<>();
        Map<StageId, StageId> previous = new HashMap<>();
        StageId end = null;
        for (StageId stageId : topologicalOrder) {
            int best = 1;
            StageId via = null;
            for (StageId dependency : definitions.get(stageId).dependsOn()) {
                int candidate = length.get(dependency) + 1;
                if (candidate > best || (candidate == best && via != null && earlier(dependency, via))) {
                    best = candidate;
                    via = dependency;
                }
            }
            length.put(stageId, best);
            if (via != null) {
                previous.put(stageId, via);
            }
            if (end == null || best > length.get(end) || (best == length.get(end) && earlier(stageId, end))) {
                end = stageId;
            }
        }

        List<StageId> path = new ArrayList<>();
        for (StageId cursor = end; cursor != null; cursor = previous.get(cursor)) {
            path.add(0, cursor);
        }
        return path;
    }

    private boolean earlier(StageId a, StageId b) {
        return declarationIndex.get(a) < declarationIndex.get(b);
    }

    public PipelineTemplate template() {
        return template;
    }

    /**
     * Stage 정의 조회.
     *
     * @param stageId Stage ID
     * @return 정의
     * @throws IllegalArgumentException 알 수 없는 Stage인 경우
     */
    public StageDefinition definition(StageId stageId) {
        StageDefinition definition = definitions.get(stageId);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown stage " + stageId + " in template " + template.ref());
        }
        return definition;
    }

    public List<StageId> stageIds() {
        return List.copyOf(definitions.keySet());
    }

    public List<StageId> dependenciesOf(StageId stageId) {
        return definition(stageId).dependsOn();
    }

    public List<StageId> dependentsOf(StageId stageId) {
        definition(stageId);
        return dependents.get(stageId);
    }

    public Set<StageId> transitiveDependenciesOf(StageId stageId) {
        definition(stageId);
        return transitive.get(stageId);
    }

    public List<StageId> topologicalOrder() {
        return topologicalOrder;
    }

    public List<List<StageId>> executionGroups() {
        return executionGroups;
    }

    /**
     * 선언 순서 비교용 인덱스.
     *
     * @param stageId Stage ID
     * @return 0부터 시작하는 선언 위치
     */
    public int declarationIndexOf(StageId stageId) {
        definition(stageId);
        return declarationIndex.get(stageId);
    }
}

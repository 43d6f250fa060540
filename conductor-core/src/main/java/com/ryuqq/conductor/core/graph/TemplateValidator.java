package com.ryuqq.conductor.core.graph;

import com.ryuqq.conductor.core.exception.TemplateValidationException;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.template.InputSpec;
import com.ryuqq.conductor.core.template.PipelineTemplate;
import com.ryuqq.conductor.core.template.PromptTemplate;
import com.ryuqq.conductor.core.template.StageDefinition;
import com.ryuqq.conductor.core.template.TemplateReference;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 파이프라인 템플릿 구조 검증.
 *
 * <p>템플릿 등록 시 한 번만 수행되며, Run마다 반복하지 않습니다.
 * 발견된 모든 문제를 모아 하나의 {@link TemplateValidationException}으로 보고합니다.</p>
 *
 * <p><strong>검증 항목:</strong></p>
 * <ul>
 *   <li>Stage ID 중복</li>
 *   <li>존재하지 않는 Stage에 대한 의존성</li>
 *   <li>의존성 순환 (경로 포함 보고: {@code a -> b -> a})</li>
 *   <li>알 수 없는 네임스페이스의 자리표시자</li>
 *   <li>선언되지 않은 {@code inputs.x}, {@code defaults.x} 참조</li>
 *   <li>(전이적) 의존 Stage가 아닌 {@code steps.x} 참조</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TemplateValidator {

    // Utility class - prevent instantiation
    private TemplateValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 템플릿 검증.
     *
     * @param template 템플릿
     * @throws TemplateValidationException 문제가 하나라도 있는 경우
     */
    public static void validate(PipelineTemplate template) {
        List<String> problems = problemsOf(template);
        if (!problems.isEmpty()) {
            throw new TemplateValidationException(template.ref(), problems);
        }
    }

    /**
     * 템플릿의 문제 목록 (예외 없이).
     *
     * @param template 템플릿
     * @return 문제 목록 (유효하면 빈 목록)
     */
    public static List<String> problemsOf(PipelineTemplate template) {
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        List<String> problems = new ArrayList<>();

        Map<StageId, StageDefinition> stages = new LinkedHashMap<>();
        for (StageDefinition stage : template.stages()) {
            if (stages.putIfAbsent(stage.id(), stage) != null) {
                problems.add("duplicate stage id '" + stage.id().getValue() + "'");
            }
        }

        for (StageDefinition stage : stages.values()) {
            for (StageId dependency : stage.dependsOn()) {
                if (!stages.containsKey(dependency)) {
                    problems.add("stage '" + stage.id().getValue() + "' depends on unknown stage '"
                        + dependency.getValue() + "'");
                }
            }
        }

        List<StageId> cycle = findCycle(stages);
        if (!cycle.isEmpty()) {
            problems.add("dependency cycle: " + formatPath(cycle));
        }

        Set<String> inputKeys = new HashSet<>();
        for (InputSpec input : template.inputs()) {
            if (!inputKeys.add(input.key())) {
                problems.add("duplicate input '" + input.key() + "'");
            }
        }

        for (StageDefinition stage : stages.values()) {
            Set<StageId> upstream = transitiveDependencies(stage.id(), stages);
            checkReferences(stage, stage.prompt(), inputKeys, template.defaults(), upstream, stages, problems);
            for (String model : stage.modelPreference()) {
                checkReferences(stage, PromptTemplate.of(model), inputKeys, template.defaults(), upstream, stages, problems);
            }
        }
        return problems;
    }

    private static void checkReferences(
        StageDefinition stage,
        PromptTemplate prompt,
        Set<String> inputKeys,
        Map<String, String> defaults,
        Set<StageId> upstream,
        Map<StageId, StageDefinition> stages,
        List<String> problems
    ) {
        String owner = "stage '" + stage.id().getValue() + "'";
        for (String unknown : prompt.getUnresolvable()) {
            problems.add(owner + " uses unknown placeholder namespace " + unknown);
        }
        for (TemplateReference ref : prompt.getReferences()) {
            switch (ref.namespace()) {
                case INPUTS:
                    if (!inputKeys.contains(ref.key())) {
                        problems.add(owner + " references undeclared input '" + ref.key() + "'");
                    }
                    break;
                case DEFAULTS:
                    if (!defaults.containsKey(ref.key())) {
                        problems.add(owner + " references undeclared default '" + ref.key() + "'");
                    }
                    break;
                case STEPS:
                    StageId target = stageIdOrNull(ref.key());
                    if (target == null || !stages.containsKey(target)) {
                        problems.add(owner + " references unknown stage output '" + ref.key() + "'");
                    } else if (!upstream.contains(target)) {
                        problems.add(owner + " references output of '" + ref.key()
                            + "' which is not one of its dependencies");
                    }
                    break;
                default:
                    throw new IllegalStateException("Unknown namespace: " + ref.namespace());
            }
        }
    }

    /**
     * 전이적 의존 Stage 집합 (자신 제외). 순환이 있어도 종료합니다.
     */
    static Set<StageId> transitiveDependencies(StageId stageId, Map<StageId, StageDefinition> stages) {
        Set<StageId> visited = new LinkedHashSet<>();
        Deque<StageId> pending = new ArrayDeque<>();
        StageDefinition start = stages.get(stageId);
        if (start == null) {
            return visited;
        }
        pending.addAll(start.dependsOn());
        while (!pending.isEmpty()) {
            StageId next = pending.pop();
            if (next.equals(stageId) || !visited.add(next)) {
                continue;
            }
            StageDefinition definition = stages.get(next);
            if (definition != null) {
                pending.addAll(definition.dependsOn());
            }
        }
        return visited;
    }

    /**
     * 선언 순서로 DFS를 수행해 처음 발견한 순환 경로를 반환.
     *
     * @return {@code [a, b, a]} 형태의 경로 (순환이 없으면 빈 목록)
     */
    static List<StageId> findCycle(Map<StageId, StageDefinition> stages) {
        Map<StageId, Integer> color = new HashMap<>();
        Deque<StageId> path = new ArrayDeque<>();
        for (StageId root : stages.keySet()) {
            List<StageId> cycle = visit(root, stages, color, path);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        return List.of();
    }

    // 0 = unvisited, 1 = on path, 2 = done
    private static List<StageId> visit(StageId node, Map<StageId, StageDefinition> stages,
                                       Map<StageId, Integer> color, Deque<StageId> path) {
        int state = color.getOrDefault(node, 0);
        if (state == 2) {
            return List.of();
        }
        if (state == 1) {
            List<StageId> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (StageId onPath : (Iterable<StageId>) path::descendingIterator) {
                if (onPath.equals(node)) {
                    inCycle = true;
                }
                if (inCycle) {
                    cycle.add(onPath);
                }
            }
            cycle.add(node);
            return cycle;
        }

        StageDefinition definition = stages.get(node);
        if (definition == null) {
            return List.of();
        }
        color.put(node, 1);
        path.push(node);
        for (StageId dependency : definition.dependsOn()) {
            List<StageId> cycle = visit(dependency, stages, color, path);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        path.pop();
        color.put(node, 2);
        return List.of();
    }

    private static String formatPath(List<StageId> path) {
        StringBuilder out = new StringBuilder();
        for (StageId stageId : path) {
            if (out.length() > 0) {
                out.append(" -> ");
            }
            out.append(stageId.getValue());
        }
        return out.toString();
    }

    private static StageId stageIdOrNull(String value) {
        try {
            return StageId.of(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}

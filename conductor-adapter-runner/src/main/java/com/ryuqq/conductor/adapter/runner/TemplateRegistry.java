package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.adapter.runner.stage.TransformRegistry;
import com.ryuqq.conductor.core.exception.TemplateNotFoundException;
import com.ryuqq.conductor.core.exception.TemplateValidationException;
import com.ryuqq.conductor.core.graph.DependencyGraph;
import com.ryuqq.conductor.core.model.TemplateId;
import com.ryuqq.conductor.core.template.PipelineTemplate;
import com.ryuqq.conductor.core.template.StageDefinition;
import com.ryuqq.conductor.core.template.StageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 파이프라인 템플릿 등록소.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>등록 시 그래프 검증 (순환, 알 수 없는 의존, 잘못된 변수 참조, 없는 변환 이름)</li>
 *   <li>(id, version)은 한 번 등록되면 불변: 같은 내용의 재등록은 무시, 다른 내용은 거부</li>
 *   <li>버전을 지정하지 않으면 가장 높은 버전 사용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TemplateRegistry {

    private static final Logger log = LoggerFactory.getLogger(TemplateRegistry.class);

    private final TransformRegistry transforms;
    private final Map<TemplateId, NavigableMap<Integer, DependencyGraph>> templates = new ConcurrentHashMap<>();

    public TemplateRegistry(TransformRegistry transforms) {
        if (transforms == null) {
            throw new IllegalArgumentException("transforms cannot be null");
        }
        this.transforms = transforms;
    }

    /**
     * 템플릿 등록.
     *
     * @param template 템플릿
     * @return 검증된 의존성 그래프
     * @throws TemplateValidationException 템플릿이 유효하지 않은 경우
     * @throws IllegalStateException 같은 (id, version)이 다른 내용으로 이미 등록된 경우
     */
    public DependencyGraph register(PipelineTemplate template) {
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        DependencyGraph graph = DependencyGraph.of(template);
        checkTransforms(template);

        NavigableMap<Integer, DependencyGraph> versions =
            templates.computeIfAbsent(template.id(), id -> new ConcurrentSkipListMap<>());
        DependencyGraph existing = versions.putIfAbsent(template.version(), graph);
        if (existing != null) {
            if (!existing.template().equals(template)) {
                throw new IllegalStateException("Template " + template.ref() + " is already registered with different content");
            }
            return existing;
        }

        log.info("Template {} registered: {} stages, {} execution groups, critical path {}",
            template.ref(), template.stages().size(), graph.executionGroups().size(), graph.criticalPath());
        return graph;
    }

    /**
     * 최신 버전 조회.
     *
     * @throws TemplateNotFoundException 등록되지 않은 경우
     */
    public DependencyGraph latest(TemplateId templateId) {
        NavigableMap<Integer, DependencyGraph> versions = templates.get(templateId);
        if (versions == null || versions.isEmpty()) {
            throw new TemplateNotFoundException(templateId == null ? "null" : templateId.getValue());
        }
        return versions.lastEntry().getValue();
    }

    /**
     * 특정 버전 조회.
     *
     * @throws TemplateNotFoundException 등록되지 않은 경우
     */
    public DependencyGraph get(TemplateId templateId, int version) {
        NavigableMap<Integer, DependencyGraph> versions = templates.get(templateId);
        DependencyGraph graph = versions == null ? null : versions.get(version);
        if (graph == null) {
            throw new TemplateNotFoundException((templateId == null ? "null" : templateId.getValue()) + "@" + version);
        }
        return graph;
    }

    public List<Integer> versionsOf(TemplateId templateId) {
        NavigableMap<Integer, DependencyGraph> versions = templates.get(templateId);
        return versions == null ? List.of() : List.copyOf(versions.keySet());
    }

    private void checkTransforms(PipelineTemplate template) {
        List<String> problems = new ArrayList<>();
        for (StageDefinition stage : template.stages()) {
            if (stage.kind() == StageKind.TRANSFORM && !transforms.contains(stage.transformName())) {
                problems.add("Stage '" + stage.id().getValue() + "' uses unknown transform '" + stage.transformName() + "'");
            }
        }
        if (!problems.isEmpty()) {
            throw new TemplateValidationException(template.ref(), problems);
        }
    }
}

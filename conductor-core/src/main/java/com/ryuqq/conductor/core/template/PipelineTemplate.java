package com.ryuqq.conductor.core.template;

import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.model.TemplateId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 버전이 있는 불변 파이프라인 템플릿.
 *
 * <p>Stage 목록의 순서가 선언 순서이며, 동시에 실행 가능한 Stage들의
 * 우선순위(tie-break)로 사용됩니다. 구조적 검증(순환, 미존재 참조 등)은
 * {@code TemplateValidator}가 담당합니다.</p>
 *
 * @param id 템플릿 ID
 * @param version 버전 (1 이상)
 * @param name 표시 이름
 * @param inputs 입력 선언 목록
 * @param defaults 기본값 맵 ({@code {{ defaults.x }}}로 참조, 중첩 키는 점으로 평탄화)
 * @param stages Stage 정의 목록 (선언 순서)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PipelineTemplate(
    TemplateId id,
    int version,
    String name,
    List<InputSpec> inputs,
    Map<String, String> defaults,
    List<StageDefinition> stages
) {

    public PipelineTemplate {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive (current: " + version + ")");
        }
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("stages cannot be null or empty");
        }
        name = name == null ? id.getValue() : name;
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        defaults = defaults == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
        stages = List.copyOf(stages);
    }

    /**
     * 최소 구성 템플릿 생성.
     *
     * @param id 템플릿 ID
     * @param version 버전
     * @param stages Stage 정의 목록
     * @return PipelineTemplate
     */
    public static PipelineTemplate of(String id, int version, List<StageDefinition> stages) {
        return new PipelineTemplate(TemplateId.of(id), version, null, List.of(), Map.of(), stages);
    }

    public PipelineTemplate withName(String name) {
        return new PipelineTemplate(id, version, name, inputs, defaults, stages);
    }

    public PipelineTemplate withInputs(InputSpec... inputs) {
        return new PipelineTemplate(id, version, name, List.of(inputs), defaults, stages);
    }

    public PipelineTemplate withDefaults(Map<String, String> defaults) {
        return new PipelineTemplate(id, version, name, inputs, defaults, stages);
    }

    /**
     * Stage 정의 조회.
     *
     * @param stageId Stage ID
     * @return 정의 (없으면 empty)
     */
    public Optional<StageDefinition> stage(StageId stageId) {
        for (StageDefinition stage : stages) {
            if (stage.id().equals(stageId)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }

    /**
     * 선언 순서의 Stage ID 목록.
     *
     * @return Stage ID 목록
     */
    public List<StageId> stageIds() {
        List<StageId> ids = new ArrayList<>(stages.size());
        for (StageDefinition stage : stages) {
            ids.add(stage.id());
        }
        return ids;
    }

    /**
     * 입력 선언 조회.
     *
     * @param key 입력 키
     * @return 입력 선언 (없으면 empty)
     */
    public Optional<InputSpec> input(String key) {
        for (InputSpec spec : inputs) {
            if (spec.key().equals(key)) {
                return Optional.of(spec);
            }
        }
        return Optional.empty();
    }

    /**
     * 로그와 예외 메시지용 참조 문자열 ({@code id@version}).
     *
     * @return 참조 문자열
     */
    public String ref() {
        return id.getValue() + "@" + version;
    }
}

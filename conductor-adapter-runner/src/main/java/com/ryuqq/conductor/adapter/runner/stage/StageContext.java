package com.ryuqq.conductor.adapter.runner.stage;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.spi.CancellationToken;
import com.ryuqq.conductor.core.spi.StreamCallback;
import com.ryuqq.conductor.core.state.RunState;
import com.ryuqq.conductor.core.template.PipelineTemplate;
import com.ryuqq.conductor.core.template.PromptTemplate;
import com.ryuqq.conductor.core.template.StageDefinition;
import com.ryuqq.conductor.core.template.TemplateReference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 시도 하나의 실행 입력.
 *
 * <p>프롬프트, 모델 선호 목록, 캐시 컨텍스트는 시도 시작 시점의 Run 상태로
 * 한 번만 렌더링됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StageContext {

    private final RunId runId;
    private final StageDefinition definition;
    private final int attempt;
    private final String prompt;
    private final List<String> models;
    private final Map<String, String> cacheContext;
    private final CancellationToken cancellation;
    private final StreamCallback chunks;

    private StageContext(RunId runId, StageDefinition definition, int attempt, String prompt, List<String> models,
                         Map<String, String> cacheContext, CancellationToken cancellation, StreamCallback chunks) {
        this.runId = runId;
        this.definition = definition;
        this.attempt = attempt;
        this.prompt = prompt;
        this.models = models;
        this.cacheContext = cacheContext;
        this.cancellation = cancellation;
        this.chunks = chunks;
    }

    /**
     * Run 상태에서 렌더링하여 생성.
     *
     * @param state 시도 시작 시점의 Run 상태
     * @param template 파이프라인 템플릿
     * @param definition Stage 정의
     * @param attempt 시도 번호
     * @param defaultModel 선호 목록이 비었을 때의 모델
     * @param cancellation 시도 단위 취소 신호
     * @param chunks 부분 출력 수신자
     * @return StageContext
     */
    public static StageContext render(RunState state, PipelineTemplate template, StageDefinition definition, int attempt,
                                      String defaultModel, CancellationToken cancellation, StreamCallback chunks) {
        if (state == null || template == null || definition == null) {
            throw new IllegalArgumentException("state, template and definition cannot be null");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }

        String prompt = definition.prompt().render(reference -> resolve(reference, state, template));

        List<String> models = new ArrayList<>();
        for (String entry : definition.modelPreference()) {
            String model = PromptTemplate.of(entry)
                .render(reference -> resolve(reference, state, template))
                .strip();
            if (!model.isEmpty()) {
                models.add(model);
            }
        }
        if (models.isEmpty()) {
            models.add(defaultModel);
        }

        Map<String, String> context = new LinkedHashMap<>();
        for (String key : definition.contextKeys()) {
            String value = state.inputs().get(key);
            if (value == null) {
                value = template.defaults().get(key);
            }
            if (value != null) {
                context.put(key, value);
            }
        }

        return new StageContext(state.runId(), definition, attempt, prompt, List.copyOf(models),
            Collections.unmodifiableMap(context), cancellation, chunks == null ? StreamCallback.NONE : chunks);
    }

    private static String resolve(TemplateReference reference, RunState state, PipelineTemplate template) {
        switch (reference.namespace()) {
            case INPUTS:
                return state.inputs().get(reference.key());
            case STEPS:
                return state.outputOf(StageId.of(reference.key())).orElse(null);
            case DEFAULTS:
                return template.defaults().get(reference.key());
            default:
                return null;
        }
    }

    public RunId runId() {
        return runId;
    }

    public StageId stageId() {
        return definition.id();
    }

    public StageDefinition definition() {
        return definition;
    }

    public int attempt() {
        return attempt;
    }

    public String prompt() {
        return prompt;
    }

    /**
     * 렌더링된 모델 선호 목록 (비어 있지 않음, 첫 항목이 우선).
     */
    public List<String> models() {
        return models;
    }

    public Map<String, String> cacheContext() {
        return cacheContext;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public StreamCallback chunks() {
        return chunks;
    }
}

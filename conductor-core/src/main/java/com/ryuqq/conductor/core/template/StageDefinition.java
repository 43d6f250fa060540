package com.ryuqq.conductor.core.template;

import com.ryuqq.conductor.core.model.StageId;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 파이프라인 템플릿을 구성하는 불변 Stage 정의.
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>id: 템플릿 내 고유 Stage ID</li>
 *   <li>kind: Stage 종류 (GENERATE, USER_SELECTION, TRANSFORM)</li>
 *   <li>prompt: 프롬프트 템플릿</li>
 *   <li>dependsOn: 선언된 의존 Stage ID 목록</li>
 *   <li>modelPreference: 모델 선호 목록 (앞쪽 우선, {@code {{ defaults.x }}} 허용)</li>
 *   <li>retryPolicy: 재시도 정책</li>
 *   <li>optional: 실패해도 하위 Stage를 막지 않는지 여부</li>
 *   <li>contextKeys: 캐시 키에 포함할 입력 키</li>
 *   <li>candidateCount: USER_SELECTION 후보 수</li>
 *   <li>transformName: TRANSFORM 함수 이름</li>
 *   <li>timeout: 시도당 제한 시간</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StageDefinition outline = StageDefinition.generate("outline", "Outline about {{ inputs.topic }}")
 *     .withModelPreference("gpt-4o", "{{ defaults.model }}");
 * StageDefinition draft = StageDefinition.generate("draft", "Expand: {{ steps.outline }}")
 *     .withDependsOn("outline");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageDefinition(
    StageId id,
    StageKind kind,
    PromptTemplate prompt,
    List<StageId> dependsOn,
    List<String> modelPreference,
    RetryPolicy retryPolicy,
    boolean optional,
    List<String> contextKeys,
    int candidateCount,
    String transformName,
    Duration timeout
) {

    /**
     * 시도당 기본 제한 시간.
     */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    public StageDefinition {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null (stage: " + id.getValue() + ")");
        }
        if (prompt == null) {
            throw new IllegalArgumentException("prompt cannot be null (stage: " + id.getValue() + ")");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null (stage: " + id.getValue() + ")");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (stage: " + id.getValue() + ")");
        }
        if (kind == StageKind.USER_SELECTION && candidateCount < 1) {
            throw new IllegalArgumentException(
                "candidateCount must be positive (stage: " + id.getValue() + ", current: " + candidateCount + ")"
            );
        }
        if (kind == StageKind.TRANSFORM && (transformName == null || transformName.isBlank())) {
            throw new IllegalArgumentException("transformName is required for TRANSFORM stage: " + id.getValue());
        }
        // 중복 의존성은 한 번만 유지
        dependsOn = dependsOn == null ? List.of() : List.copyOf(new LinkedHashSet<>(dependsOn));
        modelPreference = modelPreference == null ? List.of() : List.copyOf(modelPreference);
        contextKeys = contextKeys == null ? List.of() : List.copyOf(contextKeys);
    }

    /**
     * 생성(GENERATE) Stage 정의.
     *
     * @param id Stage ID
     * @param prompt 프롬프트 템플릿 원문
     * @return 기본 설정의 StageDefinition
     */
    public static StageDefinition generate(String id, String prompt) {
        return new StageDefinition(StageId.of(id), StageKind.GENERATE, PromptTemplate.of(prompt),
            List.of(), List.of(), new RetryPolicy(), false, List.of(), 1, null, DEFAULT_TIMEOUT);
    }

    /**
     * 사용자 선택(USER_SELECTION) Stage 정의.
     *
     * @param id Stage ID
     * @param prompt 후보 생성용 프롬프트 템플릿 원문
     * @param candidateCount 후보 수 (1 이상)
     * @return StageDefinition
     */
    public static StageDefinition userSelection(String id, String prompt, int candidateCount) {
        return new StageDefinition(StageId.of(id), StageKind.USER_SELECTION, PromptTemplate.of(prompt),
            List.of(), List.of(), new RetryPolicy(), false, List.of(), candidateCount, null, DEFAULT_TIMEOUT);
    }

    /**
     * 변환(TRANSFORM) Stage 정의.
     *
     * @param id Stage ID
     * @param transformName 등록된 변환 함수 이름
     * @param prompt 변환 입력 템플릿 원문
     * @return StageDefinition
     */
    public static StageDefinition transform(String id, String transformName, String prompt) {
        return new StageDefinition(StageId.of(id), StageKind.TRANSFORM, PromptTemplate.of(prompt),
            List.of(), List.of(), RetryPolicy.noRetry(), false, List.of(), 1, transformName, DEFAULT_TIMEOUT);
    }

    public StageDefinition withDependsOn(String... stageIds) {
        List<StageId> ids = new ArrayList<>();
        for (String stageId : stageIds) {
            ids.add(StageId.of(stageId));
        }
        return new StageDefinition(id, kind, prompt, ids, modelPreference, retryPolicy, optional,
            contextKeys, candidateCount, transformName, timeout);
    }

    public StageDefinition withModelPreference(String... models) {
        return new StageDefinition(id, kind, prompt, dependsOn, List.of(models), retryPolicy, optional,
            contextKeys, candidateCount, transformName, timeout);
    }

    public StageDefinition withRetryPolicy(RetryPolicy retryPolicy) {
        return new StageDefinition(id, kind, prompt, dependsOn, modelPreference, retryPolicy, optional,
            contextKeys, candidateCount, transformName, timeout);
    }

    public StageDefinition withOptional(boolean optional) {
        return new StageDefinition(id, kind, prompt, dependsOn, modelPreference, retryPolicy, optional,
            contextKeys, candidateCount, transformName, timeout);
    }

    public StageDefinition withContextKeys(String... keys) {
        return new StageDefinition(id, kind, prompt, dependsOn, modelPreference, retryPolicy, optional,
            List.of(keys), candidateCount, transformName, timeout);
    }

    public StageDefinition withTimeout(Duration timeout) {
        return new StageDefinition(id, kind, prompt, dependsOn, modelPreference, retryPolicy, optional,
            contextKeys, candidateCount, transformName, timeout);
    }
}

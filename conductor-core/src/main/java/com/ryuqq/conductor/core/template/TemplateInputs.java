package com.ryuqq.conductor.core.template;

import com.ryuqq.conductor.core.exception.InputValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run 입력값 해석 및 검증.
 *
 * <p>선언된 기본값을 채우고, 필수 입력 누락과 선택지 불일치를 한 번에 모아
 * {@link InputValidationException}으로 보고합니다. 선언되지 않은 키는 그대로 유지됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TemplateInputs {

    // Utility class - prevent instantiation
    private TemplateInputs() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 입력값 해석.
     *
     * @param template 템플릿
     * @param supplied 호출자가 제공한 입력 (nullable)
     * @return 기본값이 적용된 불변 입력 맵
     * @throws InputValidationException 필수 입력 누락 또는 선택지 불일치 시
     */
    public static Map<String, String> resolve(PipelineTemplate template, Map<String, String> supplied) {
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        Map<String, String> resolved = new LinkedHashMap<>();
        if (supplied != null) {
            for (Map.Entry<String, String> entry : supplied.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    resolved.put(entry.getKey(), entry.getValue());
                }
            }
        }

        List<String> problems = new ArrayList<>();
        for (InputSpec spec : template.inputs()) {
            String value = resolved.get(spec.key());
            if (value == null || value.isBlank()) {
                if (spec.defaultValue() != null) {
                    resolved.put(spec.key(), spec.defaultValue());
                    continue;
                }
                if (spec.required()) {
                    problems.add("missing required input '" + spec.key() + "'");
                }
                continue;
            }
            if (spec.isChoice() && !spec.options().contains(value)) {
                problems.add("input '" + spec.key() + "' must be one of " + spec.options() + " (current: " + value + ")");
            }
        }

        if (!problems.isEmpty()) {
            throw new InputValidationException(problems);
        }
        return Map.copyOf(resolved);
    }
}

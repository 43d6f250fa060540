package com.ryuqq.conductor.core.template;

import java.util.List;

/**
 * 템플릿 입력 선언.
 *
 * @param key 입력 키 ({@code {{ inputs.<key> }}}로 참조)
 * @param required 필수 여부
 * @param defaultValue 기본값 (nullable)
 * @param options 허용 값 목록 (비어 있으면 자유 입력)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InputSpec(String key, boolean required, String defaultValue, List<String> options) {

    public InputSpec {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        options = options == null ? List.of() : List.copyOf(options);
        if (defaultValue != null && !options.isEmpty() && !options.contains(defaultValue)) {
            throw new IllegalArgumentException(
                "defaultValue must be one of options (key: " + key + ", default: " + defaultValue + ")"
            );
        }
    }

    public static InputSpec required(String key) {
        return new InputSpec(key, true, null, List.of());
    }

    public static InputSpec optional(String key, String defaultValue) {
        return new InputSpec(key, false, defaultValue, List.of());
    }

    public static InputSpec choice(String key, String... options) {
        return new InputSpec(key, true, null, List.of(options));
    }

    public InputSpec withDefaultValue(String defaultValue) {
        return new InputSpec(key, required, defaultValue, options);
    }

    /**
     * 선택지 입력 여부.
     *
     * @return options가 비어 있지 않으면 true
     */
    public boolean isChoice() {
        return !options.isEmpty();
    }
}

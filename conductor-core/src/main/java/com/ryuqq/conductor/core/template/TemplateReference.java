package com.ryuqq.conductor.core.template;

/**
 * 프롬프트 템플릿의 변수 참조 하나 ({@code {{ namespace.key }}}).
 *
 * @param namespace 참조 네임스페이스
 * @param key 네임스페이스 내 키 (defaults는 점으로 구분된 중첩 키 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TemplateReference(Namespace namespace, String key) {

    public TemplateReference {
        if (namespace == null) {
            throw new IllegalArgumentException("namespace cannot be null");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
    }

    /**
     * 참조 네임스페이스.
     */
    public enum Namespace {
        INPUTS("inputs"),
        STEPS("steps"),
        DEFAULTS("defaults");

        private final String prefix;

        Namespace(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }

        static Namespace fromPrefix(String prefix) {
            for (Namespace namespace : values()) {
                if (namespace.prefix.equals(prefix)) {
                    return namespace;
                }
            }
            return null;
        }
    }

    @Override
    public String toString() {
        return namespace.prefix + "." + key;
    }
}

package com.ryuqq.conductor.adapter.runner.stage;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 이름으로 찾는 변환 함수 목록.
 *
 * <p><strong>기본 제공:</strong> identity, trim, upper, lower, collapse-whitespace</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransformRegistry {

    private final Map<String, StageTransform> transforms = new ConcurrentHashMap<>();

    /**
     * 빈 레지스트리.
     */
    public TransformRegistry() {
    }

    /**
     * 기본 변환이 등록된 레지스트리.
     *
     * @return TransformRegistry
     */
    public static TransformRegistry withDefaults() {
        TransformRegistry registry = new TransformRegistry();
        registry.register("identity", input -> input);
        registry.register("trim", String::strip);
        registry.register("upper", input -> input.toUpperCase(Locale.ROOT));
        registry.register("lower", input -> input.toLowerCase(Locale.ROOT));
        registry.register("collapse-whitespace", input -> input.strip().replaceAll("\\s+", " "));
        return registry;
    }

    /**
     * 변환 등록. 같은 이름이 있으면 교체합니다.
     *
     * @param name 변환 이름
     * @param transform 변환 함수
     * @return this
     */
    public TransformRegistry register(String name, StageTransform transform) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        transforms.put(name, transform);
        return this;
    }

    public Optional<StageTransform> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(transforms.get(name));
    }

    public boolean contains(String name) {
        return name != null && transforms.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(transforms.keySet());
    }
}

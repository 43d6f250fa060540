package com.ryuqq.conductor.core.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code {{ namespace.key }}} 자리표시자를 가진 프롬프트 템플릿.
 *
 * <p>지원 네임스페이스: {@code inputs}, {@code steps}, {@code defaults}.
 * 알 수 없는 네임스페이스는 {@link #getUnresolvable()}에 모이며, 템플릿 검증 단계에서
 * 오류로 보고됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 시 참조 목록을 한 번 파싱해 보관합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PromptTemplate {

    private static final Pattern PLACEHOLDER =
        Pattern.compile("\\{\\{\\s*([A-Za-z_][A-Za-z0-9_]*)\\.([A-Za-z0-9_\\-.]+)\\s*}}");

    private final String text;
    private final List<TemplateReference> references;
    private final List<String> unresolvable;

    private PromptTemplate(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        this.text = text;

        List<TemplateReference> refs = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            TemplateReference.Namespace namespace = TemplateReference.Namespace.fromPrefix(matcher.group(1));
            if (namespace == null) {
                unknown.add(matcher.group(0));
            } else {
                TemplateReference ref = new TemplateReference(namespace, matcher.group(2));
                if (!refs.contains(ref)) {
                    refs.add(ref);
                }
            }
        }
        this.references = Collections.unmodifiableList(refs);
        this.unresolvable = Collections.unmodifiableList(unknown);
    }

    /**
     * PromptTemplate 생성.
     *
     * @param text 템플릿 원문
     * @return PromptTemplate 인스턴스
     */
    public static PromptTemplate of(String text) {
        return new PromptTemplate(text);
    }

    /**
     * 자리표시자를 치환한 프롬프트 생성.
     *
     * <p>resolver가 null을 반환한 참조는 빈 문자열로 치환됩니다.
     * 알 수 없는 네임스페이스의 자리표시자는 원문 그대로 남습니다.</p>
     *
     * @param resolver 참조 → 값 함수
     * @return 렌더링된 프롬프트
     */
    public String render(Function<TemplateReference, String> resolver) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            TemplateReference.Namespace namespace = TemplateReference.Namespace.fromPrefix(matcher.group(1));
            String replacement;
            if (namespace == null) {
                replacement = matcher.group(0);
            } else {
                String value = resolver.apply(new TemplateReference(namespace, matcher.group(2)));
                replacement = value == null ? "" : value;
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * 특정 네임스페이스의 참조 목록.
     *
     * @param namespace 네임스페이스
     * @return 등장 순서대로 정렬된 참조
     */
    public List<TemplateReference> referencesIn(TemplateReference.Namespace namespace) {
        List<TemplateReference> result = new ArrayList<>();
        for (TemplateReference ref : references) {
            if (ref.namespace() == namespace) {
                result.add(ref);
            }
        }
        return result;
    }

    public String getText() {
        return text;
    }

    public List<TemplateReference> getReferences() {
        return references;
    }

    public List<String> getUnresolvable() {
        return unresolvable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PromptTemplate that = (PromptTemplate) o;
        return text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "PromptTemplate{" + text + '}';
    }
}

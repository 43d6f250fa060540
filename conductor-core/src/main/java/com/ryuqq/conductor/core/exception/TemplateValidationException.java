package com.ryuqq.conductor.core.exception;

import java.util.List;

/**
 * 템플릿 로드 시점 검증 실패 (ValidationError).
 *
 * <p>의존성 순환(경로 포함), 존재하지 않는 Stage 참조, 잘못된 프롬프트 변수 참조 등을
 * 모두 모아서 보고합니다. 이 예외가 발생한 템플릿으로는 Run이 시작되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TemplateValidationException extends ConductorException {

    private final List<String> problems;

    public TemplateValidationException(String templateRef, List<String> problems) {
        super("Template " + templateRef + " is invalid: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    /**
     * 발견된 문제 목록.
     *
     * @return 불변 문제 목록
     */
    public List<String> getProblems() {
        return problems;
    }
}

package com.ryuqq.conductor.core.exception;

import java.util.List;

/**
 * Run 입력값 검증 실패.
 *
 * <p>필수 입력 누락 또는 선택지(choice) 불일치 시 발생하며, Run은 생성되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InputValidationException extends ConductorException {

    private final List<String> problems;

    public InputValidationException(List<String> problems) {
        super("Invalid run inputs: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}

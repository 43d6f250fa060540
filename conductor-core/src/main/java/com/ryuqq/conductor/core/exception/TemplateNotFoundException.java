package com.ryuqq.conductor.core.exception;

/**
 * 등록되지 않은 템플릿 조회.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TemplateNotFoundException extends ConductorException {

    public TemplateNotFoundException(String templateRef) {
        super("Template not found: " + templateRef);
    }
}

/**
 * Pipeline template model.
 *
 * <p>A {@link com.ryuqq.conductor.core.template.PipelineTemplate} is an immutable, versioned
 * list of {@link com.ryuqq.conductor.core.template.StageDefinition}s. Prompts use
 * {@code {{ inputs.x }}}, {@code {{ steps.x }}} and {@code {{ defaults.x }}} placeholders.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.conductor.core.template;

package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.model.TokenUsage;

/**
 * Terminal result of a generation call.
 *
 * @param text full generated text
 * @param model model that actually produced the text
 * @param tokenUsage token counts reported by the model
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GenerationResult(String text, String model, TokenUsage tokenUsage) {

    public GenerationResult {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model cannot be null or blank");
        }
        tokenUsage = tokenUsage == null ? TokenUsage.zero() : tokenUsage;
    }
}

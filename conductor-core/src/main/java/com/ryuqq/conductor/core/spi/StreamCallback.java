package com.ryuqq.conductor.core.spi;

/**
 * Receiver of partial generation output.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StreamCallback {

    /**
     * A callback that drops every chunk.
     */
    StreamCallback NONE = chunk -> { };

    /**
     * Called once per partial chunk, in generation order.
     *
     * @param chunk partial text
     */
    void onChunk(String chunk);
}

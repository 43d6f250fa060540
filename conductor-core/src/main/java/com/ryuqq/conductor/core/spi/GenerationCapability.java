package com.ryuqq.conductor.core.spi;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * External text generation SPI.
 *
 * <p>The orchestrator never generates text itself. Every GENERATE and USER_SELECTION
 * stage attempt that misses the response cache calls this capability with a fully
 * rendered prompt.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>The returned future completes with the terminal {@link GenerationResult}, or
 *       exceptionally with a {@link com.ryuqq.conductor.core.exception.StageExecutionException}
 *       whose {@code retryable} flag drives the retry policy</li>
 *   <li>{@code callback} receives zero or more partial chunks before the future completes,
 *       and none after</li>
 *   <li>When {@code cancellation} is cancelled the implementation should abort as soon as
 *       possible and complete the future with a {@link java.util.concurrent.CancellationException}</li>
 *   <li>The call itself must not block; work happens on the implementation's own threads</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface GenerationCapability {

    /**
     * Starts a generation call.
     *
     * @param promptText rendered prompt
     * @param modelPreference model identifiers, most preferred first (never empty)
     * @param callback receiver of streamed partial output
     * @param cancellation cooperative cancellation signal for this call
     * @return future of the terminal result
     */
    CompletableFuture<GenerationResult> invoke(
        String promptText,
        List<String> modelPreference,
        StreamCallback callback,
        CancellationToken cancellation
    );
}

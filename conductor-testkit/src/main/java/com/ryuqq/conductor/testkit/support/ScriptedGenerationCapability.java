package com.ryuqq.conductor.testkit.support;

import com.ryuqq.conductor.core.exception.StageExecutionException;
import com.ryuqq.conductor.core.model.TokenUsage;
import com.ryuqq.conductor.core.spi.CancellationToken;
import com.ryuqq.conductor.core.spi.GenerationCapability;
import com.ryuqq.conductor.core.spi.GenerationResult;
import com.ryuqq.conductor.core.spi.StreamCallback;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted {@link GenerationCapability} fake.
 *
 * <p>Rules are matched by prompt fragment in registration order. A prompt that matches
 * no active rule is answered with {@code "echo: " + prompt}. Responses are streamed
 * word by word on the fake's own threads, so calls never block the caller.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedGenerationCapability generation = new ScriptedGenerationCapability()
 *     .respond("outline", "1. intro 2. body")
 *     .failTimes("draft", 2, true)
 *     .hang("slow");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedGenerationCapability implements GenerationCapability, AutoCloseable {

    private enum Kind { RESPOND, FAIL, HANG }

    private static final class Rule {
        private final String fragment;
        private final Kind kind;
        private final String text;
        private final boolean retryable;
        private final AtomicInteger remaining;
        private final CountDownLatch started = new CountDownLatch(1);

        private Rule(String fragment, Kind kind, String text, boolean retryable, int times) {
            this.fragment = fragment;
            this.kind = kind;
            this.text = text;
            this.retryable = retryable;
            this.remaining = new AtomicInteger(times);
        }

        // times < 0 means unlimited
        private boolean claim(String prompt) {
            if (!prompt.contains(fragment)) {
                return false;
            }
            while (true) {
                int left = remaining.get();
                if (left == 0) {
                    return false;
                }
                if (left < 0 || remaining.compareAndSet(left, left - 1)) {
                    return true;
                }
            }
        }
    }

    private final List<Rule> rules = new CopyOnWriteArrayList<>();
    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "scripted-generation");
        thread.setDaemon(true);
        return thread;
    });
    private volatile Duration latency = Duration.ZERO;

    public ScriptedGenerationCapability respond(String fragment, String text) {
        rules.add(new Rule(fragment, Kind.RESPOND, text, false, -1));
        return this;
    }

    public ScriptedGenerationCapability failAlways(String fragment, boolean retryable) {
        rules.add(new Rule(fragment, Kind.FAIL, null, retryable, -1));
        return this;
    }

    /**
     * Fails the first {@code times} matching calls, then lets later rules answer.
     */
    public ScriptedGenerationCapability failTimes(String fragment, int times, boolean retryable) {
        if (times < 1) {
            throw new IllegalArgumentException("times must be positive (current: " + times + ")");
        }
        rules.add(new Rule(fragment, Kind.FAIL, null, retryable, times));
        return this;
    }

    /**
     * Matching calls never finish on their own; they end only when cancelled.
     */
    public ScriptedGenerationCapability hang(String fragment) {
        rules.add(new Rule(fragment, Kind.HANG, null, false, -1));
        return this;
    }

    /**
     * Delay before every streamed chunk.
     */
    public ScriptedGenerationCapability withLatency(Duration latency) {
        this.latency = latency;
        return this;
    }

    @Override
    public CompletableFuture<GenerationResult> invoke(
        String promptText,
        List<String> modelPreference,
        StreamCallback callback,
        CancellationToken cancellation
    ) {
        prompts.add(promptText);
        CompletableFuture<GenerationResult> future = new CompletableFuture<>();
        cancellation.onCancel(() -> future.completeExceptionally(new CancellationException("generation cancelled")));
        Rule rule = match(promptText);
        String model = modelPreference.isEmpty() ? "scripted" : modelPreference.get(0);

        executor.execute(() -> {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            AtomicBoolean left = new AtomicBoolean();
            // the call counts as finished before its future completes
            Runnable leave = () -> {
                if (left.compareAndSet(false, true)) {
                    inFlight.decrementAndGet();
                }
            };
            try {
                run(rule, promptText, model, callback, future, leave);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                leave.run();
                future.completeExceptionally(e);
            } finally {
                leave.run();
            }
        });
        return future;
    }

    private void run(Rule rule, String prompt, String model, StreamCallback callback,
                     CompletableFuture<GenerationResult> future, Runnable leave) throws InterruptedException {
        if (rule != null) {
            rule.started.countDown();
        }
        if (rule != null && rule.kind == Kind.HANG) {
            while (!future.isDone()) {
                Thread.sleep(5);
            }
            return;
        }
        if (rule != null && rule.kind == Kind.FAIL) {
            pause();
            leave.run();
            future.completeExceptionally(new StageExecutionException(
                "GENERATION_FAILED", "scripted failure for '" + rule.fragment + "'", rule.retryable));
            return;
        }

        String text = rule != null ? rule.text : "echo: " + prompt;
        List<String> chunks = chunksOf(text);
        for (String chunk : chunks) {
            pause();
            if (future.isDone()) {
                return;
            }
            callback.onChunk(chunk);
        }
        leave.run();
        future.complete(new GenerationResult(text, model, new TokenUsage(wordCount(prompt), chunks.size())));
    }

    private void pause() throws InterruptedException {
        long millis = latency.toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    private Rule match(String prompt) {
        for (Rule rule : rules) {
            if (rule.claim(prompt)) {
                return rule;
            }
        }
        return null;
    }

    private static List<String> chunksOf(String text) {
        List<String> chunks = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= text.length(); i++) {
            if (i == text.length() || text.charAt(i) == ' ') {
                chunks.add(text.substring(start, i));
                start = i;
            }
        }
        if (chunks.isEmpty()) {
            chunks.add("");
        }
        return chunks;
    }

    private static long wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    /**
     * Waits until a call matching the first rule with this fragment has started.
     *
     * @return true if it started within the timeout
     */
    public boolean awaitStarted(String fragment, Duration timeout) throws InterruptedException {
        for (Rule rule : rules) {
            if (rule.fragment.equals(fragment)) {
                return rule.started.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        }
        throw new IllegalArgumentException("No rule registered for fragment: " + fragment);
    }

    public int invocationCount() {
        return prompts.size();
    }

    public int invocationCount(String fragment) {
        int count = 0;
        for (String prompt : prompts) {
            if (prompt.contains(fragment)) {
                count++;
            }
        }
        return count;
    }

    public List<String> prompts() {
        return List.copyOf(prompts);
    }

    public int maxConcurrentInvocations() {
        return maxInFlight.get();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}

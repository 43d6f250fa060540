package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.adapter.runner.journal.RunJournal.RunAppender;
import com.ryuqq.conductor.adapter.runner.stage.StageContext;
import com.ryuqq.conductor.adapter.runner.stage.StageFailures;
import com.ryuqq.conductor.adapter.runner.stage.StageHandlers;
import com.ryuqq.conductor.core.event.RunCancelled;
import com.ryuqq.conductor.core.event.RunCompleted;
import com.ryuqq.conductor.core.event.RunFailed;
import com.ryuqq.conductor.core.event.RunPaused;
import com.ryuqq.conductor.core.event.RunResumed;
import com.ryuqq.conductor.core.event.RunStarted;
import com.ryuqq.conductor.core.event.StageAwaitingFeedback;
import com.ryuqq.conductor.core.event.StageCompleted;
import com.ryuqq.conductor.core.event.StageFailed;
import com.ryuqq.conductor.core.event.StageRetried;
import com.ryuqq.conductor.core.event.StageSkipped;
import com.ryuqq.conductor.core.event.StageStarted;
import com.ryuqq.conductor.core.event.UserFeedbackRecorded;
import com.ryuqq.conductor.core.graph.DependencyGraph;
import com.ryuqq.conductor.core.graph.DependencyResolver;
import com.ryuqq.conductor.core.graph.Resolution;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.outcome.AwaitFeedback;
import com.ryuqq.conductor.core.outcome.Fail;
import com.ryuqq.conductor.core.outcome.Ok;
import com.ryuqq.conductor.core.outcome.Retry;
import com.ryuqq.conductor.core.outcome.StageOutcome;
import com.ryuqq.conductor.core.spi.CancellationToken;
import com.ryuqq.conductor.core.state.RunState;
import com.ryuqq.conductor.core.state.SkipReason;
import com.ryuqq.conductor.core.state.StageError;
import com.ryuqq.conductor.core.state.StageExecution;
import com.ryuqq.conductor.core.state.StageOutput;
import com.ryuqq.conductor.core.statemachine.RunStatus;
import com.ryuqq.conductor.core.statemachine.StageStatus;
import com.ryuqq.conductor.core.template.RetryPolicy;
import com.ryuqq.conductor.core.template.StageDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Run 하나의 실행 루프.
 *
 * <p>Run마다 스레드 하나가 신호 큐를 순서대로 처리하며, 이 스레드만 Run 로그에 이벤트를 기록합니다.
 * 외부 생성 호출은 비동기로 진행되고 결과는 {@link RunSignal.AttemptSettled} 신호로 돌아옵니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * startup()  → RunStarted (PENDING이면), 재시작 전 진행 중이던 시도 정리
 *   ↓
 * schedule() → 상위 실패 Stage 건너뜀 → 필수 Stage 실패 시 RunFailed
 *            → 재시도 예정 Stage, 실행 가능 Stage 순으로 시작 (동시 실행 한도 내)
 *            → 남은 Stage가 없으면 RunCompleted
 *   ↓
 * signals.take() → handle(signal) → schedule() 반복
 *   ↓
 * 종료 이벤트 기록 후 → 늦게 도착한 결과를 drain 시간 동안 기록
 * </pre>
 *
 * <p><strong>대기 지점:</strong></p>
 * <ul>
 *   <li>외부 생성 호출: 시도 단위 {@link CancellationToken}으로 취소, 시도 제한 시간 초과 시 TIMEOUT</li>
 *   <li>사용자 선택 대기 (AWAITING_FEEDBACK): 동시 실행 슬롯을 차지하지 않으며 Run 취소로만 끝남</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class RunLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RunLoop.class);

    private static final String RESTART_MESSAGE = "Attempt interrupted by restart";

    private final RunId runId;
    private final RunAppender appender;
    private final DependencyGraph graph;
    private final DependencyResolver resolver;
    private final StageHandlers handlers;
    private final SingleFlightGuard singleFlight;
    private final EventBroadcaster broadcaster;
    private final ScheduledExecutorService timers;
    private final OrchestratorConfig config;

    private final BlockingQueue<RunSignal> signals = new LinkedBlockingQueue<>();
    private final CompletableFuture<RunState> termination = new CompletableFuture<>();
    private final Object submitLock = new Object();
    private boolean closed;
    private volatile Thread loopThread;

    // 루프 스레드 전용
    private final Map<StageId, InFlight> inFlight = new LinkedHashMap<>();
    private final Set<StageId> dueRetries = new LinkedHashSet<>();
    private final Map<StageId, ScheduledFuture<?>> retryTimers = new LinkedHashMap<>();

    RunLoop(RunAppender appender, DependencyGraph graph, StageHandlers handlers, SingleFlightGuard singleFlight,
            EventBroadcaster broadcaster, ScheduledExecutorService timers, OrchestratorConfig config) {
        if (appender == null) {
            throw new IllegalArgumentException("appender cannot be null");
        }
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (handlers == null) {
            throw new IllegalArgumentException("handlers cannot be null");
        }
        if (singleFlight == null) {
            throw new IllegalArgumentException("singleFlight cannot be null");
        }
        if (broadcaster == null) {
            throw new IllegalArgumentException("broadcaster cannot be null");
        }
        if (timers == null) {
            throw new IllegalArgumentException("timers cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.appender = appender;
        this.runId = appender.state().runId();
        this.graph = graph;
        this.resolver = new DependencyResolver(graph);
        this.handlers = handlers;
        this.singleFlight = singleFlight;
        this.broadcaster = broadcaster;
        this.timers = timers;
        this.config = config;
    }

    RunId runId() {
        return runId;
    }

    RunState state() {
        return appender.state();
    }

    CompletableFuture<RunState> termination() {
        return termination;
    }

    boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * 신호 전달.
     *
     * @return 루프가 이미 끝나 신호를 받을 수 없으면 false
     */
    boolean submit(RunSignal signal) {
        synchronized (submitLock) {
            if (closed) {
                return false;
            }
            signals.add(signal);
            return true;
        }
    }

    @Override
    public void run() {
        loopThread = Thread.currentThread();
        boolean stopped = false;
        try {
            startup();
            while (!state().isTerminal()) {
                RunSignal signal = signals.take();
                if (signal instanceof RunSignal.Stop) {
                    stopped = true;
                    break;
                }
                handle(signal);
                schedule();
            }
            if (!stopped) {
                long drainMs = state().status() == RunStatus.CANCELLED ? config.cancelTimeoutMs() : config.drainTimeoutMs();
                drainLate(drainMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Run loop of {} interrupted", runId.getValue());
        } catch (RuntimeException e) {
            log.error("Run loop of {} failed", runId.getValue(), e);
            abort(e);
        } finally {
            close();
        }
    }

    // ========================================
    // 시작 / 복구
    // ========================================

    private void startup() {
        RunState state = state();
        if (state.isTerminal()) {
            return;
        }
        if (state.status() == RunStatus.PENDING) {
            appender.append((seq, at) -> new RunStarted(runId, seq, at));
        }

        for (StageExecution execution : state().stages().values()) {
            StageId stageId = execution.stageId();
            if (execution.status() == StageStatus.RUNNING) {
                // 결과가 기록되지 않은 시도는 다시 실행 (at-least-once)
                StageError error = new StageError(stageId, execution.attempt(), StageError.INTERNAL, RESTART_MESSAGE);
                if (policyOf(stageId).allowsAttemptAfter(execution.attempt())) {
                    appender.append((seq, at) -> new StageRetried(runId, seq, at, stageId, execution.attempt(), 0, error));
                    dueRetries.add(stageId);
                } else {
                    appender.append((seq, at) -> new StageFailed(runId, seq, at, stageId, execution.attempt(), error));
                }
                log.info("Run {} stage {} attempt {} was in flight before restart", runId.getValue(),
                    stageId.getValue(), execution.attempt());
            } else if (execution.status() == StageStatus.FAILED && execution.retryScheduled()) {
                dueRetries.add(stageId);
            }
        }
        schedule();
    }

    // ========================================
    // 스케줄링
    // ========================================

    private void schedule() {
        boolean progressed = true;
        while (progressed && !state().isTerminal()) {
            progressed = false;
            RunState state = state();
            boolean running = state.status() == RunStatus.RUNNING;
            int slots = running ? config.maxConcurrentStages() - inFlight.size() : 0;
            Resolution resolution = resolver.resolve(state, slots);

            if (!resolution.skipped().isEmpty()) {
                for (Resolution.Skip skip : resolution.skipped()) {
                    appender.append((seq, at) -> new StageSkipped(runId, seq, at, skip.stageId(),
                        SkipReason.UPSTREAM_FAILED, skip.cause()));
                    log.debug("Run {} stage {} skipped: upstream {} failed", runId.getValue(),
                        skip.stageId().getValue(), skip.cause().getValue());
                }
                progressed = true;
                continue;
            }

            if (!resolution.failedRequired().isEmpty()) {
                failRun(describeFailure(resolution.failedRequired().get(0)));
                return;
            }

            if (running) {
                Iterator<StageId> due = dueRetries.iterator();
                while (slots > 0 && due.hasNext()) {
                    StageId stageId = due.next();
                    due.remove();
                    if (startAttempt(stageId)) {
                        slots--;
                        progressed = true;
                    }
                }
                for (StageId stageId : resolution.runnable()) {
                    if (slots <= 0) {
                        break;
                    }
                    if (startAttempt(stageId)) {
                        slots--;
                        progressed = true;
                    }
                }
            }

            if (!progressed && running && inFlight.isEmpty() && dueRetries.isEmpty()) {
                if (resolution.exhausted()) {
                    appender.append((seq, at) -> new RunCompleted(runId, seq, at));
                    log.info("Run {} completed: {} tokens", runId.getValue(), state().tokenUsage().total());
                } else if (resolution.stuck()) {
                    failRun("No runnable stage remains while " + state().stagesWith(StageStatus.WAITING).size()
                        + " stage(s) are waiting");
                }
            }
        }
    }

    private boolean startAttempt(StageId stageId) {
        StageExecution execution = state().stage(stageId);
        int attempt = execution.attempt() + 1;
        if (!singleFlight.tryAcquire(runId, stageId, attempt)) {
            log.warn("Run {} stage {} attempt {} already in flight; duplicate start rejected",
                runId.getValue(), stageId.getValue(), attempt);
            return false;
        }

        StageDefinition definition = graph.definition(stageId);
        try {
            appender.append((seq, at) -> new StageStarted(runId, seq, at, stageId, attempt));
        } catch (RuntimeException e) {
            singleFlight.release(runId, stageId, attempt);
            throw e;
        }
        log.debug("Run {} stage {} attempt {} started", runId.getValue(), stageId.getValue(), attempt);

        CancellationToken token = new CancellationToken();
        CompletableFuture<StageOutcome> future;
        try {
            StageContext context = StageContext.render(state(), graph.template(), definition, attempt,
                config.defaultModel(), token, chunk -> broadcaster.publishChunk(runId, stageId, attempt, chunk));
            future = handlers.forKind(definition.kind()).execute(context);
            if (future == null) {
                future = CompletableFuture.failedFuture(
                    new IllegalStateException("Handler returned no future for stage " + stageId.getValue()));
            }
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        inFlight.put(stageId, new InFlight(attempt, token));
        future.orTimeout(definition.timeout().toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((outcome, failure) -> {
                StageOutcome settled;
                if (failure == null) {
                    settled = outcome;
                } else {
                    if (unwrap(failure) instanceof TimeoutException) {
                        token.cancel();
                    }
                    settled = StageFailures.classify(stageId, attempt, failure);
                }
                if (!submit(new RunSignal.AttemptSettled(stageId, attempt, settled))) {
                    singleFlight.release(runId, stageId, attempt);
                }
            });
        return true;
    }

    private void failRun(String reason) {
        cancelInFlight();
        List<StageError> errors = state().errors();
        appender.append((seq, at) -> new RunFailed(runId, seq, at, reason, errors));
        log.info("Run {} failed: {}", runId.getValue(), reason);
    }

    private String describeFailure(StageId stageId) {
        StageExecution execution = state().stage(stageId);
        String cause = execution.error() == null ? "unknown error" : execution.error().message();
        return String.format("Stage '%s' failed after %d attempt(s): %s", stageId.getValue(), execution.attempt(), cause);
    }

    // ========================================
    // 신호 처리
    // ========================================

    private void handle(RunSignal signal) {
        if (signal instanceof RunSignal.AttemptSettled) {
            handleSettled((RunSignal.AttemptSettled) signal);
        } else if (signal instanceof RunSignal.RetryDue) {
            handleRetryDue((RunSignal.RetryDue) signal);
        } else if (signal instanceof RunSignal.CancelRequested) {
            handleCancel((RunSignal.CancelRequested) signal);
        } else if (signal instanceof RunSignal.Acknowledged) {
            RunSignal.Acknowledged request = (RunSignal.Acknowledged) signal;
            try {
                handleRequest(request);
                request.ack().complete(null);
            } catch (IllegalStateException | IllegalArgumentException e) {
                request.ack().completeExceptionally(e);
            } catch (RuntimeException e) {
                request.ack().completeExceptionally(e);
                throw e;
            }
        }
    }

    private void handleRequest(RunSignal.Acknowledged request) {
        RunState state = state();
        if (request instanceof RunSignal.FeedbackSupplied) {
            RunSignal.FeedbackSupplied feedback = (RunSignal.FeedbackSupplied) request;
            StageExecution execution = requireStage(state, feedback.stageId());
            if (execution.status() != StageStatus.AWAITING_FEEDBACK) {
                throw new IllegalStateException("Stage '" + feedback.stageId().getValue()
                    + "' is not awaiting feedback (current: " + execution.status() + ")");
            }
            String text = feedback.selection().resolve(execution.candidates());
            appender.append((seq, at) -> new UserFeedbackRecorded(runId, seq, at, feedback.stageId(),
                feedback.selection().candidateIndex(), text, feedback.selection().comment()));
            appender.append((seq, at) -> new StageCompleted(runId, seq, at, feedback.stageId(), execution.attempt(),
                StageOutput.feedback(text)));
            log.info("Run {} stage {} feedback recorded", runId.getValue(), feedback.stageId().getValue());
        } else if (request instanceof RunSignal.PauseRequested) {
            if (state.status() == RunStatus.PAUSED) {
                return;
            }
            if (state.status() != RunStatus.RUNNING) {
                throw new IllegalStateException("Run " + runId.getValue() + " cannot be paused (current: " + state.status() + ")");
            }
            appender.append((seq, at) -> new RunPaused(runId, seq, at));
            log.info("Run {} paused: {} stages in flight", runId.getValue(), inFlight.size());
        } else if (request instanceof RunSignal.ResumeRequested) {
            if (state.status() != RunStatus.PAUSED) {
                throw new IllegalStateException("Run " + runId.getValue() + " is not paused (current: " + state.status() + ")");
            }
            appender.append((seq, at) -> new RunResumed(runId, seq, at));
            log.info("Run {} resumed", runId.getValue());
        } else if (request instanceof RunSignal.SkipRequested) {
            RunSignal.SkipRequested skip = (RunSignal.SkipRequested) request;
            StageExecution execution = requireStage(state, skip.stageId());
            if (execution.status() != StageStatus.WAITING) {
                throw new IllegalStateException("Stage '" + skip.stageId().getValue()
                    + "' is not waiting (current: " + execution.status() + ")");
            }
            appender.append((seq, at) -> new StageSkipped(runId, seq, at, skip.stageId(), SkipReason.EXPLICIT, null));
            log.info("Run {} stage {} skipped on request", runId.getValue(), skip.stageId().getValue());
        }
    }

    private void handleSettled(RunSignal.AttemptSettled settled) {
        InFlight current = inFlight.get(settled.stageId());
        if (current == null || current.attempt != settled.attempt()) {
            log.debug("Run {} stage {} attempt {} settled after it stopped being tracked", runId.getValue(),
                settled.stageId().getValue(), settled.attempt());
            return;
        }
        inFlight.remove(settled.stageId());
        singleFlight.release(runId, settled.stageId(), settled.attempt());

        StageId stageId = settled.stageId();
        int attempt = settled.attempt();
        StageOutcome outcome = settled.outcome();
        if (outcome instanceof Ok) {
            StageOutput output = ((Ok) outcome).output();
            appender.append((seq, at) -> new StageCompleted(runId, seq, at, stageId, attempt, output));
            log.debug("Run {} stage {} attempt {} completed ({})", runId.getValue(), stageId.getValue(), attempt,
                output.source());
        } else if (outcome instanceof AwaitFeedback) {
            AwaitFeedback awaiting = (AwaitFeedback) outcome;
            appender.append((seq, at) -> new StageAwaitingFeedback(runId, seq, at, stageId, attempt,
                awaiting.candidates(), awaiting.tokenUsage()));
            log.info("Run {} stage {} awaiting feedback on {} candidates", runId.getValue(), stageId.getValue(),
                awaiting.candidates().size());
        } else if (outcome instanceof Retry) {
            StageError error = ((Retry) outcome).error();
            RetryPolicy policy = policyOf(stageId);
            if (policy.allowsAttemptAfter(attempt)) {
                long delayMs = BackoffCalculator.of(policy).calculate(attempt);
                appender.append((seq, at) -> new StageRetried(runId, seq, at, stageId, attempt, delayMs, error));
                scheduleRetry(stageId, attempt, delayMs);
                log.debug("Run {} stage {} attempt {} failed, retrying in {}ms: {}", runId.getValue(),
                    stageId.getValue(), attempt, delayMs, error.message());
            } else {
                appender.append((seq, at) -> new StageFailed(runId, seq, at, stageId, attempt, error));
                log.info("Run {} stage {} failed after {} attempt(s): {}", runId.getValue(), stageId.getValue(),
                    attempt, error.message());
            }
        } else if (outcome instanceof Fail) {
            StageError error = ((Fail) outcome).error();
            appender.append((seq, at) -> new StageFailed(runId, seq, at, stageId, attempt, error));
            log.info("Run {} stage {} failed permanently: {}", runId.getValue(), stageId.getValue(), error.message());
        } else {
            StageError error = new StageError(stageId, attempt, StageError.INTERNAL, "Attempt produced no outcome");
            appender.append((seq, at) -> new StageFailed(runId, seq, at, stageId, attempt, error));
        }
    }

    private void scheduleRetry(StageId stageId, int failedAttempt, long delayMs) {
        if (delayMs <= 0) {
            dueRetries.add(stageId);
            return;
        }
        ScheduledFuture<?> timer = timers.schedule(
            () -> submit(new RunSignal.RetryDue(stageId, failedAttempt)), delayMs, TimeUnit.MILLISECONDS);
        retryTimers.put(stageId, timer);
    }

    private void handleRetryDue(RunSignal.RetryDue due) {
        retryTimers.remove(due.stageId());
        StageExecution execution = state().stage(due.stageId());
        if (execution.status() == StageStatus.FAILED && execution.retryScheduled()
            && execution.attempt() == due.failedAttempt()) {
            dueRetries.add(due.stageId());
        }
    }

    private void handleCancel(RunSignal.CancelRequested cancel) {
        RunState state = state();
        if (state.isTerminal()) {
            return;
        }
        List<StageId> interrupted = new ArrayList<>(state.stagesWith(StageStatus.RUNNING));
        interrupted.addAll(state.stagesWith(StageStatus.AWAITING_FEEDBACK));
        cancelInFlight();
        appender.append((seq, at) -> new RunCancelled(runId, seq, at, interrupted, cancel.reason()));
        log.info("Run {} cancelled: {} stage(s) interrupted", runId.getValue(), interrupted.size());
    }

    // ========================================
    // 종료
    // ========================================

    private void cancelInFlight() {
        for (InFlight attempt : inFlight.values()) {
            attempt.token.cancel();
        }
        for (ScheduledFuture<?> timer : retryTimers.values()) {
            timer.cancel(false);
        }
        retryTimers.clear();
        dueRetries.clear();
    }

    /**
     * 종료 이후 도착한 시도 결과를 기록 (상태에는 반영되지 않음).
     */
    private void drainLate(long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (!inFlight.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            RunSignal signal = signals.poll(remaining, TimeUnit.NANOSECONDS);
            if (signal == null || signal instanceof RunSignal.Stop) {
                break;
            }
            if (signal instanceof RunSignal.AttemptSettled) {
                handleSettled((RunSignal.AttemptSettled) signal);
            } else if (signal instanceof RunSignal.Acknowledged) {
                ((RunSignal.Acknowledged) signal).ack().completeExceptionally(
                    new IllegalStateException("Run " + runId.getValue() + " has already terminated"));
            }
        }
        if (!inFlight.isEmpty()) {
            log.warn("Run {} terminated with {} attempt(s) still in flight; their results will not be recorded",
                runId.getValue(), inFlight.size());
        }
    }

    private void abort(RuntimeException cause) {
        cancelInFlight();
        try {
            if (!state().isTerminal()) {
                String reason = "Run loop failure: " + cause.getMessage();
                List<StageError> errors = state().errors();
                appender.append((seq, at) -> new RunFailed(runId, seq, at, reason, errors));
            }
        } catch (RuntimeException e) {
            log.error("Could not record failure of run {}; the log ends at sequence {}", runId.getValue(),
                state().lastSequence(), e);
        }
    }

    private void close() {
        List<RunSignal> pending = new ArrayList<>();
        synchronized (submitLock) {
            closed = true;
            signals.drainTo(pending);
        }
        for (RunSignal signal : pending) {
            if (signal instanceof RunSignal.Acknowledged) {
                ((RunSignal.Acknowledged) signal).ack().completeExceptionally(
                    new IllegalStateException("Run loop of " + runId.getValue() + " has stopped"));
            }
        }
        for (Map.Entry<StageId, InFlight> entry : inFlight.entrySet()) {
            entry.getValue().token.cancel();
            singleFlight.release(runId, entry.getKey(), entry.getValue().attempt);
        }
        for (ScheduledFuture<?> timer : retryTimers.values()) {
            timer.cancel(false);
        }

        RunState state = state();
        if (state.isTerminal()) {
            termination.complete(state);
        } else {
            termination.completeExceptionally(new IllegalStateException(
                "Run loop of " + runId.getValue() + " stopped before the run terminated (status: " + state.status() + ")"));
        }
    }

    // ========================================
    // 보조
    // ========================================

    private RetryPolicy policyOf(StageId stageId) {
        return graph.definition(stageId).retryPolicy();
    }

    private static StageExecution requireStage(RunState state, StageId stageId) {
        if (!state.stages().containsKey(stageId)) {
            throw new IllegalArgumentException("Unknown stage '" + stageId.getValue() + "' in run " + state.runId().getValue());
        }
        return state.stage(stageId);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class InFlight {
        private final int attempt;
        private final CancellationToken token;

        private InFlight(int attempt, CancellationToken token) {
            this.attempt = attempt;
            this.token = token;
        }
    }
}

package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.adapter.runner.cache.CacheConfig;
import com.ryuqq.conductor.adapter.runner.cache.ResponseCache;
import com.ryuqq.conductor.adapter.runner.journal.RunJournal;
import com.ryuqq.conductor.adapter.runner.journal.RunJournal.RunAppender;
import com.ryuqq.conductor.adapter.runner.stage.GenerateStageHandler;
import com.ryuqq.conductor.adapter.runner.stage.StageHandlers;
import com.ryuqq.conductor.adapter.runner.stage.TransformRegistry;
import com.ryuqq.conductor.adapter.runner.stage.TransformStageHandler;
import com.ryuqq.conductor.adapter.runner.stage.UserSelectionStageHandler;
import com.ryuqq.conductor.application.orchestrator.FeedbackSelection;
import com.ryuqq.conductor.application.orchestrator.Orchestrator;
import com.ryuqq.conductor.application.orchestrator.RunListener;
import com.ryuqq.conductor.application.orchestrator.Subscription;
import com.ryuqq.conductor.core.cache.CacheKey;
import com.ryuqq.conductor.core.cache.CacheStats;
import com.ryuqq.conductor.core.event.RunCancelled;
import com.ryuqq.conductor.core.event.RunCreated;
import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.event.RunStarted;
import com.ryuqq.conductor.core.graph.DependencyGraph;
import com.ryuqq.conductor.core.model.BranchOrigin;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.ScopeId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.model.TemplateId;
import com.ryuqq.conductor.core.spi.CacheBackend;
import com.ryuqq.conductor.core.spi.EventSink;
import com.ryuqq.conductor.core.spi.GenerationCapability;
import com.ryuqq.conductor.core.state.RunState;
import com.ryuqq.conductor.core.state.RunStateProjector;
import com.ryuqq.conductor.core.statemachine.StageStatus;
import com.ryuqq.conductor.core.template.PipelineTemplate;
import com.ryuqq.conductor.core.template.TemplateInputs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 기본 오케스트레이터 (조립 루트).
 *
 * <p>Run마다 {@link RunLoop} 하나를 띄우고, 제어 요청을 해당 루프의 신호로 전달합니다.
 * 상태 조회는 실행 중이면 루프의 현재 상태를, 아니면 이벤트 로그에서 재생한 상태를 반환합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>템플릿 등록 및 입력값 검증 후 Run 생성 (RunCreated, RunStarted는 호출 스레드에서 기록)</li>
 *   <li>실행 중인 Run 목록 ({@link RunRegistry}) 관리</li>
 *   <li>분기, 시점 조회, 재시작 후 복구</li>
 *   <li>응답 캐시 무효화 및 통계</li>
 * </ul>
 *
 * <p><strong>스레드:</strong></p>
 * <ul>
 *   <li>conductor-run-N: Run 루프 (Run당 하나)</li>
 *   <li>conductor-retry-timer: 재시도 지연 타이머</li>
 *   <li>conductor-cache-writer: 캐시 Tier 2 비동기 쓰기</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DefaultOrchestrator orchestrator = DefaultOrchestrator.builder()
 *     .eventSink(new FileEventSink(Path.of("runs")))
 *     .generation(capability)
 *     .cacheBackend(new FileCacheBackend(Path.of("cache")))
 *     .template(articleTemplate)
 *     .build();
 *
 * new RunRecoverer(orchestrator).recoverAll();
 * RunId runId = orchestrator.startRun(TemplateId.of("article"), Map.of("topic", "cats"));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultOrchestrator implements Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultOrchestrator.class);

    private static final long CACHE_WRITER_SHUTDOWN_MS = 5000;

    private final EventSink eventSink;
    private final RunJournal journal;
    private final TemplateRegistry templates;
    private final ResponseCache cache;
    private final StageHandlers handlers;
    private final SingleFlightGuard singleFlight = new SingleFlightGuard();
    private final EventBroadcaster broadcaster = new EventBroadcaster();
    private final RunRegistry registry = new RunRegistry();
    private final OrchestratorConfig config;

    private final ExecutorService loopExecutor;
    private final ScheduledExecutorService timers;
    private final ExecutorService cacheWriter;
    private final Object lifecycleLock = new Object();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private DefaultOrchestrator(Builder builder) {
        if (builder.eventSink == null) {
            throw new IllegalArgumentException("eventSink cannot be null");
        }
        if (builder.generation == null) {
            throw new IllegalArgumentException("generation cannot be null");
        }
        this.eventSink = builder.eventSink;
        this.config = builder.config;
        this.journal = new RunJournal(builder.eventSink, new RunStateProjector(), builder.clock, config.snapshotInterval());
        this.templates = new TemplateRegistry(builder.transforms);
        for (PipelineTemplate template : builder.templates) {
            templates.register(template);
        }

        this.loopExecutor = Executors.newCachedThreadPool(daemonThreads("conductor-run-"));
        this.timers = Executors.newSingleThreadScheduledExecutor(daemonThreads("conductor-retry-timer-"));
        this.cacheWriter = Executors.newSingleThreadExecutor(daemonThreads("conductor-cache-writer-"));

        this.cache = new ResponseCache(builder.cacheConfig, builder.cacheBackend, cacheWriter, builder.clock);
        ScopeId scope = ScopeId.of(config.isolationScope());
        this.handlers = new StageHandlers(List.of(
            new GenerateStageHandler(builder.generation, cache, scope),
            new UserSelectionStageHandler(builder.generation, cache, scope),
            new TransformStageHandler(builder.transforms)
        ));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 템플릿 등록.
     *
     * @param template 템플릿
     * @return 검증된 의존성 그래프
     * @throws com.ryuqq.conductor.core.exception.TemplateValidationException 템플릿이 유효하지 않은 경우
     */
    public DependencyGraph registerTemplate(PipelineTemplate template) {
        return templates.register(template);
    }

    // ========================================
    // Run 생성
    // ========================================

    @Override
    public RunId startRun(TemplateId templateId, Map<String, String> inputs) {
        return start(templates.latest(templateId), inputs);
    }

    @Override
    public RunId startRun(TemplateId templateId, int version, Map<String, String> inputs) {
        return start(templates.get(templateId, version), inputs);
    }

    private RunId start(DependencyGraph graph, Map<String, String> inputs) {
        requireRunning();
        PipelineTemplate template = graph.template();
        Map<String, String> resolved = TemplateInputs.resolve(template, inputs);
        RunId runId = RunId.generate();

        RunAppender appender = journal.begin(null, (seq, at) -> new RunCreated(runId, seq, at, template.id(),
            template.version(), resolved, template.stageIds(), null), broadcaster::publish);
        appender.append((seq, at) -> new RunStarted(runId, seq, at));
        log.info("Run {} started from template {} ({} stages)", runId.getValue(), template.ref(),
            template.stages().size());

        launch(appender, graph);
        return runId;
    }

    @Override
    public RunId branchRun(RunId parentRunId, long atSequence) {
        requireRunning();
        RunState parentAt = journal.stateAt(parentRunId, atSequence);
        DependencyGraph graph = templates.get(parentAt.templateId(), parentAt.templateVersion());
        RunId childRunId = RunId.generate();
        BranchOrigin origin = new BranchOrigin(parentRunId, atSequence);
        List<StageId> stageIds = new ArrayList<>(parentAt.stages().keySet());

        RunAppender appender = journal.begin(parentAt, (seq, at) -> new RunCreated(childRunId, seq, at,
            parentAt.templateId(), parentAt.templateVersion(), parentAt.inputs(), stageIds, origin),
            broadcaster::publish);
        appender.append((seq, at) -> new RunStarted(childRunId, seq, at));
        log.info("Run {} branched from {} at sequence {}: {} stage(s) kept", childRunId.getValue(),
            parentRunId.getValue(), atSequence, appender.state().stagesWith(StageStatus.COMPLETED).size());

        launch(appender, graph);
        return childRunId;
    }

    @Override
    public RunState recoverRun(RunId runId) {
        requireRunning();
        synchronized (lifecycleLock) {
            Optional<RunLoop> active = registry.find(runId);
            if (active.isPresent()) {
                return active.get().state();
            }
            RunAppender appender = journal.open(runId, broadcaster::publish);
            RunState state = appender.state();
            if (state.isTerminal()) {
                return state;
            }
            DependencyGraph graph = templates.get(state.templateId(), state.templateVersion());
            log.info("Run {} recovered at sequence {} ({})", runId.getValue(), state.lastSequence(), state.status());
            launch(appender, graph);
            return state;
        }
    }

    private void launch(RunAppender appender, DependencyGraph graph) {
        RunLoop loop = new RunLoop(appender, graph, handlers, singleFlight, broadcaster, timers, config);
        registry.register(loop);
        loop.termination().whenComplete((state, failure) -> registry.remove(loop));
        try {
            loopExecutor.execute(loop);
        } catch (RejectedExecutionException e) {
            registry.remove(loop);
            throw new IllegalStateException("Orchestrator is shut down", e);
        }
    }

    // ========================================
    // 조회
    // ========================================

    @Override
    public RunState getRunState(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        Optional<RunLoop> active = registry.find(runId);
        return active.isPresent() ? active.get().state() : journal.load(runId);
    }

    @Override
    public RunState getRunStateAt(RunId runId, long sequence) {
        return journal.stateAt(runId, sequence);
    }

    @Override
    public List<RunEvent> history(RunId runId) {
        return journal.history(runId);
    }

    @Override
    public RunState awaitTermination(RunId runId, Duration timeout) throws InterruptedException, TimeoutException {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        Optional<RunLoop> active = registry.find(runId);
        if (active.isPresent()) {
            try {
                return active.get().termination().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw new IllegalStateException(e.getCause().getMessage(), e.getCause());
            }
        }
        RunState state = journal.load(runId);
        if (state.isTerminal()) {
            return state;
        }
        throw new IllegalStateException("Run " + runId.getValue() + " is not active (status: " + state.status()
            + "); recover it before waiting");
    }

    /**
     * 실행 중인 Run 여부.
     */
    public boolean isActive(RunId runId) {
        return registry.isActive(runId);
    }

    public List<RunId> activeRunIds() {
        List<RunId> runIds = new ArrayList<>();
        for (RunLoop loop : registry.all()) {
            runIds.add(loop.runId());
        }
        return runIds;
    }

    /**
     * 이벤트 저장소에 로그가 있는 모든 Run.
     */
    public List<RunId> knownRunIds() {
        return eventSink.runIds();
    }

    @Override
    public Subscription subscribe(RunId runId, RunListener listener) {
        return broadcaster.subscribe(runId, listener, () -> journal.history(runId));
    }

    // ========================================
    // 제어
    // ========================================

    @Override
    public void supplyFeedback(RunId runId, StageId stageId, FeedbackSelection selection) {
        if (stageId == null) {
            throw new IllegalArgumentException("stageId cannot be null");
        }
        if (selection == null) {
            throw new IllegalArgumentException("selection cannot be null");
        }
        request(runId, ack -> new RunSignal.FeedbackSupplied(stageId, selection, ack));
    }

    @Override
    public void pauseRun(RunId runId) {
        request(runId, RunSignal.PauseRequested::new);
    }

    @Override
    public void resumeRun(RunId runId) {
        request(runId, RunSignal.ResumeRequested::new);
    }

    @Override
    public void skipStage(RunId runId, StageId stageId) {
        if (stageId == null) {
            throw new IllegalArgumentException("stageId cannot be null");
        }
        request(runId, ack -> new RunSignal.SkipRequested(stageId, ack));
    }

    @Override
    public void cancelRun(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        synchronized (lifecycleLock) {
            Optional<RunLoop> active = registry.find(runId);
            if (active.isPresent() && active.get().submit(new RunSignal.CancelRequested("Cancelled by request"))) {
                return;
            }
            if (registry.isActive(runId)) {
                // 루프가 종료 중
                return;
            }

            // 재시작 후 아직 복구되지 않은 Run은 로그에 바로 기록
            RunAppender appender = journal.open(runId, broadcaster::publish);
            RunState state = appender.state();
            if (state.isTerminal()) {
                return;
            }
            List<StageId> interrupted = new ArrayList<>(state.stagesWith(StageStatus.RUNNING));
            interrupted.addAll(state.stagesWith(StageStatus.AWAITING_FEEDBACK));
            appender.append((seq, at) -> new RunCancelled(runId, seq, at, interrupted, "Cancelled while inactive"));
            log.info("Run {} cancelled while inactive", runId.getValue());
        }
    }

    private void request(RunId runId, Function<CompletableFuture<Void>, RunSignal.Acknowledged> factory) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        RunLoop loop = registry.find(runId).orElseThrow(() -> notActive(runId));
        CompletableFuture<Void> ack = new CompletableFuture<>();
        if (!loop.submit(factory.apply(ack))) {
            throw notActive(runId);
        }
        if (loop.isLoopThread()) {
            // 수신자 콜백 안에서 호출된 경우: 루프가 다음 신호로 처리
            return;
        }
        try {
            ack.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for run " + runId.getValue(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    private IllegalStateException notActive(RunId runId) {
        RunState state = journal.load(runId);
        return new IllegalStateException("Run " + runId.getValue() + " is not active (status: " + state.status() + ")");
    }

    // ========================================
    // 캐시
    // ========================================

    @Override
    public void invalidateCache(CacheKey key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateCacheScope(ScopeId scope) {
        cache.invalidateScope(scope);
    }

    @Override
    public CacheStats cacheStats() {
        return cache.stats();
    }

    /**
     * 메모리 캐시의 만료 항목 정리.
     *
     * @return 제거된 항목 수
     */
    public int cleanupExpiredCache() {
        return cache.cleanupExpired();
    }

    // ========================================
    // 종료
    // ========================================

    /**
     * 오케스트레이터 종료.
     *
     * <p>실행 중인 Run 루프는 종료 이벤트 없이 멈추며, 로그는 마지막 기록 상태로 남습니다.
     * 다음 기동 시 {@link RunRecoverer}로 이어서 실행할 수 있습니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트된 경우
     */
    public void shutdown() throws InterruptedException {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        List<RunLoop> loops = registry.all();
        for (RunLoop loop : loops) {
            loop.submit(new RunSignal.Stop());
        }

        loopExecutor.shutdown();
        if (!loopExecutor.awaitTermination(config.cancelTimeoutMs() + config.drainTimeoutMs(), TimeUnit.MILLISECONDS)) {
            loopExecutor.shutdownNow();
        }
        timers.shutdownNow();
        cacheWriter.shutdown();
        if (!cacheWriter.awaitTermination(CACHE_WRITER_SHUTDOWN_MS, TimeUnit.MILLISECONDS)) {
            cacheWriter.shutdownNow();
        }
        log.info("Orchestrator shut down: {} active run(s) stopped", loops.size());
    }

    private void requireRunning() {
        if (shutdown.get()) {
            throw new IllegalStateException("Orchestrator is shut down");
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * DefaultOrchestrator 빌더.
     *
     * <p>eventSink와 generation은 필수입니다.</p>
     */
    public static final class Builder {

        private EventSink eventSink;
        private GenerationCapability generation;
        private CacheBackend cacheBackend;
        private OrchestratorConfig config = new OrchestratorConfig();
        private CacheConfig cacheConfig = new CacheConfig();
        private Clock clock = Clock.systemUTC();
        private TransformRegistry transforms = TransformRegistry.withDefaults();
        private final List<PipelineTemplate> templates = new ArrayList<>();

        private Builder() {
        }

        public Builder eventSink(EventSink eventSink) {
            this.eventSink = eventSink;
            return this;
        }

        public Builder generation(GenerationCapability generation) {
            this.generation = generation;
            return this;
        }

        /**
         * Tier 2 캐시 저장소 (선택).
         */
        public Builder cacheBackend(CacheBackend cacheBackend) {
            this.cacheBackend = cacheBackend;
            return this;
        }

        public Builder config(OrchestratorConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            this.config = config;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig cannot be null");
            }
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            this.clock = clock;
            return this;
        }

        public Builder transforms(TransformRegistry transforms) {
            if (transforms == null) {
                throw new IllegalArgumentException("transforms cannot be null");
            }
            this.transforms = transforms;
            return this;
        }

        public Builder template(PipelineTemplate template) {
            if (template == null) {
                throw new IllegalArgumentException("template cannot be null");
            }
            this.templates.add(template);
            return this;
        }

        public DefaultOrchestrator build() {
            return new DefaultOrchestrator(this);
        }
    }
}

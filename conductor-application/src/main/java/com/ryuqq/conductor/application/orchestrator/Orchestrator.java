package com.ryuqq.conductor.application.orchestrator;

import com.ryuqq.conductor.core.cache.CacheKey;
import com.ryuqq.conductor.core.cache.CacheStats;
import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.ScopeId;
import com.ryuqq.conductor.core.model.StageId;
import com.ryuqq.conductor.core.model.TemplateId;
import com.ryuqq.conductor.core.state.RunState;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * 파이프라인 Run 실행 조정자 (제어 표면).
 *
 * <p>프레젠테이션/전송 계층이 사용하는 유일한 진입점입니다. 모든 상태 조회는
 * 이벤트 로그에서 유도된 {@link RunState}를 반환하며, 모든 변경 요청은
 * Run 루프에 신호로 전달되어 이벤트로 기록됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RunId runId = orchestrator.startRun(TemplateId.of("article"), Map.of("topic", "cats"));
 *
 * try (Subscription subscription = orchestrator.subscribe(runId, new RunListener() {
 *     public void onEvent(RunEvent event) { ... }
 *     public void onChunk(StageId stageId, int attempt, String chunk) { ... }
 * })) {
 *     RunState state = orchestrator.awaitTermination(runId, Duration.ofMinutes(5));
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Orchestrator {

    /**
     * 템플릿의 최신 버전으로 Run 시작.
     *
     * <p>입력값 검증과 RunCreated/RunStarted 기록이 끝난 뒤 반환하며,
     * Stage 실행은 비동기로 진행됩니다.</p>
     *
     * @param templateId 등록된 템플릿 ID
     * @param inputs 입력값
     * @return 새 Run ID
     * @throws com.ryuqq.conductor.core.exception.TemplateNotFoundException 템플릿이 없는 경우
     * @throws com.ryuqq.conductor.core.exception.InputValidationException 입력값이 유효하지 않은 경우
     */
    RunId startRun(TemplateId templateId, Map<String, String> inputs);

    /**
     * 특정 버전의 템플릿으로 Run 시작.
     *
     * @param templateId 템플릿 ID
     * @param version 템플릿 버전
     * @param inputs 입력값
     * @return 새 Run ID
     */
    RunId startRun(TemplateId templateId, int version, Map<String, String> inputs);

    /**
     * 현재 Run 상태.
     *
     * @param runId Run ID
     * @return 이벤트 로그에서 유도된 상태
     * @throws com.ryuqq.conductor.core.exception.RunNotFoundException Run이 없는 경우
     */
    RunState getRunState(RunId runId);

    /**
     * 특정 시퀀스 시점의 Run 상태.
     *
     * @param runId Run ID
     * @param sequence 시퀀스 번호 (1 이상, 마지막 시퀀스 이하)
     * @return 해당 시점까지 접힌 상태
     */
    RunState getRunStateAt(RunId runId, long sequence);

    /**
     * Run의 전체 이벤트 이력 (분기 Run은 부모 접두부 포함).
     *
     * @param runId Run ID
     * @return 시퀀스 순서의 이벤트
     */
    List<RunEvent> history(RunId runId);

    /**
     * 사용자 선택 전달.
     *
     * @param runId Run ID
     * @param stageId 선택을 기다리는 Stage
     * @param selection 후보 인덱스 또는 직접 입력
     * @throws IllegalStateException Stage가 선택을 기다리고 있지 않은 경우
     * @throws IllegalArgumentException 후보 인덱스가 범위를 벗어난 경우
     */
    void supplyFeedback(RunId runId, StageId stageId, FeedbackSelection selection);

    /**
     * Run 취소 요청 (협력적).
     *
     * <p>새 Stage 시작을 막고 진행 중인 외부 호출에 중단을 요청합니다.
     * 이미 종료된 Run에 대해서는 아무 일도 하지 않습니다.</p>
     *
     * @param runId Run ID
     */
    void cancelRun(RunId runId);

    /**
     * Run 일시정지. 진행 중인 Stage는 끝까지 실행되고 새 Stage만 시작되지 않습니다.
     *
     * @param runId Run ID
     */
    void pauseRun(RunId runId);

    /**
     * 일시정지된 Run 재개.
     *
     * @param runId Run ID
     * @throws IllegalStateException Run이 일시정지 상태가 아닌 경우
     */
    void resumeRun(RunId runId);

    /**
     * 대기 중인 Stage를 명시적으로 건너뜀. 하위 Stage는 충족된 것으로 봅니다.
     *
     * @param runId Run ID
     * @param stageId 대기 중인 Stage
     */
    void skipStage(RunId runId, StageId stageId);

    /**
     * Run 이벤트 구독.
     *
     * <p>기존 이력을 먼저 전달한 뒤 새 이벤트를 순서대로 전달합니다.</p>
     *
     * @param runId Run ID
     * @param listener 수신자
     * @return 구독 핸들
     */
    Subscription subscribe(RunId runId, RunListener listener);

    /**
     * Run 분기 (copy-on-write).
     *
     * <p>부모 로그를 복사하지 않고 부모 ID와 분기 시퀀스만 기록합니다.
     * 분기 시점에 완료되지 않은 Stage는 자식 Run에서 다시 실행됩니다.</p>
     *
     * @param parentRunId 부모 Run
     * @param atSequence 분기 시퀀스 (1 이상, 부모 마지막 시퀀스 이하)
     * @return 자식 Run ID
     */
    RunId branchRun(RunId parentRunId, long atSequence);

    /**
     * 재시작 이후 로그에서 Run을 다시 올려 이어서 실행.
     *
     * <p>완료 이벤트가 유실된 Stage는 다시 실행될 수 있습니다 (at-least-once).</p>
     *
     * @param runId Run ID
     * @return 복구 시점의 상태
     */
    RunState recoverRun(RunId runId);

    /**
     * Run 종료 대기.
     *
     * @param runId Run ID
     * @param timeout 최대 대기 시간
     * @return 종료 상태
     * @throws InterruptedException 대기 중 인터럽트된 경우
     * @throws TimeoutException 시간 내 종료되지 않은 경우
     */
    RunState awaitTermination(RunId runId, Duration timeout) throws InterruptedException, TimeoutException;

    /**
     * 캐시 항목 무효화 (두 계층 모두).
     *
     * @param key 캐시 키
     */
    void invalidateCache(CacheKey key);

    /**
     * 격리 범위 전체 무효화 (두 계층 모두).
     *
     * @param scope 격리 범위
     */
    void invalidateCacheScope(ScopeId scope);

    /**
     * 응답 캐시 통계.
     *
     * @return 통계
     */
    CacheStats cacheStats();
}

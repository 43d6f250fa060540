package com.ryuqq.conductor.adapter.runner;

/**
 * 오케스트레이터 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrentStages: Run 하나에서 동시에 RUNNING일 수 있는 Stage 수 (기본 4)</li>
 *   <li>snapshotInterval: 스냅샷 사이의 원시 이벤트 수 (기본 50)</li>
 *   <li>cancelTimeoutMs: 취소 요청 후 진행 중 호출의 종료를 기다리는 시간 (기본 5000ms)</li>
 *   <li>drainTimeoutMs: Run 종료 후 늦게 도착한 결과를 기록하기 위해 기다리는 시간 (기본 2000ms)</li>
 *   <li>isolationScope: 응답 캐시 격리 범위 (기본 "default")</li>
 *   <li>defaultModel: 모델 선호 목록이 비었을 때 사용할 모델 (기본 "gpt-4o-mini")</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>외부 생성 호출이 느리고 독립 Stage가 많으면 maxConcurrentStages 증가</li>
 *   <li>Run이 길고 재시작이 잦으면 snapshotInterval 감소 (재생 비용 감소)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxConcurrentStages Run당 동시 실행 Stage 수 (1 이상)
 * @param snapshotInterval 스냅샷 간격 (1 이상)
 * @param cancelTimeoutMs 취소 대기 시간 (밀리초, 0 이상)
 * @param drainTimeoutMs 종료 후 대기 시간 (밀리초, 0 이상)
 * @param isolationScope 캐시 격리 범위
 * @param defaultModel 기본 모델
 */
public record OrchestratorConfig(
    int maxConcurrentStages,
    int snapshotInterval,
    long cancelTimeoutMs,
    long drainTimeoutMs,
    String isolationScope,
    String defaultModel
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConcurrentStages=4, snapshotInterval=50, cancelTimeoutMs=5000,
     * drainTimeoutMs=2000, isolationScope="default", defaultModel="gpt-4o-mini"</p>
     */
    public OrchestratorConfig() {
        this(4, 50, 5000, 2000, "default", "gpt-4o-mini");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        if (maxConcurrentStages <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrentStages must be positive (current: " + maxConcurrentStages + ")"
            );
        }
        if (snapshotInterval <= 0) {
            throw new IllegalArgumentException(
                "snapshotInterval must be positive (current: " + snapshotInterval + ")"
            );
        }
        if (cancelTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "cancelTimeoutMs must be non-negative (current: " + cancelTimeoutMs + ")"
            );
        }
        if (drainTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "drainTimeoutMs must be non-negative (current: " + drainTimeoutMs + ")"
            );
        }
        if (isolationScope == null || isolationScope.isBlank()) {
            throw new IllegalArgumentException("isolationScope cannot be null or blank");
        }
        if (defaultModel == null || defaultModel.isBlank()) {
            throw new IllegalArgumentException("defaultModel cannot be null or blank");
        }
    }

    /**
     * maxConcurrentStages만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withMaxConcurrentStages(int maxConcurrentStages) {
        return new OrchestratorConfig(maxConcurrentStages, snapshotInterval, cancelTimeoutMs, drainTimeoutMs, isolationScope, defaultModel);
    }

    /**
     * snapshotInterval만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withSnapshotInterval(int snapshotInterval) {
        return new OrchestratorConfig(maxConcurrentStages, snapshotInterval, cancelTimeoutMs, drainTimeoutMs, isolationScope, defaultModel);
    }

    /**
     * cancelTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withCancelTimeoutMs(long cancelTimeoutMs) {
        return new OrchestratorConfig(maxConcurrentStages, snapshotInterval, cancelTimeoutMs, drainTimeoutMs, isolationScope, defaultModel);
    }

    /**
     * drainTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withDrainTimeoutMs(long drainTimeoutMs) {
        return new OrchestratorConfig(maxConcurrentStages, snapshotInterval, cancelTimeoutMs, drainTimeoutMs, isolationScope, defaultModel);
    }

    /**
     * isolationScope만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withIsolationScope(String isolationScope) {
        return new OrchestratorConfig(maxConcurrentStages, snapshotInterval, cancelTimeoutMs, drainTimeoutMs, isolationScope, defaultModel);
    }

    /**
     * defaultModel만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withDefaultModel(String defaultModel) {
        return new OrchestratorConfig(maxConcurrentStages, snapshotInterval, cancelTimeoutMs, drainTimeoutMs, isolationScope, defaultModel);
    }
}

package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 재시작 후 미종료 Run 복구.
 *
 * <p>이벤트 로그에 남아 있는 Run 중 종료되지 않았고 실행 중이 아닌 Run을 찾아
 * {@link DefaultOrchestrator#recoverRun}으로 다시 올립니다.</p>
 *
 * <p><strong>복구 규칙:</strong></p>
 * <ul>
 *   <li>RUNNING으로 남은 시도: 재시도 예산이 있으면 즉시 재시도, 없으면 실패 처리</li>
 *   <li>재시도 대기 중이던 시도: 지연 없이 재시도</li>
 *   <li>AWAITING_FEEDBACK: 그대로 선택을 기다림</li>
 *   <li>PAUSED: 일시정지 상태 유지</li>
 * </ul>
 *
 * <p><strong>실행 주기:</strong> 프로세스 기동 시 1회</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunRecoverer {

    private static final Logger log = LoggerFactory.getLogger(RunRecoverer.class);

    private final DefaultOrchestrator orchestrator;

    /**
     * 생성자.
     *
     * @param orchestrator 복구된 Run을 실행할 오케스트레이터
     * @throws IllegalArgumentException orchestrator가 null인 경우
     */
    public RunRecoverer(DefaultOrchestrator orchestrator) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        this.orchestrator = orchestrator;
    }

    /**
     * 복구 스캔 실행.
     *
     * <p>Run 하나의 복구 실패는 로그로 남기고 나머지 Run을 계속 처리합니다.</p>
     *
     * @return 다시 실행을 시작한 Run 수
     */
    public int recoverAll() {
        log.info("Run recovery scan started");

        List<RunId> runIds = orchestrator.knownRunIds();
        int recovered = 0;
        for (RunId runId : runIds) {
            if (orchestrator.isActive(runId)) {
                continue;
            }
            try {
                RunState state = orchestrator.recoverRun(runId);
                if (!state.isTerminal()) {
                    recovered++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to recover run {} in recovery scan", runId.getValue(), e);
            }
        }

        log.info("Run recovery scan completed: {} recovered out of {} runs", recovered, runIds.size());
        return recovered;
    }
}

package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * (Run, Stage, 시도) 단위 중복 실행 방지.
 *
 * <p>같은 키로 진행 중인 외부 호출은 최대 하나입니다. 키는 결과가 기록된 뒤 해제됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SingleFlightGuard {

    private final Set<Key> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * 실행 권한 획득.
     *
     * @return 이미 같은 키가 진행 중이면 false
     */
    public boolean tryAcquire(RunId runId, StageId stageId, int attempt) {
        return inFlight.add(new Key(runId, stageId, attempt));
    }

    public void release(RunId runId, StageId stageId, int attempt) {
        inFlight.remove(new Key(runId, stageId, attempt));
    }

    public boolean isInFlight(RunId runId, StageId stageId, int attempt) {
        return inFlight.contains(new Key(runId, stageId, attempt));
    }

    public int size() {
        return inFlight.size();
    }

    private record Key(RunId runId, StageId stageId, int attempt) {
    }
}

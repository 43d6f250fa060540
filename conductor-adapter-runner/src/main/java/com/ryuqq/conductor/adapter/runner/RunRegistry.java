package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.core.model.RunId;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 실행 중인 Run 루프 목록.
 *
 * <p>Run 하나에는 루프가 최대 하나만 존재합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class RunRegistry {

    private final Map<RunId, RunLoop> loops = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException 이미 루프가 있는 경우
     */
    void register(RunLoop loop) {
        RunLoop existing = loops.putIfAbsent(loop.runId(), loop);
        if (existing != null) {
            throw new IllegalStateException("Run " + loop.runId().getValue() + " is already active");
        }
    }

    Optional<RunLoop> find(RunId runId) {
        return Optional.ofNullable(loops.get(runId));
    }

    void remove(RunLoop loop) {
        loops.remove(loop.runId(), loop);
    }

    boolean isActive(RunId runId) {
        return loops.containsKey(runId);
    }

    List<RunLoop> all() {
        return List.copyOf(loops.values());
    }
}

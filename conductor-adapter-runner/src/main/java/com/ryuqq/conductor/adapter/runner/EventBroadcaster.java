package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.orchestrator.RunListener;
import com.ryuqq.conductor.application.orchestrator.Subscription;
import com.ryuqq.conductor.core.event.RunEvent;
import com.ryuqq.conductor.core.model.RunId;
import com.ryuqq.conductor.core.model.StageId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Run 이벤트 구독 관리.
 *
 * <p><strong>전달 보장:</strong></p>
 * <ul>
 *   <li>구독 시 기존 이력을 먼저 전달하고, 그동안 도착한 새 이벤트는 버퍼에 쌓았다가 이어서 전달</li>
 *   <li>시퀀스 기준 중복 제거: 같은 이벤트는 한 번만 전달</li>
 *   <li>수신자 예외는 로그만 남김</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final Map<RunId, List<BroadcastSubscription>> subscriptions = new ConcurrentHashMap<>();

    /**
     * 구독 등록.
     *
     * @param runId Run ID
     * @param listener 수신자
     * @param history 등록 이후 읽는 기존 이력
     * @return 구독 핸들
     */
    public Subscription subscribe(RunId runId, RunListener listener, Supplier<List<RunEvent>> history) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }

        BroadcastSubscription subscription = new BroadcastSubscription(runId, listener);
        subscriptions.computeIfAbsent(runId, id -> new CopyOnWriteArrayList<>()).add(subscription);
        try {
            subscription.replay(history.get());
        } catch (RuntimeException e) {
            subscription.close();
            throw e;
        }
        return subscription;
    }

    /**
     * 기록된 이벤트 전달.
     *
     * @param event 이벤트
     */
    public void publish(RunEvent event) {
        List<BroadcastSubscription> targets = subscriptions.get(event.runId());
        if (targets == null) {
            return;
        }
        for (BroadcastSubscription subscription : targets) {
            subscription.deliver(event);
        }
    }

    /**
     * 부분 출력 전달 (이력 없음, 중복 제거 없음).
     *
     * @param runId Run ID
     * @param stageId Stage ID
     * @param attempt 시도 번호
     * @param chunk 부분 텍스트
     */
    public void publishChunk(RunId runId, StageId stageId, int attempt, String chunk) {
        List<BroadcastSubscription> targets = subscriptions.get(runId);
        if (targets == null) {
            return;
        }
        for (BroadcastSubscription subscription : targets) {
            subscription.deliverChunk(stageId, attempt, chunk);
        }
    }

    /**
     * Run의 활성 구독 수.
     *
     * @param runId Run ID
     * @return 구독 수
     */
    public int subscriberCount(RunId runId) {
        List<BroadcastSubscription> targets = subscriptions.get(runId);
        return targets == null ? 0 : targets.size();
    }

    private void remove(BroadcastSubscription subscription) {
        subscriptions.computeIfPresent(subscription.runId, (id, list) -> {
            list.remove(subscription);
            return list.isEmpty() ? null : list;
        });
    }

    private final class BroadcastSubscription implements Subscription {

        private final RunId runId;
        private final RunListener listener;
        private final Object lock = new Object();
        private final List<RunEvent> buffered = new ArrayList<>();
        private boolean replaying = true;
        private long lastDelivered;
        private volatile boolean active = true;

        private BroadcastSubscription(RunId runId, RunListener listener) {
            this.runId = runId;
            this.listener = listener;
        }

        private void replay(List<RunEvent> history) {
            for (RunEvent event : history) {
                if (!active) {
                    return;
                }
                notify(event);
                lastDelivered = Math.max(lastDelivered, event.sequence());
            }
            synchronized (lock) {
                for (RunEvent event : buffered) {
                    deliverLocked(event);
                }
                buffered.clear();
                replaying = false;
            }
        }

        private void deliver(RunEvent event) {
            synchronized (lock) {
                if (!active) {
                    return;
                }
                if (replaying) {
                    buffered.add(event);
                    return;
                }
                deliverLocked(event);
            }
        }

        private void deliverLocked(RunEvent event) {
            if (event.sequence() <= lastDelivered) {
                return;
            }
            lastDelivered = event.sequence();
            notify(event);
        }

        private void deliverChunk(StageId stageId, int attempt, String chunk) {
            if (!active) {
                return;
            }
            try {
                listener.onChunk(stageId, attempt, chunk);
            } catch (RuntimeException e) {
                log.warn("Listener of {} failed on chunk of stage {}", runId, stageId, e);
            }
        }

        private void notify(RunEvent event) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener of {} failed on event {} (sequence {})", runId, event.type(), event.sequence(), e);
            }
        }

        @Override
        public void close() {
            active = false;
            remove(this);
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}

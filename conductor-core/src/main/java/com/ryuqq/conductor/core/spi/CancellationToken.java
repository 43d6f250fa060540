package com.ryuqq.conductor.core.spi;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between the run loop and one in-flight call.
 *
 * <p>Cancellation is one-way: once cancelled a token stays cancelled. Listeners registered
 * after cancellation run immediately on the registering thread.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * Requests cancellation and notifies registered listeners once.
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers an abort hook.
     *
     * @param listener hook run on cancellation
     */
    public void onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }

    /**
     * Throws if cancellation was requested.
     *
     * @throws CancellationException if cancelled
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Cancellation requested");
        }
    }
}

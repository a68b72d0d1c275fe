package com.aviax.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a request and the blocking work
 * it started. Listeners registered after cancellation run immediately.
 */
@Slf4j
public final class CancellationToken {

    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Mark as cancelled and notify listeners. Only the first call has effect.
     */
    public void cancel() {
        if (this == NONE || !cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            runListener(listener);
        }
    }

    /**
     * Register a listener; returns a handle that unregisters it.
     */
    public Runnable onCancel(Runnable listener) {
        if (this == NONE) {
            return () -> {
            };
        }
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            runListener(listener);
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Throw if cancelled.
     */
    public void throwIfCancelled() throws InterruptedException {
        if (isCancelled()) {
            throw new InterruptedException("cancelled");
        }
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed: {}", ErrorUtils.formatErrorMessage(e));
        }
    }
}

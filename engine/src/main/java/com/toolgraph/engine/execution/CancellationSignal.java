package com.toolgraph.engine.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one run. The engine checks it before
 * each node; a tool already in flight is allowed to finish.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** A fresh signal that nobody else holds, so it is never triggered. */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /** @return true if this call triggered the signal, false if it was already set */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

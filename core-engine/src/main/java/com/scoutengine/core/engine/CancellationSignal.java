package com.scoutengine.core.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a detection run. The engine checks it
 * between batches; a batch in flight always completes.
 *
 * @since 1.0.0
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * @return a fresh, not yet cancelled signal
     */
    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationSignal{cancelled=" + cancelled.get() + '}';
    }
}

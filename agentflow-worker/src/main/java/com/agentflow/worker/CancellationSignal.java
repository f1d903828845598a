package com.agentflow.worker;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Best-effort cancellation flag handed to executors at dispatch time.
 * Executors are expected to poll it and stop early; nothing forces them to.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

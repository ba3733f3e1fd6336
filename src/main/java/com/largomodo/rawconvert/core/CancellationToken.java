package com.largomodo.rawconvert.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-way cancellation latch shared by the batch scheduler and every worker of a run.
 * <p>
 * Transitions from "running" to "cancelled" at most once and never reverts. A new run
 * always gets a new token.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Request cancellation. Idempotent.
     *
     * @return true if this call performed the transition, false if already cancelled
     */
    public boolean set() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isSet() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken[" + (isSet() ? "cancelled" : "active") + "]";
    }
}

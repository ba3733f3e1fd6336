package com.largomodo.rawconvert.core;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Handle of a run started with {@link BatchScheduler#start}.
 * <p>
 * Gives the front end its two controls over a running batch: the abort trigger and a way
 * to wait for the terminal status. The run's events are only observable through the
 * event channel.
 */
public final class BatchRun {

    private final CancellationToken token;
    private final CountDownLatch done = new CountDownLatch(1);

    BatchRun(CancellationToken token) {
        this.token = token;
    }

    /**
     * Request cancellation of the run. Idempotent.
     */
    public void abort() {
        token.set();
    }

    public boolean isAborted() {
        return token.isSet();
    }

    public CancellationToken token() {
        return token;
    }

    /**
     * @return true once the scheduler has published its terminal status
     */
    public boolean isDone() {
        return done.getCount() == 0;
    }

    public void await() throws InterruptedException {
        done.await();
    }

    /**
     * @return true if the run finished within the timeout
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }

    void markDone() {
        done.countDown();
    }
}

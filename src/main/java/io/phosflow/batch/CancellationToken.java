package io.phosflow.batch;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-way stop signal shared between the cycle loop and a shutdown hook.
 */
public final class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Sleeps until the timeout elapses or the token is cancelled.
     *
     * @return {@code true} if cancelled
     */
    public boolean await(long timeoutMs) throws InterruptedException {
        return cancelled.await(Math.max(0L, timeoutMs), TimeUnit.MILLISECONDS);
    }
}

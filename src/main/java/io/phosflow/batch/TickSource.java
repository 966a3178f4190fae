package io.phosflow.batch;

/**
 * Paces the cycle loop. Tests substitute a source that ticks immediately.
 */
public interface TickSource {
    /**
     * Blocks until the next cycle is due.
     *
     * @return {@code false} once the token is cancelled
     */
    boolean awaitNextTick(CancellationToken token) throws InterruptedException;
}

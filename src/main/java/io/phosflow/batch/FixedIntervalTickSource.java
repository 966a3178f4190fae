package io.phosflow.batch;

public final class FixedIntervalTickSource implements TickSource {
    private final long intervalMs;

    public FixedIntervalTickSource(long intervalMs) {
        this.intervalMs = Math.max(1L, intervalMs);
    }

    @Override
    public boolean awaitNextTick(CancellationToken token) throws InterruptedException {
        return !token.await(intervalMs);
    }
}

package io.phosflow.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Outer loop: run a cycle, then wait for the next tick, until auto-exit or cancellation.
 */
public final class CycleRunner {
    private static final Logger log = LoggerFactory.getLogger(CycleRunner.class);

    private final BatchController controller;
    private final TickSource ticks;
    private final Consumer<CycleOutcome> listener;

    public CycleRunner(BatchController controller, TickSource ticks, Consumer<CycleOutcome> listener) {
        this.controller = controller;
        this.ticks = ticks;
        this.listener = listener == null ? outcome -> { } : listener;
    }

    /**
     * @return number of cycles run
     */
    public long run(CancellationToken token) throws InterruptedException {
        long cycles = 0;
        while (!token.isCancelled()) {
            CycleOutcome outcome = controller.runCycle();
            cycles++;
            listener.accept(outcome);
            if (outcome.exitRequested()) {
                log.info("Auto-exit after {} idle cycles", outcome.idleCycles());
                return cycles;
            }
            if (!ticks.awaitNextTick(token)) {
                break;
            }
        }
        log.info("Cycle loop cancelled after {} cycles", cycles);
        controller.persist();
        return cycles;
    }
}

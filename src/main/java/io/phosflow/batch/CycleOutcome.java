package io.phosflow.batch;

import java.util.List;

/**
 * Summary of one {@link BatchController#runCycle()} pass, printed as JSON by the CLI.
 */
public record CycleOutcome(
        long cycle,
        List<String> discovered,
        List<String> admitted,
        int active,
        int pending,
        int completed,
        int failed,
        int errors,
        int alertsSent,
        boolean idle,
        int idleCycles,
        boolean saved,
        boolean exitRequested
) {
}

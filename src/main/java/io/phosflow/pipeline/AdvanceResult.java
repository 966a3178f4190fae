package io.phosflow.pipeline;

import io.phosflow.model.Milestone;

/**
 * Outcome of one {@link UnitPipeline#advance()} call.
 *
 * @param milestone   highest milestone reached, ignored when {@code fatal}
 * @param fatal       the unit is fatally blocked; its fatal log exists
 * @param submissions jobs handed to the scheduler during this call
 */
public record AdvanceResult(Milestone milestone, boolean fatal, int submissions) {
    public static final String FATAL_LABEL = "Fatal";

    public static AdvanceResult blocked() {
        return new AdvanceResult(Milestone.STARTING, true, 0);
    }

    public String stageLabel() {
        return fatal ? FATAL_LABEL : milestone.label();
    }
}

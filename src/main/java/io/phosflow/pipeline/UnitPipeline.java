package io.phosflow.pipeline;

/**
 * Stage machine of a single unit.
 */
public interface UnitPipeline {
    /**
     * Moves the unit as far as the artifacts on disk allow. Idempotent: without new artifacts a
     * second call changes nothing and submits nothing.
     */
    AdvanceResult advance();
}

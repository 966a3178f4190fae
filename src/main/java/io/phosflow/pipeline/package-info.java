/**
 * Per-unit stage state machine.
 *
 * <p>{@link io.phosflow.pipeline.PipelineEngine} turns probe observations into
 * {@link io.phosflow.pipeline.StageEvent}s and applies the matching
 * {@link io.phosflow.pipeline.TransitionTable} row. Marker files are only the contract with the
 * job scripts; the typed state lives in SQLite.
 */
package io.phosflow.pipeline;

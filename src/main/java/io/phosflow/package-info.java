/**
 * PhosFlow source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.phosflow.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.phosflow.cli.PhosFlowCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.phosflow.batch.BatchController} admits, advances and watches units each cycle.</li>
 *   <li>{@code io.phosflow.pipeline.PipelineEngine} is the per-unit stage state machine.</li>
 *   <li>{@code io.phosflow.storage.StageStateStore} is the authoritative step state.</li>
 * </ul>
 */
package io.phosflow;

package io.phosflow.probe;

import io.phosflow.model.PipelineStep;

import java.util.Optional;

/**
 * Read-only view of one unit's working tree. Implementations must not modify any file.
 */
public interface ArtifactProbe {
    boolean sourcePresent();

    boolean fatalLogPresent();

    boolean reportPresent();

    /**
     * The external job of this step exited successfully. For the two phases of a MOMAP stage
     * the marker is attributed to the overlap phase until its selection has been recorded.
     */
    boolean completionMarkerPresent(PipelineStep step);

    /**
     * A job script for this step has been written and handed to the scheduler.
     */
    boolean submissionRecordPresent(PipelineStep step);

    /**
     * The primary output shows the external program did not finish cleanly.
     */
    boolean abnormalTermination(PipelineStep step);

    /**
     * Secondary acceptance check. Only frequency steps reject: any imaginary mode.
     */
    boolean unacceptableResult(PipelineStep step);

    /**
     * Wall time the step's last run consumed, in hours.
     */
    double elapsedHours(PipelineStep step);

    OverlapVerdict overlapVerdict(PipelineStep step);

    FailureSignature errorSignature(PipelineStep step);

    boolean retryMarkerPresent(PipelineStep step);

    Optional<String> selectionMarker(PipelineStep step);
}

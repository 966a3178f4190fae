package io.phosflow.model;

/**
 * Persisted state of one pipeline step of one unit.
 *
 * @param selectedArtifact overlap phase only: the displacement file chosen for the rate job
 * @param jobId            scheduler job id of the latest submission, empty when unknown
 */
public record StageRecord(
        String unitId,
        PipelineStep step,
        StageState state,
        boolean retryUsed,
        String selectedArtifact,
        String jobId,
        long updatedAtMs
) {
    public static StageRecord initial(String unitId, PipelineStep step, long nowMs) {
        return new StageRecord(unitId, step, StageState.NOT_STARTED, false, null, null, nowMs);
    }

    public StageRecord withState(StageState next, long nowMs) {
        return new StageRecord(unitId, step, next, retryUsed, selectedArtifact, jobId, nowMs);
    }

    public StageRecord withRetryUsed(long nowMs) {
        return new StageRecord(unitId, step, state, true, selectedArtifact, jobId, nowMs);
    }

    public StageRecord withSelectedArtifact(String artifact, long nowMs) {
        return new StageRecord(unitId, step, state, retryUsed, artifact, jobId, nowMs);
    }

    public StageRecord withJobId(String id, long nowMs) {
        return new StageRecord(unitId, step, state, retryUsed, selectedArtifact, id, nowMs);
    }
}

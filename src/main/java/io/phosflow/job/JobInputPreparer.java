package io.phosflow.job;

import io.phosflow.model.PipelineStep;

import java.util.Optional;

/**
 * Writes the program inputs of one step into its stage directory.
 */
public interface JobInputPreparer {
    /**
     * @return empty while an upstream artifact the inputs derive from has not appeared yet
     * @throws InputPreparationException when an upstream artifact exists but cannot be used
     */
    Optional<PreparedJob> prepare(PipelineStep step, JobVariant variant);
}

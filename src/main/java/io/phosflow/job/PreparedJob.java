package io.phosflow.job;

import io.phosflow.model.Stage;

import java.nio.file.Path;

/**
 * Inputs are on disk; the job only needs a scheduler script and a submission.
 *
 * @param inputFile file name, relative to {@code workDir}, the program is started with
 */
public record PreparedJob(
        Stage stage,
        JobKind kind,
        String jobName,
        Path workDir,
        String inputFile,
        JobVariant variant
) {
}

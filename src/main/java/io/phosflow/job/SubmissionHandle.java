package io.phosflow.job;

import java.nio.file.Path;

/**
 * @param jobId scheduler job id, empty when the scheduler output could not be parsed
 */
public record SubmissionHandle(String jobId, Path script) {
}

package io.phosflow.job;

/**
 * Hands a prepared job to the batch scheduler. Returns once the scheduler has accepted it; the job's
 * results are only ever observed later through the files it writes.
 */
public interface ExternalJobAdapter {
    SubmissionHandle submit(PreparedJob job);
}

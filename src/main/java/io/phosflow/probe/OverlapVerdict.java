package io.phosflow.probe;

/**
 * Result of validating the reorganization energies of a finished overlap job.
 */
public record OverlapVerdict(Outcome outcome, String selectedFile, String detail) {
    public enum Outcome {
        ACCEPTED,
        THRESHOLD_EXCEEDED,
        NO_CANDIDATE
    }

    public static OverlapVerdict accepted(String file, String detail) {
        return new OverlapVerdict(Outcome.ACCEPTED, file, detail);
    }

    public static OverlapVerdict exceeded(String detail) {
        return new OverlapVerdict(Outcome.THRESHOLD_EXCEEDED, null, detail);
    }

    public static OverlapVerdict noCandidate(String detail) {
        return new OverlapVerdict(Outcome.NO_CANDIDATE, null, detail);
    }
}

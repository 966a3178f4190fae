package io.phosflow.probe;

/**
 * Classification of an overlap job's error log.
 */
public enum FailureSignature {
    NONE,
    /** Internal-coordinate transformation failed; rerunning in Cartesian coordinates may succeed. */
    COORDINATE,
    CRASH
}

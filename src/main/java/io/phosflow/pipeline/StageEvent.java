package io.phosflow.pipeline;

/**
 * Observation derived from the probe for one step in its current state.
 */
public enum StageEvent {
    GATE_CLOSED,
    GATE_OPEN,
    ALREADY_SUBMITTED,
    ACCEPTED_ON_DISK,
    JOB_PENDING,
    ABNORMAL_TERMINATION,
    JOB_CRASHED,
    VALIDATION_PASSED,
    VALIDATION_REJECTED,
    DIAGNOSABLE_ERROR,
    THRESHOLD_EXCEEDED,
    RETRY_AVAILABLE,
    RETRY_EXHAUSTED,
    BUDGET_EXCEEDED,
    INPUT_UNUSABLE
}

package io.phosflow.model;

public enum StepKind {
    OPTIMIZATION,
    FREQUENCY,
    COUPLING,
    OVERLAP,
    RATE
}

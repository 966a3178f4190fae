package io.phosflow.job;

public enum JobKind {
    GAUSSIAN,
    ORCA,
    MOMAP
}

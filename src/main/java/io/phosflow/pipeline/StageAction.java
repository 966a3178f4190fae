package io.phosflow.pipeline;

public enum StageAction {
    NONE,
    SUBMIT,
    ACCEPT,
    MARK_FATAL,
    REOPTIMIZE_STRICT,
    RESUBMIT_CARTESIAN
}

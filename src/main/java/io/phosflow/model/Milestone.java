package io.phosflow.model;

import java.util.Map;
import java.util.function.Predicate;

/**
 * Human-readable progress labels written to the status report, lowest first.
 */
public enum Milestone {
    STARTING("Starting / In Progress"),
    S0_DONE("Gaussian S0 Done"),
    S1_DONE("Gaussian S1 Done"),
    T1_DONE("Gaussian T1 Done"),
    ORCA_DONE("ORCA Done"),
    KR_DONE("MOMAP Kr Done"),
    KISC_DONE("MOMAP Kisc Done"),
    KIC_DONE("MOMAP Kic Done"),
    ANALYSIS_DONE("Analysis Done");

    private final String label;

    Milestone(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Highest milestone reached given which steps are READY and whether the report exists.
     */
    public static Milestone reached(Map<PipelineStep, StageState> states, boolean reportPresent) {
        if (reportPresent) {
            return ANALYSIS_DONE;
        }
        Predicate<PipelineStep> ready = step -> states.get(step) == StageState.READY;
        if (ready.test(PipelineStep.KIC_RATE)) {
            return KIC_DONE;
        }
        if (ready.test(PipelineStep.KISC_RATE)) {
            return KISC_DONE;
        }
        if (ready.test(PipelineStep.KR_RATE)) {
            return KR_DONE;
        }
        if (ready.test(PipelineStep.SOC)) {
            return ORCA_DONE;
        }
        if (ready.test(PipelineStep.T1_FREQ)) {
            return T1_DONE;
        }
        if (ready.test(PipelineStep.S1_FREQ)) {
            return S1_DONE;
        }
        if (ready.test(PipelineStep.S0_FREQ)) {
            return S0_DONE;
        }
        return STARTING;
    }

    public static Milestone fromLabel(String label) {
        if (label == null) {
            return STARTING;
        }
        for (Milestone value : values()) {
            if (value.label.equals(label)) {
                return value;
            }
        }
        return STARTING;
    }
}

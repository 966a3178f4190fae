package io.phosflow.model;

import java.util.List;

/**
 * Unit of work tracked by the pipeline state machine.
 *
 * <p>Seven stages map to a single step. The three MOMAP stages run in two phases inside the same
 * directory: a normal-mode overlap job whose output is validated, then the rate job itself.
 * Declaration order is evaluation order.
 */
public enum PipelineStep {
    S0_OPT(Stage.S0_OPT, StepKind.OPTIMIZATION, Geometry.S0),
    S0_FREQ(Stage.S0_FREQ, StepKind.FREQUENCY, Geometry.S0),
    S1_OPT(Stage.S1_OPT, StepKind.OPTIMIZATION, Geometry.S1),
    S1_FREQ(Stage.S1_FREQ, StepKind.FREQUENCY, Geometry.S1),
    T1_OPT(Stage.T1_OPT, StepKind.OPTIMIZATION, Geometry.T1),
    T1_FREQ(Stage.T1_FREQ, StepKind.FREQUENCY, Geometry.T1),
    SOC(Stage.SOC, StepKind.COUPLING, null),
    KR_OVERLAP(Stage.KR, StepKind.OVERLAP, null),
    KR_RATE(Stage.KR, StepKind.RATE, null),
    KISC_OVERLAP(Stage.KISC, StepKind.OVERLAP, null),
    KISC_RATE(Stage.KISC, StepKind.RATE, null),
    KIC_OVERLAP(Stage.KIC, StepKind.OVERLAP, null),
    KIC_RATE(Stage.KIC, StepKind.RATE, null);

    private final Stage stage;
    private final StepKind kind;
    private final Geometry geometry;

    PipelineStep(Stage stage, StepKind kind, Geometry geometry) {
        this.stage = stage;
        this.kind = kind;
        this.geometry = geometry;
    }

    public Stage stage() {
        return stage;
    }

    public StepKind kind() {
        return kind;
    }

    public Geometry geometry() {
        return geometry;
    }

    /**
     * Optimisation step paired with this frequency step.
     */
    public PipelineStep optimizationStep() {
        return switch (this) {
            case S0_FREQ -> S0_OPT;
            case S1_FREQ -> S1_OPT;
            case T1_FREQ -> T1_OPT;
            default -> throw new IllegalStateException("No optimisation step paired with " + this);
        };
    }

    public static List<PipelineStep> rateSteps() {
        return List.of(KR_RATE, KISC_RATE, KIC_RATE);
    }
}

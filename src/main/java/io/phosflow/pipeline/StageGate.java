package io.phosflow.pipeline;

import io.phosflow.model.PipelineStep;
import io.phosflow.model.StageState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed dependency graph between pipeline steps.
 */
public final class StageGate {
    private static final Map<PipelineStep, Set<PipelineStep>> REQUIRES = buildRequirements();

    public Set<PipelineStep> requirements(PipelineStep step) {
        return REQUIRES.get(step);
    }

    /**
     * A step may start once every declared upstream step is READY.
     */
    public boolean isEligible(PipelineStep step, Map<PipelineStep, StageState> states) {
        for (PipelineStep upstream : REQUIRES.get(step)) {
            if (states.get(upstream) != StageState.READY) {
                return false;
            }
        }
        return true;
    }

    public boolean analysisEligible(Map<PipelineStep, StageState> states) {
        for (PipelineStep rate : PipelineStep.rateSteps()) {
            if (states.get(rate) != StageState.READY) {
                return false;
            }
        }
        return true;
    }

    private static Map<PipelineStep, Set<PipelineStep>> buildRequirements() {
        Map<PipelineStep, Set<PipelineStep>> out = new EnumMap<>(PipelineStep.class);
        require(out, PipelineStep.S0_OPT);
        require(out, PipelineStep.S0_FREQ, PipelineStep.S0_OPT);
        require(out, PipelineStep.S1_OPT, PipelineStep.S0_FREQ);
        require(out, PipelineStep.S1_FREQ, PipelineStep.S1_OPT);
        require(out, PipelineStep.T1_OPT, PipelineStep.S0_FREQ);
        require(out, PipelineStep.T1_FREQ, PipelineStep.T1_OPT);
        require(out, PipelineStep.SOC, PipelineStep.S1_FREQ, PipelineStep.T1_FREQ);
        require(out, PipelineStep.KR_OVERLAP, PipelineStep.S0_FREQ, PipelineStep.T1_FREQ, PipelineStep.SOC);
        require(out, PipelineStep.KR_RATE, PipelineStep.KR_OVERLAP);
        require(out, PipelineStep.KISC_OVERLAP, PipelineStep.S0_FREQ, PipelineStep.T1_FREQ, PipelineStep.SOC);
        require(out, PipelineStep.KISC_RATE, PipelineStep.KISC_OVERLAP);
        require(out, PipelineStep.KIC_OVERLAP, PipelineStep.S0_FREQ, PipelineStep.S1_FREQ);
        require(out, PipelineStep.KIC_RATE, PipelineStep.KIC_OVERLAP);
        return Collections.unmodifiableMap(out);
    }

    private static void require(Map<PipelineStep, Set<PipelineStep>> out, PipelineStep step, PipelineStep... upstream) {
        Set<PipelineStep> deps = EnumSet.noneOf(PipelineStep.class);
        deps.addAll(List.of(upstream));
        out.put(step, Collections.unmodifiableSet(deps));
    }
}

package io.phosflow.batch;

import io.phosflow.model.Milestone;
import io.phosflow.pipeline.AdvanceResult;
import io.phosflow.pipeline.UnitPipeline;
import io.phosflow.pipeline.UnitPipelineFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unit pipelines whose outcome the test dictates per unit.
 */
final class ScriptedPipelines implements UnitPipelineFactory {
    final Map<String, AdvanceResult> results = new HashMap<>();
    final Set<String> failing = new HashSet<>();
    final List<String> advanced = new ArrayList<>();

    @Override
    public UnitPipeline forUnit(String unitId) {
        return () -> {
            advanced.add(unitId);
            if (failing.contains(unitId)) {
                throw new IllegalStateException("sbatch: error: Batch job submission failed");
            }
            return results.getOrDefault(unitId, new AdvanceResult(Milestone.STARTING, false, 0));
        };
    }
}

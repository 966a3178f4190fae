package io.phosflow.pipeline;

import io.phosflow.job.InputPreparationException;
import io.phosflow.job.JobInputPreparer;
import io.phosflow.job.JobKind;
import io.phosflow.job.JobVariant;
import io.phosflow.job.PreparedJob;
import io.phosflow.model.PipelineStep;
import io.phosflow.model.UnitLayout;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Names each job after its step so tests can tell the two MOMAP phases apart.
 */
final class FakeJobInputPreparer implements JobInputPreparer {
    final Set<PipelineStep> notReady = EnumSet.noneOf(PipelineStep.class);
    final Map<PipelineStep, String> unusable = new EnumMap<>(PipelineStep.class);
    private final UnitLayout layout;

    FakeJobInputPreparer(UnitLayout layout) {
        this.layout = layout;
    }

    @Override
    public Optional<PreparedJob> prepare(PipelineStep step, JobVariant variant) {
        if (unusable.containsKey(step)) {
            throw new InputPreparationException(unusable.get(step));
        }
        if (notReady.contains(step)) {
            return Optional.empty();
        }
        JobKind kind = switch (step.kind()) {
            case OPTIMIZATION, FREQUENCY -> JobKind.GAUSSIAN;
            case COUPLING -> JobKind.ORCA;
            case OVERLAP, RATE -> JobKind.MOMAP;
        };
        return Optional.of(new PreparedJob(step.stage(), kind, step.name(), layout.stageDir(step.stage()), "input", variant));
    }
}

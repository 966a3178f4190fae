package io.phosflow.pipeline;

import io.phosflow.model.PipelineStep;
import io.phosflow.model.StepKind;
import io.phosflow.model.UnitLayout;
import io.phosflow.probe.ArtifactProbe;
import io.phosflow.probe.FailureSignature;
import io.phosflow.probe.OverlapVerdict;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Marker files and the presence of {@code momap.err} are read from the unit tree so engine file
 * operations stay visible; log content checks come from fields the test sets.
 */
final class FakeArtifactProbe implements ArtifactProbe {
    final Set<PipelineStep> abnormal = EnumSet.noneOf(PipelineStep.class);
    final Set<PipelineStep> imaginaryModes = EnumSet.noneOf(PipelineStep.class);
    final Map<PipelineStep, Double> elapsedHours = new EnumMap<>(PipelineStep.class);
    final Map<PipelineStep, OverlapVerdict> verdicts = new EnumMap<>(PipelineStep.class);
    final Map<PipelineStep, FailureSignature> signatures = new EnumMap<>(PipelineStep.class);
    boolean report;

    private final UnitLayout layout;

    FakeArtifactProbe(UnitLayout layout) {
        this.layout = layout;
    }

    @Override
    public boolean sourcePresent() {
        return true;
    }

    @Override
    public boolean fatalLogPresent() {
        return Files.exists(layout.fatalLog());
    }

    @Override
    public boolean reportPresent() {
        return report;
    }

    @Override
    public boolean completionMarkerPresent(PipelineStep step) {
        return Files.exists(layout.completionMarker(step.stage())) && ownsMarkers(step);
    }

    @Override
    public boolean submissionRecordPresent(PipelineStep step) {
        return Files.exists(layout.submissionRecord(step.stage())) && ownsMarkers(step);
    }

    @Override
    public boolean abnormalTermination(PipelineStep step) {
        return abnormal.contains(step);
    }

    @Override
    public boolean unacceptableResult(PipelineStep step) {
        return imaginaryModes.contains(step);
    }

    @Override
    public double elapsedHours(PipelineStep step) {
        return elapsedHours.getOrDefault(step, 1.0);
    }

    @Override
    public OverlapVerdict overlapVerdict(PipelineStep step) {
        return verdicts.getOrDefault(step, OverlapVerdict.accepted(UnitLayout.OVERLAP_CARTESIAN_FILE, "mean 812.5 cm-1"));
    }

    @Override
    public FailureSignature errorSignature(PipelineStep step) {
        if (!Files.exists(layout.overlapErrorLog(step.stage()))) {
            return FailureSignature.NONE;
        }
        return signatures.getOrDefault(step, FailureSignature.NONE);
    }

    @Override
    public boolean retryMarkerPresent(PipelineStep step) {
        return switch (step.kind()) {
            case OPTIMIZATION, FREQUENCY -> Files.exists(layout.geometryRetryMarker(step.geometry()));
            case OVERLAP -> Files.exists(layout.coordinateRetryMarker(step.stage()));
            default -> false;
        };
    }

    @Override
    public Optional<String> selectionMarker(PipelineStep step) {
        Path marker = layout.selectionMarker(step.stage());
        if (!Files.exists(marker)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(marker, StandardCharsets.UTF_8).trim());
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    private boolean ownsMarkers(PipelineStep step) {
        boolean selected = Files.exists(layout.selectionMarker(step.stage()));
        if (step.kind() == StepKind.OVERLAP) {
            return !selected;
        }
        if (step.kind() == StepKind.RATE) {
            return selected;
        }
        return true;
    }
}

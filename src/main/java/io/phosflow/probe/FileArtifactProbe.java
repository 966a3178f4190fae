package io.phosflow.probe;

import io.phosflow.model.PipelineStep;
import io.phosflow.model.Stage;
import io.phosflow.model.StepKind;
import io.phosflow.model.UnitLayout;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class FileArtifactProbe implements ArtifactProbe {
    private final UnitLayout layout;
    private final double reorganizationThreshold;

    public FileArtifactProbe(UnitLayout layout, double reorganizationThreshold) {
        this.layout = layout;
        this.reorganizationThreshold = reorganizationThreshold;
    }

    @Override
    public boolean sourcePresent() {
        return Files.isRegularFile(layout.sourceFile());
    }

    @Override
    public boolean fatalLogPresent() {
        return Files.exists(layout.fatalLog());
    }

    @Override
    public boolean reportPresent() {
        return Files.exists(layout.report());
    }

    @Override
    public boolean completionMarkerPresent(PipelineStep step) {
        Stage stage = step.stage();
        if (!Files.exists(layout.completionMarker(stage))) {
            return false;
        }
        return phaseOwnsMarkers(step);
    }

    @Override
    public boolean submissionRecordPresent(PipelineStep step) {
        Stage stage = step.stage();
        if (!Files.exists(layout.submissionRecord(stage))) {
            return false;
        }
        return phaseOwnsMarkers(step);
    }

    @Override
    public boolean abnormalTermination(PipelineStep step) {
        Stage stage = step.stage();
        return switch (step.kind()) {
            case OPTIMIZATION, FREQUENCY -> {
                Optional<String> log = read(layout.gaussianLog(stage));
                yield log.isEmpty() || !GaussianLogs.terminatedNormally(log.get());
            }
            case COUPLING -> {
                Optional<String> out = read(layout.orcaOutput());
                yield out.isEmpty() || !OrcaLogs.terminatedNormally(out.get());
            }
            case RATE -> !Files.exists(layout.rateLog(stage));
            case OVERLAP -> false;
        };
    }

    @Override
    public boolean unacceptableResult(PipelineStep step) {
        if (step.kind() != StepKind.FREQUENCY) {
            return false;
        }
        return read(layout.gaussianLog(step.stage()))
                .map(log -> !GaussianLogs.imaginaryFrequencies(log).isEmpty())
                .orElse(false);
    }

    @Override
    public double elapsedHours(PipelineStep step) {
        if (step.kind() != StepKind.OPTIMIZATION && step.kind() != StepKind.FREQUENCY) {
            return 0.0;
        }
        return read(layout.gaussianLog(step.stage())).map(GaussianLogs::elapsedHours).orElse(0.0);
    }

    @Override
    public OverlapVerdict overlapVerdict(PipelineStep step) {
        Stage stage = step.stage();
        Map<String, Double> means = new LinkedHashMap<>();
        for (String name : List.of(UnitLayout.OVERLAP_INTERNAL_FILE, UnitLayout.OVERLAP_CARTESIAN_FILE)) {
            Optional<String> content = read(layout.stageDir(stage).resolve(name));
            if (content.isEmpty()) {
                continue;
            }
            Optional<double[]> energies = MomapLogs.reorganizationEnergies(content.get());
            if (energies.isEmpty()) {
                continue;
            }
            double first = energies.get()[0];
            double second = energies.get()[1];
            if (first > reorganizationThreshold || second > reorganizationThreshold) {
                return OverlapVerdict.exceeded(String.format(Locale.ROOT,
                        "%s reorganization energy (%.1f, %.1f) cm-1 exceeds %.0f",
                        name, first, second, reorganizationThreshold));
            }
            means.put(name, (first + second) / 2.0);
        }
        if (means.isEmpty()) {
            return OverlapVerdict.noCandidate("No reorganization energy found in "
                    + UnitLayout.OVERLAP_INTERNAL_FILE + " or " + UnitLayout.OVERLAP_CARTESIAN_FILE);
        }
        Map.Entry<String, Double> best = null;
        for (Map.Entry<String, Double> e : means.entrySet()) {
            if (best == null || e.getValue() < best.getValue()) {
                best = e;
            }
        }
        return OverlapVerdict.accepted(best.getKey(),
                String.format(Locale.ROOT, "%s mean reorganization %.1f cm-1", best.getKey(), best.getValue()));
    }

    @Override
    public FailureSignature errorSignature(PipelineStep step) {
        if (step.kind() != StepKind.OVERLAP) {
            return FailureSignature.NONE;
        }
        return read(layout.overlapErrorLog(step.stage()))
                .map(MomapLogs::errorSignature)
                .orElse(FailureSignature.NONE);
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
        if (step.kind() != StepKind.OVERLAP && step.kind() != StepKind.RATE) {
            return Optional.empty();
        }
        return read(layout.selectionMarker(step.stage())).map(String::trim).filter(s -> !s.isEmpty());
    }

    private boolean phaseOwnsMarkers(PipelineStep step) {
        boolean selected = Files.exists(layout.selectionMarker(step.stage()));
        return switch (step.kind()) {
            case OVERLAP -> !selected;
            case RATE -> selected;
            default -> true;
        };
    }

    private static Optional<String> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new String(Files.readAllBytes(file), StandardCharsets.ISO_8859_1));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read artifact: " + file, e);
        }
    }
}

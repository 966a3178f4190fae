package io.phosflow.job;

import io.phosflow.config.PipelineSettings;
import io.phosflow.model.Geometry;
import io.phosflow.model.PipelineStep;
import io.phosflow.model.Stage;
import io.phosflow.model.StepKind;
import io.phosflow.model.UnitLayout;
import io.phosflow.probe.Atom;
import io.phosflow.probe.GaussianLogs;
import io.phosflow.probe.OrcaLogs;
import io.phosflow.probe.Structures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

public final class FileJobInputPreparer implements JobInputPreparer {
    private static final Logger log = LoggerFactory.getLogger(FileJobInputPreparer.class);

    private final UnitLayout layout;
    private final PipelineSettings settings;

    public FileJobInputPreparer(UnitLayout layout, PipelineSettings settings) {
        this.layout = layout;
        this.settings = settings;
    }

    @Override
    public Optional<PreparedJob> prepare(PipelineStep step, JobVariant variant) {
        return switch (step.kind()) {
            case OPTIMIZATION -> prepareOptimization(step, variant);
            case FREQUENCY -> prepareFrequency(step);
            case COUPLING -> prepareCoupling();
            case OVERLAP -> prepareOverlap(step, variant);
            case RATE -> prepareRate(step);
        };
    }

    private Optional<PreparedJob> prepareOptimization(PipelineStep step, JobVariant variant) {
        Geometry geometry = step.geometry();
        List<Atom> atoms;
        if (geometry == Geometry.S0) {
            try {
                atoms = Structures.readXyz(layout.sourceFile());
            } catch (IllegalArgumentException e) {
                throw new InputPreparationException("Unusable source structure " + layout.sourceFile() + ": " + e.getMessage(), e);
            }
        } else {
            Optional<List<Atom>> fromGround = geometryFrom(layout.gaussianLog(Stage.S0_OPT));
            if (fromGround.isEmpty()) {
                return Optional.empty();
            }
            atoms = fromGround.get();
        }
        return Optional.of(writeGaussian(step, variant, atoms));
    }

    private Optional<PreparedJob> prepareFrequency(PipelineStep step) {
        Stage optStage = step.optimizationStep().stage();
        Path optChk = layout.checkpoint(optStage);
        Path optLog = layout.gaussianLog(optStage);
        if (!Files.exists(optChk) || !Files.exists(optLog)) {
            log.debug("{}: waiting for {} and {}", layout.unitId(), optChk.getFileName(), optLog.getFileName());
            return Optional.empty();
        }
        Optional<List<Atom>> atoms = geometryFrom(optLog);
        if (atoms.isEmpty()) {
            return Optional.empty();
        }
        copy(optChk, layout.checkpoint(step.stage()));
        return Optional.of(writeGaussian(step, JobVariant.STANDARD, atoms.get()));
    }

    private Optional<PreparedJob> prepareCoupling() {
        Optional<List<Atom>> atoms = geometryFrom(layout.gaussianLog(Stage.T1_OPT));
        if (atoms.isEmpty()) {
            return Optional.empty();
        }
        Stage stage = Stage.SOC;
        String jobName = stage.jobName(layout.unitId());
        String inputFile = jobName + ".inp";
        write(layout.stageDir(stage).resolve(inputFile), OrcaInput.render(atoms.get(), settings.orcaMaxcoreMb()));
        return Optional.of(new PreparedJob(stage, JobKind.ORCA, jobName, layout.stageDir(stage), inputFile, JobVariant.STANDARD));
    }

    private Optional<PreparedJob> prepareOverlap(PipelineStep step, JobVariant variant) {
        Stage stage = step.stage();
        Stage partner = partnerFrequencyStage(stage);
        String partnerName = partnerLogName(stage);
        Path groundLog = layout.gaussianLog(Stage.S0_FREQ);
        Path partnerLog = layout.gaussianLog(partner);
        if (!Files.exists(groundLog) || !Files.exists(partnerLog)) {
            return Optional.empty();
        }
        Path dir = layout.stageDir(stage);
        copy(groundLog, dir.resolve("s0.log"));
        copy(partnerLog, dir.resolve(partnerName + ".log"));
        copyIfPresent(layout.jobFile(Stage.S0_FREQ, ".fchk"), dir.resolve("s0.fchk"));
        copyIfPresent(layout.jobFile(partner, ".fchk"), dir.resolve(partnerName + ".fchk"));

        boolean cartesian = variant == JobVariant.CARTESIAN_COORDINATES;
        write(dir.resolve(MomapInput.FILE_NAME), MomapInput.overlap("s0.log", partnerName + ".log", cartesian));
        String jobName = stage.jobName(layout.unitId()) + "_evc";
        return Optional.of(new PreparedJob(stage, JobKind.MOMAP, jobName, dir, MomapInput.FILE_NAME, variant));
    }

    private Optional<PreparedJob> prepareRate(PipelineStep step) {
        Stage stage = step.stage();
        Path dir = layout.stageDir(stage);
        String partnerName = partnerLogName(stage);
        double ground = energyOf(dir.resolve("s0.log"));
        double excited = energyOf(dir.resolve(partnerName + ".log"));
        double ead = Math.abs(excited - ground);
        double temperature = settings.temperatureK();

        String content = switch (stage) {
            case KR -> MomapInput.radiative(ead, OrcaLogs.emissionDipole(readOrcaOutput()), selectedFile(stage), temperature);
            case KISC -> MomapInput.intersystemCrossing(ead, OrcaLogs.spinOrbitCoupling(readOrcaOutput()), selectedFile(stage), temperature);
            case KIC -> MomapInput.internalConversion(ead, UnitLayout.OVERLAP_CARTESIAN_FILE, UnitLayout.OVERLAP_NAC_FILE, temperature);
            default -> throw new IllegalArgumentException("Not a rate stage: " + stage);
        };
        write(dir.resolve(MomapInput.FILE_NAME), content);
        return Optional.of(new PreparedJob(stage, JobKind.MOMAP, stage.jobName(layout.unitId()), dir,
                MomapInput.FILE_NAME, JobVariant.STANDARD));
    }

    private JobVariant effective(PipelineStep step, JobVariant variant) {
        return step.kind() == StepKind.OPTIMIZATION ? variant : JobVariant.STANDARD;
    }

    private PreparedJob writeGaussian(PipelineStep step, JobVariant variant, List<Atom> atoms) {
        Stage stage = step.stage();
        JobVariant used = effective(step, variant);
        String jobName = stage.jobName(layout.unitId());
        String inputFile = jobName + ".gjf";
        String route = GaussianInput.route(step.geometry(), step.kind(), used, settings.methodRoute());
        write(layout.stageDir(stage).resolve(inputFile),
                GaussianInput.render(jobName, route, step.geometry(), atoms, settings));
        return new PreparedJob(stage, JobKind.GAUSSIAN, jobName, layout.stageDir(stage), inputFile, used);
    }

    private Optional<List<Atom>> geometryFrom(Path gaussianLog) {
        if (!Files.exists(gaussianLog)) {
            return Optional.empty();
        }
        Optional<List<Atom>> atoms = GaussianLogs.lastGeometry(read(gaussianLog));
        if (atoms.isEmpty()) {
            throw new InputPreparationException("No orientation block in " + gaussianLog);
        }
        return atoms;
    }

    private double energyOf(Path gaussianLog) {
        if (!Files.exists(gaussianLog)) {
            throw new InputPreparationException("Missing frequency log copy " + gaussianLog);
        }
        double energy = GaussianLogs.finalEnergy(read(gaussianLog));
        if (energy == 0.0) {
            throw new InputPreparationException("No final energy in " + gaussianLog);
        }
        return energy;
    }

    private String readOrcaOutput() {
        Path out = layout.orcaOutput();
        if (!Files.exists(out)) {
            throw new InputPreparationException("Missing ORCA output " + out);
        }
        return read(out);
    }

    private String selectedFile(Stage stage) {
        Path marker = layout.selectionMarker(stage);
        if (!Files.exists(marker)) {
            throw new InputPreparationException("Overlap selection not recorded in " + marker);
        }
        String selected = read(marker).trim();
        return selected.isEmpty() ? UnitLayout.OVERLAP_CARTESIAN_FILE : selected;
    }

    static Stage partnerFrequencyStage(Stage rateStage) {
        return switch (rateStage) {
            case KR, KISC -> Stage.T1_FREQ;
            case KIC -> Stage.S1_FREQ;
            default -> throw new IllegalArgumentException("Not a rate stage: " + rateStage);
        };
    }

    private static String partnerLogName(Stage rateStage) {
        return partnerFrequencyStage(rateStage) == Stage.T1_FREQ ? "t1" : "s1";
    }

    private static String read(Path file) {
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new InputPreparationException("Failed to read " + file, e);
        }
    }

    private static void write(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write job input: " + file, e);
        }
    }

    private static void copy(Path from, Path to) {
        try {
            Files.createDirectories(to.getParent());
            Files.copy(from, to, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RuntimeException("Failed to copy " + from + " to " + to, e);
        }
    }

    private static void copyIfPresent(Path from, Path to) {
        if (Files.exists(from)) {
            copy(from, to);
        }
    }
}

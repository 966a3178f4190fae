package io.phosflow.model;

import java.nio.file.Path;

/**
 * File names shared with the job scripts. These markers are the boundary contract with the
 * cluster side; pipeline state itself lives in the stage store.
 */
public record UnitLayout(String unitId, Path unitDir, Path sourceFile) {
    public static final String COMPLETION_MARKER = "job.done";
    public static final String SUBMISSION_RECORD = "run.slurm";
    public static final String GEOMETRY_RETRY_MARKER = "RETRY_CALCALL";
    public static final String COORDINATE_RETRY_MARKER = "RETRY_CART";
    public static final String SELECTION_MARKER = "evc.done";
    public static final String FATAL_LOG = "FATAL_ERROR.txt";
    public static final String REPORT = "REPORT_PLQY.txt";
    public static final String OVERLAP_ERROR_LOG = "momap.err";
    public static final String OVERLAP_INTERNAL_FILE = "evc.dint.dat";
    public static final String OVERLAP_CARTESIAN_FILE = "evc.cart.dat";
    public static final String OVERLAP_NAC_FILE = "evc.cart.nac";

    public Path stageDir(Stage stage) {
        return unitDir.resolve(stage.dirName());
    }

    public Path completionMarker(Stage stage) {
        return stageDir(stage).resolve(COMPLETION_MARKER);
    }

    public Path submissionRecord(Stage stage) {
        return stageDir(stage).resolve(SUBMISSION_RECORD);
    }

    /**
     * Geometry retries are recorded in the optimisation directory of that state.
     */
    public Path geometryRetryMarker(Geometry geometry) {
        return stageDir(optimizationStage(geometry)).resolve(GEOMETRY_RETRY_MARKER);
    }

    public Path coordinateRetryMarker(Stage stage) {
        return stageDir(stage).resolve(COORDINATE_RETRY_MARKER);
    }

    public Path selectionMarker(Stage stage) {
        return stageDir(stage).resolve(SELECTION_MARKER);
    }

    public Path overlapErrorLog(Stage stage) {
        return stageDir(stage).resolve(OVERLAP_ERROR_LOG);
    }

    public Path fatalLog() {
        return unitDir.resolve(FATAL_LOG);
    }

    public Path report() {
        return unitDir.resolve(REPORT);
    }

    public Path jobFile(Stage stage, String extension) {
        return stageDir(stage).resolve(stage.jobName(unitId) + extension);
    }

    public Path gaussianLog(Stage stage) {
        return jobFile(stage, ".log");
    }

    public Path checkpoint(Stage stage) {
        return jobFile(stage, ".chk");
    }

    public Path orcaOutput() {
        return jobFile(Stage.SOC, ".out");
    }

    public Path rateLog(Stage stage) {
        return stageDir(stage).resolve(switch (stage) {
            case KR -> "spec.tvcf.log";
            case KISC -> "isc.tvcf.log";
            case KIC -> "ic.tvcf.log";
            default -> throw new IllegalArgumentException("No rate log for " + stage);
        });
    }

    public Path spectrumFile() {
        return stageDir(Stage.KR).resolve("spec.tvcf.spec.dat");
    }

    public static Stage optimizationStage(Geometry geometry) {
        return switch (geometry) {
            case S0 -> Stage.S0_OPT;
            case S1 -> Stage.S1_OPT;
            case T1 -> Stage.T1_OPT;
        };
    }

    public static Stage frequencyStage(Geometry geometry) {
        return switch (geometry) {
            case S0 -> Stage.S0_FREQ;
            case S1 -> Stage.S1_FREQ;
            case T1 -> Stage.T1_FREQ;
        };
    }
}

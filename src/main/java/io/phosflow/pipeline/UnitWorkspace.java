package io.phosflow.pipeline;

import io.phosflow.model.Geometry;
import io.phosflow.model.Stage;
import io.phosflow.model.UnitLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * File mutations the engine performs on a unit tree: retry markers, discarding rejected
 * artifacts and recording the overlap selection.
 */
public final class UnitWorkspace {
    private static final Logger log = LoggerFactory.getLogger(UnitWorkspace.class);

    private final UnitLayout layout;

    public UnitWorkspace(UnitLayout layout) {
        this.layout = layout;
    }

    public UnitLayout layout() {
        return layout;
    }

    /**
     * Marks the geometry retry as used and clears both the optimisation and frequency directories
     * so the optimisation can run again from scratch.
     */
    public void discardGeometry(Geometry geometry) {
        touch(layout.geometryRetryMarker(geometry));
        for (Stage stage : List.of(UnitLayout.optimizationStage(geometry), UnitLayout.frequencyStage(geometry))) {
            Path dir = layout.stageDir(stage);
            backupLogs(dir);
            deleteMatching(dir, "*.chk");
            deleteIfExists(layout.completionMarker(stage));
            deleteIfExists(layout.submissionRecord(stage));
        }
        log.info("{}: discarded {} geometry artifacts for strict re-optimisation", layout.unitId(), geometry);
    }

    public void discardOverlapAttempt(Stage stage) {
        touch(layout.coordinateRetryMarker(stage));
        Path errorLog = layout.overlapErrorLog(stage);
        if (Files.exists(errorLog)) {
            move(errorLog, errorLog.resolveSibling(errorLog.getFileName() + ".bak"));
        }
        deleteIfExists(layout.completionMarker(stage));
        deleteIfExists(layout.submissionRecord(stage));
        log.info("{}: retrying {} overlap with Cartesian coordinates", layout.unitId(), stage.dirName());
    }

    /**
     * Hands the stage directory over to the rate phase. Markers of the overlap job are cleared
     * before the selection is written so a crash in between leads to a rerun, never to a
     * completion marker attributed to the wrong phase.
     */
    public void recordSelection(Stage stage, String selectedFile) {
        deleteIfExists(layout.completionMarker(stage));
        deleteIfExists(layout.submissionRecord(stage));
        Path marker = layout.selectionMarker(stage);
        try {
            Files.createDirectories(marker.getParent());
            Files.writeString(marker, selectedFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write selection marker: " + marker, e);
        }
    }

    private void backupLogs(Path dir) {
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (DirectoryStream<Path> logs = Files.newDirectoryStream(dir, "*.log")) {
            for (Path logFile : logs) {
                move(logFile, logFile.resolveSibling(logFile.getFileName() + ".bak"));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to back up logs in: " + dir, e);
        }
    }

    private static void deleteMatching(Path dir, String glob) {
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (DirectoryStream<Path> matches = Files.newDirectoryStream(dir, glob)) {
            for (Path file : matches) {
                Files.deleteIfExists(file);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete " + glob + " in: " + dir, e);
        }
    }

    private static void deleteIfExists(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete: " + file, e);
        }
    }

    private static void touch(Path file) {
        try {
            Files.createDirectories(file.getParent());
            if (!Files.exists(file)) {
                Files.createFile(file);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to create marker: " + file, e);
        }
    }

    private static void move(Path from, Path to) {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RuntimeException("Failed to move " + from + " to " + to, e);
        }
    }
}

package io.phosflow.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * On-disk layout of one PhosFlow deployment, resolved from a single root directory.
 */
public final class PhosFlowConfig {
    public static final String DEFAULT_ROOT = ".";
    public static final String SETTINGS_FILE = "phosflow-settings.json";

    private final Path rootDir;
    private final Path sourceDir;
    private final Path resultsDir;
    private final Path statusFile;

    public PhosFlowConfig(Path rootDir, Path sourceDir, Path resultsDir, Path statusFile) {
        this.rootDir = rootDir;
        this.sourceDir = sourceDir;
        this.resultsDir = resultsDir;
        this.statusFile = statusFile;
    }

    public static PhosFlowConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        return new PhosFlowConfig(
                base,
                base.resolve("molecules"),
                base.resolve("results"),
                base.resolve("status_report.csv")
        );
    }

    public PhosFlowConfig withSourceDir(String dir) {
        if (dir == null || dir.isBlank()) {
            return this;
        }
        return new PhosFlowConfig(rootDir, rootDir.resolve(dir).normalize(), resultsDir, statusFile);
    }

    public PhosFlowConfig withResultsDir(String dir) {
        if (dir == null || dir.isBlank()) {
            return this;
        }
        return new PhosFlowConfig(rootDir, sourceDir, rootDir.resolve(dir).normalize(), statusFile);
    }

    public PhosFlowConfig withStatusFile(String file) {
        if (file == null || file.isBlank()) {
            return this;
        }
        return new PhosFlowConfig(rootDir, sourceDir, resultsDir, rootDir.resolve(file).normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path sourceDir() {
        return sourceDir;
    }

    public Path resultsDir() {
        return resultsDir;
    }

    public Path statusFile() {
        return statusFile;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path dbFile() {
        return resultsDir.resolve("phosflow.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path sourceFile(String unitId) {
        return sourceDir.resolve(unitId + ".xyz");
    }

    public Path unitDir(String unitId) {
        return resultsDir.resolve(unitId);
    }
}

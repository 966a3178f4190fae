package io.phosflow.config;

import io.phosflow.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable tunables for one controller process.
 *
 * <p>Resolution order is defaults, then {@code phosflow-settings.json}, then {@code PHOSFLOW_*}
 * environment variables, then command-line overrides. Every numeric value is clamped to a floor
 * so a malformed file cannot produce a zero poll interval or a negative concurrency cap.
 */
public record PipelineSettings(
        int maxConcurrent,
        long pollIntervalMs,
        long stallTimeoutMs,
        boolean autoExit,
        int idleCycleThreshold,
        boolean alertEnabled,
        String webhookUrl,
        long webhookTimeoutMs,
        int maxErrorStrikes,
        long retryTimeBudgetMs,
        double reorganizationThreshold,
        double temperatureK,
        int nproc,
        String partition,
        String memory,
        int orcaMaxcoreMb,
        String methodRoute,
        String submitCommand,
        long submitTimeoutMs,
        String gaussianModule,
        String orcaHome,
        String mpiHome,
        String momapEnv,
        String scratchRoot
) {
    public static final int DEFAULT_MAX_CONCURRENT = 10;
    public static final long DEFAULT_POLL_INTERVAL_MS = 300_000L;
    public static final long DEFAULT_STALL_TIMEOUT_MS = 48L * 60L * 60L * 1000L;
    public static final int DEFAULT_IDLE_CYCLE_THRESHOLD = 3;
    public static final int DEFAULT_MAX_ERROR_STRIKES = 3;
    public static final long DEFAULT_RETRY_TIME_BUDGET_MS = 8L * 60L * 60L * 1000L;
    public static final double DEFAULT_REORGANIZATION_THRESHOLD = 5000.0;
    public static final double DEFAULT_TEMPERATURE_K = 300.0;
    public static final String DEFAULT_METHOD_ROUTE = "TPSSh/def2svp scrf=solvent=CH2Cl2 empiricaldispersion=gd3bj "
            + "IOp(3/174=1000000,3/175=2238200,3/177=452900,3/178=4655000) nosymm";

    public static PipelineSettings defaults() {
        return new PipelineSettings(
                DEFAULT_MAX_CONCURRENT,
                DEFAULT_POLL_INTERVAL_MS,
                DEFAULT_STALL_TIMEOUT_MS,
                false,
                DEFAULT_IDLE_CYCLE_THRESHOLD,
                true,
                "",
                10_000L,
                DEFAULT_MAX_ERROR_STRIKES,
                DEFAULT_RETRY_TIME_BUDGET_MS,
                DEFAULT_REORGANIZATION_THRESHOLD,
                DEFAULT_TEMPERATURE_K,
                56,
                "planck-cpu01",
                "256GB",
                8_000,
                DEFAULT_METHOD_ROUTE,
                "sbatch",
                60_000L,
                "gaussian/16B",
                "/opt/orca",
                "/opt/openmpi",
                "/opt/momap/env.sh",
                "/tmp"
        );
    }

    public static PipelineSettings load(PhosFlowConfig config, Map<String, String> env) {
        PipelineSettings defaults = defaults();
        Path file = config.settingsFile();
        PipelineSettings fromFile = defaults;
        if (Files.exists(file)) {
            try {
                SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
                fromFile = fromFile(parsed, defaults);
            } catch (IOException e) {
                throw new RuntimeException("Failed to load settings: " + file, e);
            }
        }
        return fromFile.withEnvironment(env);
    }

    public static PipelineSettings fromFile(SettingsFile file, PipelineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new PipelineSettings(
                sanitizeInt(file.maxConcurrent(), defaults.maxConcurrent(), 1),
                sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 1_000L),
                sanitizeLong(file.stallTimeoutMs(), defaults.stallTimeoutMs(), 60_000L),
                sanitizeBoolean(file.autoExit(), defaults.autoExit()),
                sanitizeInt(file.idleCycleThreshold(), defaults.idleCycleThreshold(), 1),
                sanitizeBoolean(file.alertEnabled(), defaults.alertEnabled()),
                sanitizeString(file.webhookUrl(), defaults.webhookUrl()),
                sanitizeLong(file.webhookTimeoutMs(), defaults.webhookTimeoutMs(), 1_000L),
                sanitizeInt(file.maxErrorStrikes(), defaults.maxErrorStrikes(), 1),
                sanitizeLong(file.retryTimeBudgetMs(), defaults.retryTimeBudgetMs(), 0L),
                sanitizeDouble(file.reorganizationThreshold(), defaults.reorganizationThreshold(), 0.0),
                sanitizeDouble(file.temperatureK(), defaults.temperatureK(), 1.0),
                sanitizeInt(file.nproc(), defaults.nproc(), 1),
                sanitizeString(file.partition(), defaults.partition()),
                sanitizeString(file.memory(), defaults.memory()),
                sanitizeInt(file.orcaMaxcoreMb(), defaults.orcaMaxcoreMb(), 256),
                sanitizeString(file.methodRoute(), defaults.methodRoute()),
                sanitizeString(file.submitCommand(), defaults.submitCommand()),
                sanitizeLong(file.submitTimeoutMs(), defaults.submitTimeoutMs(), 1_000L),
                sanitizeString(file.gaussianModule(), defaults.gaussianModule()),
                sanitizeString(file.orcaHome(), defaults.orcaHome()),
                sanitizeString(file.mpiHome(), defaults.mpiHome()),
                sanitizeString(file.momapEnv(), defaults.momapEnv()),
                sanitizeString(file.scratchRoot(), defaults.scratchRoot())
        );
    }

    /**
     * Applies {@code PHOSFLOW_MAX_CONCURRENT}, {@code PHOSFLOW_POLL_INTERVAL_S},
     * {@code PHOSFLOW_STALL_TIMEOUT_H}, {@code PHOSFLOW_AUTO_EXIT}, {@code PHOSFLOW_IDLE_CYCLES},
     * {@code PHOSFLOW_ALERT_ENABLED} and {@code PHOSFLOW_WEBHOOK_URL}.
     */
    public PipelineSettings withEnvironment(Map<String, String> env) {
        if (env == null || env.isEmpty()) {
            return this;
        }
        SettingsFile overrides = new SettingsFile(
                parseInt(env.get("PHOSFLOW_MAX_CONCURRENT")),
                secondsToMs(parseLong(env.get("PHOSFLOW_POLL_INTERVAL_S"))),
                hoursToMs(parseLong(env.get("PHOSFLOW_STALL_TIMEOUT_H"))),
                parseBoolean(env.get("PHOSFLOW_AUTO_EXIT")),
                parseInt(env.get("PHOSFLOW_IDLE_CYCLES")),
                parseBoolean(env.get("PHOSFLOW_ALERT_ENABLED")),
                env.get("PHOSFLOW_WEBHOOK_URL"),
                null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null
        );
        return fromFile(overrides, this);
    }

    public PipelineSettings withRunOverrides(Integer maxConcurrent, Long pollIntervalSeconds, Boolean autoExit, Integer idleCycles) {
        SettingsFile overrides = new SettingsFile(
                maxConcurrent,
                secondsToMs(pollIntervalSeconds),
                null,
                autoExit,
                idleCycles,
                null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null
        );
        return fromFile(overrides, this);
    }

    public SettingsFile toFile() {
        return new SettingsFile(
                maxConcurrent, pollIntervalMs, stallTimeoutMs, autoExit, idleCycleThreshold,
                alertEnabled, webhookUrl, webhookTimeoutMs, maxErrorStrikes, retryTimeBudgetMs,
                reorganizationThreshold, temperatureK, nproc, partition, memory, orcaMaxcoreMb,
                methodRoute, submitCommand, submitTimeoutMs, gaussianModule, orcaHome, mpiHome,
                momapEnv, scratchRoot
        );
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static double sanitizeDouble(Double value, double fallback, double min) {
        if (value == null || value.isNaN()) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static boolean sanitizeBoolean(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    private static String sanitizeString(String value, String fallback) {
        if (value == null) {
            return fallback;
        }
        return value.trim();
    }

    private static Integer parseInt(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: " + raw, e);
        }
    }

    private static Long parseLong(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: " + raw, e);
        }
    }

    private static Boolean parseBoolean(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        return v.equals("1") || v.equals("true") || v.equals("yes") || v.equals("on");
    }

    private static Long secondsToMs(Long seconds) {
        return seconds == null ? null : seconds * 1000L;
    }

    private static Long hoursToMs(Long hours) {
        return hours == null ? null : hours * 60L * 60L * 1000L;
    }

    public record SettingsFile(
            Integer maxConcurrent,
            Long pollIntervalMs,
            Long stallTimeoutMs,
            Boolean autoExit,
            Integer idleCycleThreshold,
            Boolean alertEnabled,
            String webhookUrl,
            Long webhookTimeoutMs,
            Integer maxErrorStrikes,
            Long retryTimeBudgetMs,
            Double reorganizationThreshold,
            Double temperatureK,
            Integer nproc,
            String partition,
            String memory,
            Integer orcaMaxcoreMb,
            String methodRoute,
            String submitCommand,
            Long submitTimeoutMs,
            String gaussianModule,
            String orcaHome,
            String mpiHome,
            String momapEnv,
            String scratchRoot
    ) {
    }
}

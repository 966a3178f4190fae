package io.phosflow.probe;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extraction from MOMAP overlap (EVC) and rate (TVCF) outputs.
 */
public final class MomapLogs {
    private static final Pattern REORGANIZATION = Pattern.compile(
            "Total reorganization energy.*:\\s+([\\d.]+)\\s+([\\d.]+)");
    private static final Pattern RADIATIVE_RATE = Pattern.compile(
            "radiative rate\\s+\\(\\d+\\):.*?([\\d.E+\\-]+)\\s+/s");
    private static final Pattern ISC_RATE = Pattern.compile(
            "Intersystem crossing Ead is.*?rate is\\s+([\\d.E+\\-]+)\\s+s-1");
    private static final Pattern COORDINATE_ERROR = Pattern.compile(
            "(?i)internal\\s+coordinate");
    private static final Pattern CRASH = Pattern.compile(
            "Traceback \\(most recent call last\\)|Segmentation fault|forrtl: severe|Killed|Error termination");

    private MomapLogs() {
    }

    /**
     * Pair of reorganization energies (cm^-1) for the two states, if the file reports them.
     */
    public static Optional<double[]> reorganizationEnergies(String evcDat) {
        Matcher m = REORGANIZATION.matcher(evcDat);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new double[]{Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2))});
    }

    public static FailureSignature errorSignature(String errLog) {
        if (errLog == null || errLog.isBlank()) {
            return FailureSignature.NONE;
        }
        if (COORDINATE_ERROR.matcher(errLog).find()) {
            return FailureSignature.COORDINATE;
        }
        if (CRASH.matcher(errLog).find()) {
            return FailureSignature.CRASH;
        }
        return FailureSignature.NONE;
    }

    public static double radiativeRate(String log) {
        Matcher m = RADIATIVE_RATE.matcher(log);
        return m.find() ? Double.parseDouble(m.group(1)) : 0.0;
    }

    public static double intersystemCrossingRate(String log) {
        Matcher m = ISC_RATE.matcher(log);
        return m.find() ? Double.parseDouble(m.group(1)) : 0.0;
    }

    /**
     * Sixth column of the first numeric row after the {@code 1Energy ... 6kic} table header.
     */
    public static double internalConversionRate(String log) {
        boolean inTable = false;
        for (String raw : log.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.contains("1Energy") && line.contains("6kic")) {
                inTable = true;
                continue;
            }
            if (!inTable || line.startsWith("#") || line.startsWith("-")) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts.length < 6) {
                continue;
            }
            try {
                Double.parseDouble(parts[0]);
                return Double.parseDouble(parts[5]);
            } catch (NumberFormatException ignored) {
                continue;
            }
        }
        return 0.0;
    }
}

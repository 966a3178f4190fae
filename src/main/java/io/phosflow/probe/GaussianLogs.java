package io.phosflow.probe;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text extraction from Gaussian 16 output logs.
 */
public final class GaussianLogs {
    private static final Pattern ELAPSED = Pattern.compile(
            "Elapsed time:\\s+(\\d+)\\s+days\\s+(\\d+)\\s+hours\\s+(\\d+)\\s+minutes\\s+([\\d.]+)\\s+seconds");
    private static final String FREQUENCIES = "Frequencies --";

    private GaussianLogs() {
    }

    /**
     * Every link must finish: at least one normal-termination line and no error-termination line.
     */
    public static boolean terminatedNormally(String log) {
        return log.contains("Normal termination of Gaussian") && !log.contains("Error termination");
    }

    public static List<Double> imaginaryFrequencies(String log) {
        List<Double> out = new ArrayList<>();
        for (String line : log.split("\\R")) {
            int idx = line.indexOf(FREQUENCIES);
            if (idx < 0) {
                continue;
            }
            for (String token : line.substring(idx + FREQUENCIES.length()).trim().split("\\s+")) {
                try {
                    double value = Double.parseDouble(token);
                    if (value < 0.0) {
                        out.add(value);
                    }
                } catch (NumberFormatException ignored) {
                    // Column overflow prints asterisks; those are never imaginary modes.
                }
            }
        }
        return out;
    }

    /**
     * Total wall time over all links, in hours. Zero when the log has no timing lines.
     */
    public static double elapsedHours(String log) {
        Matcher m = ELAPSED.matcher(log);
        double seconds = 0.0;
        while (m.find()) {
            seconds += Long.parseLong(m.group(1)) * 86_400.0
                    + Long.parseLong(m.group(2)) * 3_600.0
                    + Long.parseLong(m.group(3)) * 60.0
                    + Double.parseDouble(m.group(4));
        }
        return seconds / 3_600.0;
    }

    /**
     * Final electronic energy in Hartree. A {@code Total Energy} line (TD-DFT excited state)
     * wins over the last {@code SCF Done} value.
     */
    public static double finalEnergy(String log) {
        double scf = 0.0;
        double total = 0.0;
        for (String line : log.split("\\R")) {
            if (line.contains("SCF Done")) {
                String[] parts = line.trim().split("\\s+");
                if (parts.length > 4) {
                    scf = parseOr(parts[4], scf);
                }
            }
            if (line.contains("Total Energy")) {
                String[] parts = line.trim().split("\\s+");
                total = parseOr(parts[parts.length - 1], total);
            }
        }
        return total != 0.0 ? total : scf;
    }

    /**
     * Last printed orientation block, standard or input.
     */
    public static Optional<List<Atom>> lastGeometry(String log) {
        String[] lines = log.split("\\R");
        int header = -1;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].contains("Standard orientation:") || lines[i].contains("Input orientation:")) {
                header = i;
            }
        }
        if (header < 0) {
            return Optional.empty();
        }
        List<Atom> atoms = new ArrayList<>();
        int dashes = 0;
        for (int i = header + 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.startsWith("-----")) {
                dashes++;
                if (dashes == 3) {
                    break;
                }
                continue;
            }
            if (dashes < 2) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts.length < 6) {
                continue;
            }
            atoms.add(new Atom(
                    Elements.symbol(Integer.parseInt(parts[1])),
                    Double.parseDouble(parts[3]),
                    Double.parseDouble(parts[4]),
                    Double.parseDouble(parts[5])
            ));
        }
        return atoms.isEmpty() ? Optional.empty() : Optional.of(atoms);
    }

    private static double parseOr(String raw, double fallback) {
        try {
            return Double.parseDouble(raw.replace('D', 'E'));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}

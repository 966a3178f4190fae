package io.phosflow.probe;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extraction of transition dipoles and spin-orbit couplings from ORCA TD-DFT output.
 */
public final class OrcaLogs {
    public static final double DEFAULT_EDME_DEBYE = 1.0;
    private static final double AU_TO_DEBYE = 2.5417;
    private static final String ABSORPTION_HEADER =
            "SOC CORRECTED ABSORPTION SPECTRUM VIA TRANSITION ELECTRIC DIPOLE MOMENTS";
    private static final String SOCME_HEADER = "CALCULATED SOCME BETWEEN TRIPLETS AND SINGLETS";
    private static final String COMPLEX = "\\(\\s*([-\\d.]+)\\s*,\\s*([-\\d.]+)\\s*\\)";
    private static final Pattern T1_S0_ROW = Pattern.compile(
            "^\\s*1\\s+0\\s+" + COMPLEX + "\\s+" + COMPLEX + "\\s+" + COMPLEX, Pattern.MULTILINE);

    private OrcaLogs() {
    }

    public static boolean terminatedNormally(String out) {
        return out.contains("ORCA TERMINATED NORMALLY");
    }

    /**
     * Emission transition dipole in Debye: RMS of the squared dipoles (D2) of the first three
     * spin-orbit sublevels of T1. Falls back to {@value #DEFAULT_EDME_DEBYE} when the table is absent.
     */
    public static double emissionDipole(String out) {
        String[] blocks = out.split(Pattern.quote(ABSORPTION_HEADER));
        String target = null;
        for (int i = blocks.length - 1; i >= 1; i--) {
            if (blocks[i].contains("0-1.0A") && blocks[i].contains("D2")) {
                target = blocks[i];
                break;
            }
        }
        if (target == null) {
            return DEFAULT_EDME_DEBYE;
        }
        List<Double> d2 = new ArrayList<>();
        for (String line : target.split("\\R")) {
            if (!line.contains("->") || !line.contains("0-1.0A")) {
                continue;
            }
            String[] parts = line.trim().split("\\s+");
            if (parts.length <= 7) {
                continue;
            }
            try {
                d2.add(Double.parseDouble(parts[7]));
            } catch (NumberFormatException ignored) {
                continue;
            }
            if (d2.size() == 3) {
                break;
            }
        }
        if (d2.isEmpty()) {
            return DEFAULT_EDME_DEBYE;
        }
        double mean = d2.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return Math.sqrt(mean) * AU_TO_DEBYE;
    }

    /**
     * T1-S0 spin-orbit coupling in cm^-1: RMS over the Z, X and Y complex components.
     * Zero when no component table is printed.
     */
    public static double spinOrbitCoupling(String out) {
        String[] blocks = out.split(Pattern.quote(SOCME_HEADER));
        for (int i = 1; i < blocks.length; i++) {
            String[] lines = blocks[i].split("\\R", 11);
            StringBuilder head = new StringBuilder();
            for (int j = 0; j < Math.min(10, lines.length); j++) {
                head.append(lines[j]);
            }
            String h = head.toString();
            if (!(h.contains("X") && h.contains("Y") && h.contains("Z"))) {
                continue;
            }
            Matcher m = T1_S0_ROW.matcher(blocks[i]);
            if (!m.find()) {
                return 0.0;
            }
            double sumSquares = 0.0;
            for (int g = 1; g <= 6; g++) {
                double v = Double.parseDouble(m.group(g));
                sumSquares += v * v;
            }
            return Math.sqrt(sumSquares / 3.0);
        }
        return 0.0;
    }
}

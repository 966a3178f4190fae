package io.phosflow.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Emission peak and full width at half maximum from a MOMAP {@code spec.tvcf.spec.dat} table.
 *
 * <p>The first two lines are headers. Columns used: 3 (wavelength, nm) and 5 (emission).
 */
public final class SpectrumAnalysis {
    private static final Logger log = LoggerFactory.getLogger(SpectrumAnalysis.class);
    private static final int HEADER_LINES = 2;
    private static final int WAVELENGTH_COLUMN = 3;
    private static final int EMISSION_COLUMN = 5;

    private SpectrumAnalysis() {
    }

    public static SpectrumPeak analyze(Path specFile) {
        if (!Files.exists(specFile)) {
            log.warn("Spectrum file not found: {}", specFile);
            return SpectrumPeak.none();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(specFile, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read spectrum: " + specFile, e);
        }
        return analyze(lines);
    }

    static SpectrumPeak analyze(List<String> lines) {
        List<double[]> rows = new ArrayList<>();
        for (int i = HEADER_LINES; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts.length <= EMISSION_COLUMN) {
                continue;
            }
            try {
                rows.add(new double[]{
                        Double.parseDouble(parts[WAVELENGTH_COLUMN]),
                        Double.parseDouble(parts[EMISSION_COLUMN])
                });
            } catch (NumberFormatException e) {
                log.debug("Skipping spectrum row {}: {}", i + 1, line);
            }
        }
        if (rows.isEmpty()) {
            return SpectrumPeak.none();
        }
        int peak = 0;
        for (int i = 1; i < rows.size(); i++) {
            if (rows.get(i)[1] > rows.get(peak)[1]) {
                peak = i;
            }
        }
        double max = rows.get(peak)[1];
        if (max <= 0.0) {
            return SpectrumPeak.none();
        }
        double half = max / 2.0;
        int first = -1;
        int last = -1;
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i)[1] > half) {
                if (first < 0) {
                    first = i;
                }
                last = i;
            }
        }
        double fwhm = Math.abs(rows.get(first)[0] - rows.get(last)[0]);
        return new SpectrumPeak(rows.get(peak)[0], fwhm);
    }
}

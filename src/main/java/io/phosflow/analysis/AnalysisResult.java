package io.phosflow.analysis;

import java.util.Locale;

/**
 * Everything written to the final report of one unit.
 */
public record AnalysisResult(
        String unitId,
        double energyS1,
        double energyT1,
        double kr,
        double kisc,
        double kic,
        double temperatureK,
        double boltzmannRatio,
        double quantumYield,
        SpectrumPeak spectrum
) {
    public double gapHartree() {
        return energyS1 - energyT1;
    }

    public String render() {
        double gap = gapHartree();
        StringBuilder sb = new StringBuilder();
        sb.append("==================================================\n");
        sb.append("Analysis Report for ").append(unitId).append('\n');
        sb.append("==================================================\n");
        sb.append("1. Energies (Hartree)\n");
        sb.append(format("   E(S1): %.6f\n", energyS1));
        sb.append(format("   E(T1): %.6f\n", energyT1));
        sb.append(format("   dE(S1-T1): %.6f Ha (%.3f eV)\n", gap, gap * YieldCalculator.HARTREE_TO_EV));
        sb.append(format("   Boltzmann Ratio n(S1)/n(T1): %.4e (at %s K)\n", boltzmannRatio, temperatureLabel()));
        sb.append('\n');
        sb.append("2. Rates (s^-1)\n");
        sb.append(format("   Kr   (Rad): %.4e\n", kr));
        sb.append(format("   Kisc (ISC): %.4e\n", kisc));
        sb.append(format("   Kic  (IC) : %.4e\n", kic));
        sb.append('\n');
        sb.append("3. PLQY Calculation\n");
        sb.append("   Formula: Kr / (Kr + Kisc + Kic * Ratio)\n");
        sb.append(format("   PLQY: %.2f%% (%.4f)\n", quantumYield * 100.0, quantumYield));
        sb.append('\n');
        sb.append("4. Spectrum Properties\n");
        sb.append(format("   Peak Wavelength: %.1f nm\n", spectrum.peakWavelengthNm()));
        sb.append(format("   FWHM: %.1f nm\n", spectrum.fwhmNm()));
        sb.append("==================================================");
        return sb.toString();
    }

    private String temperatureLabel() {
        if (temperatureK == Math.rint(temperatureK)) {
            return Long.toString((long) temperatureK);
        }
        return Double.toString(temperatureK);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}

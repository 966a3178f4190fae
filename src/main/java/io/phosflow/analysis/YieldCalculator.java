package io.phosflow.analysis;

/**
 * Phosphorescence quantum yield from the three rates and the S1/T1 gap.
 *
 * <p>{@code PLQY = Kr / (Kr + Kisc + Kic * exp(-(E(S1) - E(T1)) / (kB * T)))}.
 */
public final class YieldCalculator {
    public static final double KB_HARTREE_PER_K = 3.1668114e-6;
    public static final double HARTREE_TO_EV = 27.2114;

    private YieldCalculator() {
    }

    /**
     * Boltzmann population ratio n(S1)/n(T1). Underflows to 0 for large gaps.
     */
    public static double boltzmannRatio(double deltaHartree, double temperatureK) {
        double ratio = Math.exp(-deltaHartree / (KB_HARTREE_PER_K * temperatureK));
        return Double.isInfinite(ratio) ? 0.0 : ratio;
    }

    public static double quantumYield(double kr, double kisc, double kic, double ratio) {
        double total = kr + kisc + kic * ratio;
        if (total == 0.0) {
            return 0.0;
        }
        return kr / total;
    }
}

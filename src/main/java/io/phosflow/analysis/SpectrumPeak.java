package io.phosflow.analysis;

public record SpectrumPeak(double peakWavelengthNm, double fwhmNm) {
    public static SpectrumPeak none() {
        return new SpectrumPeak(0.0, 0.0);
    }
}

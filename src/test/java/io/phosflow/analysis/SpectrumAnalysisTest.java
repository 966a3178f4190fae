package io.phosflow.analysis;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

final class SpectrumAnalysisTest {

    @Test
    void findsPeakAndHalfMaximumWidth() {
        SpectrumPeak peak = SpectrumAnalysis.analyze(List.of(
                "# Energy(au) Energy(eV) Energy(cm-1) wavelength(nm) absorption emission",
                "# ----",
                "0.090 2.449 19752 506.3 0.0 0.10",
                "0.089 2.422 19533 512.0 0.0 0.60",
                "0.088 2.395 19314 517.8 0.0 1.00",
                "0.087 2.367 19095 523.7 0.0 0.70",
                "0.086 2.340 18875 529.8 0.0 0.20",
                "not numeric row at all here",
                ""
        ));
        Assertions.assertEquals(517.8, peak.peakWavelengthNm(), 1e-9);
        Assertions.assertEquals(523.7 - 512.0, peak.fwhmNm(), 1e-9);
    }

    @Test
    void emptyOrFlatSpectrumHasNoPeak() {
        Assertions.assertEquals(SpectrumPeak.none(), SpectrumAnalysis.analyze(List.of("h1", "h2")));
        Assertions.assertEquals(SpectrumPeak.none(), SpectrumAnalysis.analyze(List.of(
                "h1", "h2", "0.09 2.4 19752 506.3 0.0 0.0")));
        Assertions.assertEquals(SpectrumPeak.none(), SpectrumAnalysis.analyze(Path.of("does-not-exist.dat")));
    }
}

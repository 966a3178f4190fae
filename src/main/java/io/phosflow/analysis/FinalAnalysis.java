package io.phosflow.analysis;

import io.phosflow.model.Stage;
import io.phosflow.model.UnitLayout;
import io.phosflow.probe.GaussianLogs;
import io.phosflow.probe.MomapLogs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class FinalAnalysis implements ReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(FinalAnalysis.class);

    private final double temperatureK;

    public FinalAnalysis(double temperatureK) {
        this.temperatureK = temperatureK;
    }

    public AnalysisResult analyze(UnitLayout layout) {
        double kr = MomapLogs.radiativeRate(readOrEmpty(layout.rateLog(Stage.KR)));
        double kisc = MomapLogs.intersystemCrossingRate(readOrEmpty(layout.rateLog(Stage.KISC)));
        double kic = MomapLogs.internalConversionRate(readOrEmpty(layout.rateLog(Stage.KIC)));
        double energyS1 = GaussianLogs.finalEnergy(readOrEmpty(layout.gaussianLog(Stage.S1_FREQ)));
        double energyT1 = GaussianLogs.finalEnergy(readOrEmpty(layout.gaussianLog(Stage.T1_FREQ)));
        double gap = energyS1 - energyT1;
        if (gap < 0) {
            log.warn("{}: E(S1) is below E(T1) by {} Ha", layout.unitId(), -gap);
        }
        double ratio = YieldCalculator.boltzmannRatio(gap, temperatureK);
        double plqy = YieldCalculator.quantumYield(kr, kisc, kic, ratio);
        SpectrumPeak spectrum = SpectrumAnalysis.analyze(layout.spectrumFile());
        log.info("{}: Kr={} Kisc={} Kic={} PLQY={}", layout.unitId(), kr, kisc, kic, plqy);
        return new AnalysisResult(layout.unitId(), energyS1, energyT1, kr, kisc, kic, temperatureK, ratio, plqy, spectrum);
    }

    /**
     * Writes {@code REPORT_PLQY.txt} unless it already exists.
     */
    @Override
    public void writeReport(UnitLayout layout) {
        Path report = layout.report();
        if (Files.exists(report)) {
            return;
        }
        AnalysisResult result = analyze(layout);
        Path tmp = report.resolveSibling(report.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, result.render(), StandardCharsets.UTF_8);
            Files.move(tmp, report, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write report: " + report, e);
        }
        log.info("{}: report generated at {}", layout.unitId(), report);
    }

    private static String readOrEmpty(Path file) {
        if (!Files.exists(file)) {
            log.warn("Analysis input missing: {}", file);
            return "";
        }
        try {
            return Files.readString(file, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read analysis input: " + file, e);
        }
    }
}

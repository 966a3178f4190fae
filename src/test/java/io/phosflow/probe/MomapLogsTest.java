package io.phosflow.probe;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class MomapLogsTest {

    @Test
    void parsesReorganizationEnergies() {
        String evc = " Total reorganization energy      (cm-1):    1234.5    1300.1\n";
        double[] energies = MomapLogs.reorganizationEnergies(evc).orElseThrow();
        Assertions.assertEquals(1234.5, energies[0], 1e-9);
        Assertions.assertEquals(1300.1, energies[1], 1e-9);
        Assertions.assertTrue(MomapLogs.reorganizationEnergies("nothing").isEmpty());
    }

    @Test
    void classifiesErrorLogs() {
        Assertions.assertEquals(FailureSignature.COORDINATE,
                MomapLogs.errorSignature("Error: failed to build Internal Coordinate system\n"));
        Assertions.assertEquals(FailureSignature.CRASH,
                MomapLogs.errorSignature("forrtl: severe (174): SIGSEGV, segmentation fault occurred\n"));
        Assertions.assertEquals(FailureSignature.NONE, MomapLogs.errorSignature("  \n"));
        Assertions.assertEquals(FailureSignature.NONE, MomapLogs.errorSignature(null));
    }

    @Test
    void extractsRates() {
        String spec = " radiative rate     (0):     1.23456789E+05 /s,   8.1E-06 s\n";
        Assertions.assertEquals(1.23456789E+05, MomapLogs.radiativeRate(spec), 1e-3);

        String isc = "#  Intersystem crossing Ead is  0.10 eV, rate is 3.14E+06 s-1\n";
        Assertions.assertEquals(3.14E+06, MomapLogs.intersystemCrossingRate(isc), 1e-3);

        String ic = String.join("\n",
                "#1Energy(Hartree) 2Energy(eV) 3Energy(cm-1) 4Energy(nm) 5tau(fs) 6kic(s-1)",
                "# comment",
                "  0.0966  2.6300  21211.9  471.4  1.0E+00  4.56E+04",
                "  0.1000  2.7200  21940.0  455.8  1.0E+00  9.99E+09");
        Assertions.assertEquals(4.56E+04, MomapLogs.internalConversionRate(ic), 1e-6);
        Assertions.assertEquals(0.0, MomapLogs.internalConversionRate("no table"), 0.0);
        Assertions.assertEquals(0.0, MomapLogs.radiativeRate("no rate"), 0.0);
    }
}

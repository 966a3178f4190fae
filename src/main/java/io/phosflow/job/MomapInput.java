package io.phosflow.job;

import java.util.Locale;

/**
 * {@code momap.inp} for the overlap phase and the three rate calculations.
 */
final class MomapInput {
    static final String FILE_NAME = "momap.inp";

    private MomapInput() {
    }

    static String overlap(String firstLog, String secondLog, boolean cartesian) {
        StringBuilder sb = new StringBuilder();
        sb.append("do_evc = 1\n");
        sb.append("&evc\n");
        sb.append(" ffreq(1) = \"").append(firstLog).append("\"\n");
        sb.append(" ffreq(2) = \"").append(secondLog).append("\"\n");
        if (cartesian) {
            sb.append(" set_cart = .t.\n");
        }
        sb.append("/\n");
        return sb.toString();
    }

    static String radiative(double eadHartree, double edmeDebye, String dsFile, double temperatureK) {
        return String.format(Locale.ROOT, """
                do_spec_tvcf_ft   = 1
                do_spec_tvcf_spec = 1

                &spec_tvcf
                 DUSHIN        = .f.
                 HERZ          = .f.
                 Temp          = %s K
                 tmax          = 3000 fs
                 dt            = 0.01 fs
                 Ead           = %.8f au
                 EDMA          = 1.0 debye
                 EDME          = %.8f debye
                 FreqScale     = 1.0
                 DSFile        = "%s"
                 isgauss       = .f.
                 BroadenType   = "gaussian"
                 Broadenfunc   = "frequency"
                 FWHM          = 20 cm-1
                 GFile         = "spec.tvcf.gauss.dat"
                 NScale        = 10
                 Emin          = -0.3 au
                 Emax          = 0.3 au
                 dE            = 0.00001 au
                 logFile       = "spec.tvcf.log"
                 FoFile        = "spec.tvcf.fo.dat"
                 FtFile        = "spec.tvcf.ft.dat"
                 FoSFile       = "spec.tvcf.spec.dat"
                 spectra0      = .f.
                 IntEmin       = 0.0 au
                 IntEmax       = 0.09 au
                /
                """, trim(temperatureK), eadHartree, edmeDebye, dsFile);
    }

    static String intersystemCrossing(double eadHartree, double hsoCm, String dsFile, double temperatureK) {
        return String.format(Locale.ROOT, """
                do_isc_tvcf_ft   = 1
                do_isc_tvcf_spec = 1

                &isc_tvcf
                 DUSHIN        = .f.
                 HERZ          = .f.
                 Temp          = %s K
                 tmax          = 3000 fs
                 dt            = 0.01 fs
                 Ead           = %.8f au
                 Hso           = %.5f cm-1
                 FreqScale     = 1.0
                 DSFile        = "%s"
                 isgauss       = .f.
                 BroadenType   = "gaussian"
                 Broadenfunc   = "frequency"
                 FWHM          = 50 cm-1
                 GFile         = "spec.tvcf.gauss.dat"
                 NScale        = 10
                 Emin          = -0.3 au
                 Emax          = 0.3 au
                 dE            = 0.00001 au
                 logFile       = "isc.tvcf.log"
                 FoFile        = "isc.tvcf.fo.dat"
                 FtFile        = "isc.tvcf.ft.dat"
                 FoSFile       = "isc.tvcf.spec.dat"
                 spectra0      = .f.
                 IntEmin       = 0.0 au
                 IntEmax       = 0.09 au
                /
                """, trim(temperatureK), eadHartree, hsoCm, dsFile);
    }

    static String internalConversion(double eadHartree, String dsFile, String coulFile, double temperatureK) {
        return String.format(Locale.ROOT, """
                do_ic_tvcf_ft   = 1
                do_ic_tvcf_spec = 1

                &ic_tvcf
                 DUSHIN        = .t.
                 Temp          = %s K
                 tmax          = 3000 fs
                 dt            = 0.01 fs
                 Ead           = %.8f au
                 DSFile        = "%s"
                 CoulFile      = "%s"
                 isgauss       = .t.
                 BroadenType   = "gaussian"
                 Broadenfunc   = "frequency"
                 FWHM          = 500 cm-1
                 GFile         = "spec.tvcf.gauss.dat"
                 NScale        = 20
                 Emax          = 0.3 au
                 logFile       = "ic.tvcf.log"
                 FtFile        = "ic.tvcf.ft.dat"
                 FoFile        = "ic.tvcf.fo.dat"
                /
                """, trim(temperatureK), eadHartree, dsFile, coulFile);
    }

    private static String trim(double value) {
        if (value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}

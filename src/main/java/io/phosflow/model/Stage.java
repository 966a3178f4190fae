package io.phosflow.model;

/**
 * The ten fixed calculation stages, each owning one directory under the unit root.
 */
public enum Stage {
    S0_OPT("01_S0_Opt", "s0_opt"),
    S0_FREQ("02_S0_Freq", "s0_freq"),
    S1_OPT("03_S1_Opt", "s1_opt"),
    S1_FREQ("04_S1_Freq", "s1_freq"),
    T1_OPT("05_T1_Opt", "t1_opt"),
    T1_FREQ("06_T1_Freq", "t1_freq"),
    SOC("07_ORCA_SOC", "orca"),
    KR("08_MOMAP_Kr", "kr"),
    KISC("09_MOMAP_Kisc", "kisc"),
    KIC("10_MOMAP_Kic", "kic");

    private final String dirName;
    private final String key;

    Stage(String dirName, String key) {
        this.dirName = dirName;
        this.key = key;
    }

    public String dirName() {
        return dirName;
    }

    public String key() {
        return key;
    }

    /**
     * Base name of the job files written into the stage directory, e.g. {@code mol7_s0_opt}.
     */
    public String jobName(String unitId) {
        return unitId + "_" + key;
    }
}

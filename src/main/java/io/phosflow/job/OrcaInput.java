package io.phosflow.job;

import io.phosflow.probe.Atom;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

final class OrcaInput {
    static final List<String> HEAVY_METALS = List.of("Pt", "Ir", "Os", "Ru", "Rh", "Re");

    private OrcaInput() {
    }

    /**
     * Spin-orbit TD-DFT from a closed-shell singlet reference at the given geometry.
     * {@code %pal} is inserted by the job script.
     */
    static String render(List<Atom> atoms, int maxcoreMb) {
        Set<String> metals = new LinkedHashSet<>();
        for (Atom atom : atoms) {
            if (HEAVY_METALS.contains(atom.symbol())) {
                metals.add(atom.symbol());
            }
        }
        StringBuilder sb = new StringBuilder();
        sb.append("! TPSSh DKH2 DKH-def2-tzvp RIJCOSX SARC/J CPCM(DCM) miniprint TightSCF defgrid3\n\n");
        sb.append("%maxcore ").append(maxcoreMb).append("\n\n");
        if (!metals.isEmpty()) {
            sb.append("%basis\n");
            for (String metal : metals) {
                sb.append("NewGTO ").append(metal).append(" \"SARC-DKH-TZVP\" end\n");
            }
            sb.append("end\n\n");
        }
        sb.append("""
                %tddft
                nroots      50
                DoSOC       true
                PrintLevel  3
                TDA         false
                triplets    true
                end

                """);
        sb.append("* xyz 0 1\n");
        for (Atom atom : atoms) {
            sb.append(atom.toXyzLine()).append('\n');
        }
        sb.append("*\n");
        return sb.toString();
    }
}

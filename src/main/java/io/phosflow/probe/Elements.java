package io.phosflow.probe;

import java.util.Locale;

final class Elements {
    private static final String[] SYMBOLS = {
            "X",
            "H", "He",
            "Li", "Be", "B", "C", "N", "O", "F", "Ne",
            "Na", "Mg", "Al", "Si", "P", "S", "Cl", "Ar",
            "K", "Ca", "Sc", "Ti", "V", "Cr", "Mn", "Fe", "Co", "Ni", "Cu", "Zn",
            "Ga", "Ge", "As", "Se", "Br", "Kr",
            "Rb", "Sr", "Y", "Zr", "Nb", "Mo", "Tc", "Ru", "Rh", "Pd", "Ag", "Cd",
            "In", "Sn", "Sb", "Te", "I", "Xe",
            "Cs", "Ba", "La", "Ce", "Pr", "Nd", "Pm", "Sm", "Eu", "Gd", "Tb", "Dy", "Ho", "Er", "Tm", "Yb", "Lu",
            "Hf", "Ta", "W", "Re", "Os", "Ir", "Pt", "Au", "Hg",
            "Tl", "Pb", "Bi", "Po", "At", "Rn"
    };

    private Elements() {
    }

    static String symbol(int atomicNumber) {
        if (atomicNumber <= 0 || atomicNumber >= SYMBOLS.length) {
            throw new IllegalArgumentException("Unsupported atomic number: " + atomicNumber);
        }
        return SYMBOLS[atomicNumber];
    }

    /**
     * Normalises {@code PT}, {@code pt} or {@code 78} to {@code Pt}.
     */
    static String normalize(String raw) {
        String trimmed = raw.trim();
        if (!trimmed.isEmpty() && Character.isDigit(trimmed.charAt(0))) {
            return symbol(Integer.parseInt(trimmed));
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (int i = 1; i < SYMBOLS.length; i++) {
            if (SYMBOLS[i].toLowerCase(Locale.ROOT).equals(lower)) {
                return SYMBOLS[i];
            }
        }
        throw new IllegalArgumentException("Unknown element: " + raw);
    }
}

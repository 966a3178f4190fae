package io.phosflow.probe;

import java.util.Locale;

public record Atom(String symbol, double x, double y, double z) {
    public String toXyzLine() {
        return String.format(Locale.ROOT, " %-2s %14.8f %14.8f %14.8f", symbol, x, y, z);
    }
}

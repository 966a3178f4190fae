package io.phosflow.model;

/**
 * Electronic states whose geometry is optimised and checked for imaginary modes.
 */
public enum Geometry {
    S0("s0", 0, 1),
    S1("s1", 0, 1),
    T1("t1", 0, 3);

    private final String label;
    private final int charge;
    private final int multiplicity;

    Geometry(String label, int charge, int multiplicity) {
        this.label = label;
        this.charge = charge;
        this.multiplicity = multiplicity;
    }

    public String label() {
        return label;
    }

    public int charge() {
        return charge;
    }

    public int multiplicity() {
        return multiplicity;
    }
}

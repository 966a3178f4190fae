package io.phosflow.model;

public enum UnitStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    ERROR;

    public boolean active() {
        return this == RUNNING || this == ERROR;
    }

    public static UnitStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        for (UnitStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown unit status: " + raw);
    }
}

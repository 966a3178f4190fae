package io.phosflow.model;

import java.util.Locale;

public enum StageState {
    NOT_STARTED,
    AWAITING_COMPLETION,
    VALIDATION_FAILED,
    READY,
    FATAL;

    public static StageState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NOT_STARTED;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}

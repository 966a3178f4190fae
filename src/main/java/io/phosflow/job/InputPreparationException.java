package io.phosflow.job;

public final class InputPreparationException extends RuntimeException {
    public InputPreparationException(String message) {
        super(message);
    }

    public InputPreparationException(String message, Throwable cause) {
        super(message, cause);
    }
}

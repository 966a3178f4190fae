package io.phosflow.alert;

/**
 * Fire-and-forget notification channel. Implementations must not throw: a failed delivery is
 * logged and dropped.
 */
public interface AlertSink {
    void send(Alert alert);
}

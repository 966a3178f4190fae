package io.phosflow.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when alerts are disabled or no webhook is configured.
 */
public final class LoggingAlertSink implements AlertSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingAlertSink.class);

    @Override
    public void send(Alert alert) {
        log.warn("ALERT {}: {}", alert.title(), alert.body());
    }
}

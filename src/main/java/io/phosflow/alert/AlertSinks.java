package io.phosflow.alert;

import io.phosflow.config.PipelineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

public final class AlertSinks {
    private static final Logger log = LoggerFactory.getLogger(AlertSinks.class);

    private AlertSinks() {
    }

    public static AlertSink fromSettings(PipelineSettings settings, Clock clock) {
        if (!settings.alertEnabled() || settings.webhookUrl() == null || settings.webhookUrl().isBlank()) {
            log.info("Webhook alerts disabled; alerts are logged only");
            return new LoggingAlertSink();
        }
        return new WebhookAlertSink(settings.webhookUrl(), settings.webhookTimeoutMs(), clock);
    }
}

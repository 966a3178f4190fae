package io.phosflow.alert;

import io.phosflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts alerts to a Feishu-style bot webhook as {@code {"msg_type":"text","content":{"text":...}}}.
 */
public final class WebhookAlertSink implements AlertSink {
    private static final Logger log = LoggerFactory.getLogger(WebhookAlertSink.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final URI endpoint;
    private final Duration timeout;
    private final HttpClient client;
    private final Clock clock;

    public WebhookAlertSink(String webhookUrl, long timeoutMs, Clock clock) {
        this.endpoint = URI.create(webhookUrl.trim());
        this.timeout = Duration.ofMillis(Math.max(1_000L, timeoutMs));
        this.client = HttpClient.newBuilder().connectTimeout(timeout).build();
        this.clock = clock;
    }

    @Override
    public void send(Alert alert) {
        try {
            HttpRequest request = HttpRequest.newBuilder(endpoint)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload(alert), StandardCharsets.UTF_8))
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() / 100 != 2) {
                log.warn("Alert webhook returned HTTP {} for '{}': {}", response.statusCode(), alert.title(), response.body());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Alert delivery interrupted for '{}'", alert.title());
        } catch (IOException | RuntimeException e) {
            log.warn("Alert delivery failed for '{}': {}", alert.title(), e.toString());
        }
    }

    String payload(Alert alert) {
        String text = "[PhosFlow Alert] " + alert.title() + "\n"
                + alert.body() + "\n"
                + "Time: " + LocalDateTime.now(clock).format(TIMESTAMP);
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("text", text);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("msg_type", "text");
        body.put("content", content);
        return Jsons.toCompactJson(body);
    }
}

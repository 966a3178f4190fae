package io.phosflow.alert;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpServer;
import io.phosflow.config.PipelineSettings;
import io.phosflow.testing.MutableClock;
import io.phosflow.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class WebhookAlertSinkTest {
    private static final MutableClock CLOCK = new MutableClock(Instant.parse("2026-03-02T08:00:00Z"));

    @Test
    void postsTextMessageToWebhook() throws Exception {
        List<String> bodies = new CopyOnWriteArrayList<>();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/open-apis/bot/v2/hook/test", exchange -> {
            bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] ok = "{\"code\":0}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, ok.length);
            exchange.getResponseBody().write(ok);
            exchange.close();
        });
        server.start();
        try {
            String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/open-apis/bot/v2/hook/test";
            new WebhookAlertSink(url, 2_000L, CLOCK).send(Alert.forUnit("mol1", "Fatal error: mol1", "Abnormal termination"));

            Assertions.assertEquals(1, bodies.size());
            JsonNode body = Jsons.mapper().readTree(bodies.get(0));
            Assertions.assertEquals("text", body.path("msg_type").asText());
            Assertions.assertEquals("[PhosFlow Alert] Fatal error: mol1\nAbnormal termination\nTime: 2026-03-02 08:00:00",
                    body.path("content").path("text").asText());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void deliveryFailuresAreSwallowed() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        WebhookAlertSink unreachable = new WebhookAlertSink("http://127.0.0.1:" + port + "/hook/x", 1_000L, CLOCK);
        Assertions.assertDoesNotThrow(() -> unreachable.send(Alert.forUnit("mol1", "t", "b")));

        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
        });
        server.start();
        try {
            WebhookAlertSink failing = new WebhookAlertSink(
                    "http://127.0.0.1:" + server.getAddress().getPort() + "/hook/y", 1_000L, CLOCK);
            Assertions.assertDoesNotThrow(() -> failing.send(Alert.forUnit("mol1", "t", "b")));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void blankWebhookFallsBackToLogging() {
        Assertions.assertInstanceOf(LoggingAlertSink.class, AlertSinks.fromSettings(PipelineSettings.defaults(), CLOCK));
    }
}

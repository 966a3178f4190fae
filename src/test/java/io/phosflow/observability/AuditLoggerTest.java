package io.phosflow.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.phosflow.testing.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void chainSurvivesReopenAndDetectsTampering() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-audit-");
        try {
            MutableClock clock = new MutableClock(Instant.parse("2026-03-02T08:00:00Z"));
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger first = new AuditLogger(file, clock);
            first.log(AuditLogger.AuditEvent.of("unit_status", "mol1", "RUNNING", Map.of("from", "PENDING")));
            first.log(AuditLogger.AuditEvent.of("alert", "mol1", "sent",
                    Map.of("webhook", "https://open.feishu.cn/open-apis/bot/v2/hook/abc")));
            String hash = first.currentHash();

            AuditLogger reopened = new AuditLogger(file, clock);
            Assertions.assertEquals(hash, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("auto_exit", null, "ok", Map.of("idle_cycles", 3)));
            Assertions.assertEquals(0, reopened.verify());

            List<JsonNode> rows = reopened.tail(2);
            Assertions.assertEquals(2, rows.size());
            Assertions.assertEquals("***", rows.get(0).path("details").path("webhook").asText());
            Assertions.assertEquals(rows.get(0).path("hash").asText(), rows.get(1).path("prev_hash").asText());

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            lines.set(1, lines.get(1).replace("\"sent\"", "\"dropped\""));
            Files.write(file, lines, StandardCharsets.UTF_8);
            Assertions.assertEquals(2, reopened.verify());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}

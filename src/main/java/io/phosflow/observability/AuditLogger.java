package io.phosflow.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.phosflow.util.Hashing;
import io.phosflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash-chained JSONL journal of controller decisions: unit status changes, alerts and exits.
 * Each row carries the hash of the previous one, so truncation or edits are detectable.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("unit", event.unitId());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public List<JsonNode> tail(int limit) {
        List<JsonNode> out = new ArrayList<>();
        List<String> lines = readLines();
        for (int i = Math.max(0, lines.size() - Math.max(1, limit)); i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                out.add(Jsons.mapper().readTree(line));
            } catch (IOException e) {
                throw new RuntimeException("Malformed audit row " + (i + 1) + " in " + auditFile, e);
            }
        }
        return out;
    }

    /**
     * Recomputes the chain from the first row.
     *
     * @return number of the first broken row (1-based), or 0 when the chain is intact
     */
    @SuppressWarnings("unchecked")
    public int verify() {
        String expectedPrev = "";
        List<String> lines = readLines();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            Map<String, Object> row;
            try {
                row = Jsons.mapper().readValue(line, LinkedHashMap.class);
            } catch (IOException e) {
                return i + 1;
            }
            Object hash = row.remove("hash");
            if (!expectedPrev.equals(row.get("prev_hash"))) {
                return i + 1;
            }
            if (hash == null || !hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(row)))) {
                return i + 1;
            }
            expectedPrev = hash.toString();
        }
        return 0;
    }

    private List<String> readLines() {
        try {
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        String last = "";
        for (String line : readLines()) {
            if (line != null && !line.isBlank()) {
                last = line;
            }
        }
        if (last.isBlank()) {
            return "";
        }
        try {
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            log.warn("Last audit row in {} is unreadable, starting a new chain", auditFile);
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, LinkedHashMap.class);
    }

    public record AuditEvent(String action, String unitId, String result, Map<String, Object> details) {
        public static AuditEvent of(String action, String unitId, String result, Map<String, Object> details) {
            return new AuditEvent(action, unitId, result, details == null ? Map.of() : details);
        }
    }
}

package io.phosflow.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.phosflow.model.UnitStatus;
import io.phosflow.model.UnitStatusRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The status report CSV: one row per unit, kept sorted by name.
 *
 * <p>Rows are held in memory between saves. A save writes a sibling temporary file and moves it
 * over the report, so a crash mid-save leaves the previous snapshot intact.
 */
public final class StatusStore {
    private static final Logger log = LoggerFactory.getLogger(StatusStore.class);
    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path file;
    private final CsvMapper csvMapper;
    private final TreeMap<String, UnitStatusRecord> rows = new TreeMap<>();

    public StatusStore(Path file) {
        this.file = file;
        // Quote only cells that need it, so timestamps stay readable in spreadsheets.
        this.csvMapper = CsvMapper.builder()
                .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .build();
    }

    public Path file() {
        return file;
    }

    /**
     * Replaces the in-memory rows with the file contents. A missing file yields an empty store.
     */
    public void load() {
        rows.clear();
        if (!Files.exists(file)) {
            return;
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it = csvMapper
                .readerFor(Map.class)
                .with(schema)
                .readValues(file.toFile())) {
            while (it.hasNext()) {
                Map<String, String> row = it.next();
                String name = row.getOrDefault("Name", "").trim();
                if (name.isEmpty()) {
                    continue;
                }
                rows.put(name, new UnitStatusRecord(
                        name,
                        UnitStatus.fromString(row.get("Status")),
                        row.getOrDefault("Current_Stage", ""),
                        parseTimestamp(row.get("Last_Updated")),
                        row.getOrDefault("Remark", ""),
                        parseTimestamp(row.getOrDefault("Start_Time", ""))
                ));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read status report: " + file, e);
        }
    }

    public void save() {
        List<CsvRow> out = new ArrayList<>(rows.size());
        for (UnitStatusRecord r : rows.values()) {
            out.add(new CsvRow(
                    r.name(),
                    r.status().name(),
                    r.currentStage(),
                    formatTimestamp(r.lastUpdated()),
                    r.remark(),
                    formatTimestamp(r.startTime())
            ));
        }
        CsvSchema schema = csvMapper.schemaFor(CsvRow.class).withHeader();
        Path parent = file.toAbsolutePath().getParent();
        Path tmp = parent.resolve(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(parent);
            csvMapper.writer(schema).writeValue(tmp.toFile(), out);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException atomicFailed) {
                log.debug("Atomic move unavailable for {}, falling back to replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write status report: " + file, e);
        }
    }

    public boolean contains(String name) {
        return rows.containsKey(name);
    }

    public Optional<UnitStatusRecord> get(String name) {
        return Optional.ofNullable(rows.get(name));
    }

    public void put(UnitStatusRecord record) {
        rows.put(record.name(), record);
    }

    /**
     * Snapshot of all rows in name order.
     */
    public List<UnitStatusRecord> all() {
        return List.copyOf(rows.values());
    }

    public long count(UnitStatus status) {
        return rows.values().stream().filter(r -> r.status() == status).count();
    }

    public static String formatTimestamp(LocalDateTime value) {
        return value == null ? "" : TIMESTAMP.format(value);
    }

    static LocalDateTime parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(raw.trim(), TIMESTAMP);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring malformed timestamp '{}' in status report", raw);
            return null;
        }
    }

    @JsonPropertyOrder({"Name", "Status", "Current_Stage", "Last_Updated", "Remark", "Start_Time"})
    record CsvRow(
            @JsonProperty("Name") String name,
            @JsonProperty("Status") String status,
            @JsonProperty("Current_Stage") String currentStage,
            @JsonProperty("Last_Updated") String lastUpdated,
            @JsonProperty("Remark") String remark,
            @JsonProperty("Start_Time") String startTime
    ) {
    }
}

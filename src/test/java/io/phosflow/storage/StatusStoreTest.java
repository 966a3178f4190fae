package io.phosflow.storage;

import io.phosflow.model.UnitStatus;
import io.phosflow.model.UnitStatusRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Stream;

final class StatusStoreTest {

    @Test
    void savesSortedRowsWithFixedHeaderAndReloadsThem() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-status-");
        try {
            Path file = root.resolve("status_report.csv");
            StatusStore store = new StatusStore(file);
            store.load();
            Assertions.assertTrue(store.all().isEmpty());

            LocalDateTime now = LocalDateTime.of(2026, 3, 2, 8, 0, 0);
            store.put(UnitStatusRecord.discovered("mol2", now));
            store.put(UnitStatusRecord.discovered("mol1", now)
                    .withStatus(UnitStatus.RUNNING)
                    .withStage("S1_OPT")
                    .withRemark("Submitted, job 42")
                    .startedAt(now.minusHours(1)));
            store.save();

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Assertions.assertEquals("Name,Status,Current_Stage,Last_Updated,Remark,Start_Time", lines.get(0));
            Assertions.assertTrue(lines.get(1).startsWith("mol1,RUNNING,S1_OPT,2026-03-02 08:00:00,"));
            Assertions.assertTrue(lines.get(1).endsWith("2026-03-02 07:00:00"));
            Assertions.assertTrue(lines.get(2).startsWith("mol2,PENDING,Init,"));
            Assertions.assertFalse(Files.exists(root.resolve("status_report.csv.tmp")));

            StatusStore reloaded = new StatusStore(file);
            reloaded.load();
            UnitStatusRecord mol1 = reloaded.get("mol1").orElseThrow();
            Assertions.assertEquals(UnitStatus.RUNNING, mol1.status());
            Assertions.assertEquals("Submitted, job 42", mol1.remark());
            Assertions.assertEquals(now.minusHours(1), mol1.startTime());
            Assertions.assertNull(reloaded.get("mol2").orElseThrow().startTime());
            Assertions.assertEquals(1, reloaded.count(UnitStatus.PENDING));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedTimestampsLoadAsMissing() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-status-bad-");
        try {
            Path file = root.resolve("status_report.csv");
            Files.writeString(file, """
                    Name,Status,Current_Stage,Last_Updated,Remark,Start_Time
                    mol1,error,SOC,yesterday,Unhandled error,
                    ,RUNNING,S0_OPT,,,
                    """, StandardCharsets.UTF_8);
            StatusStore store = new StatusStore(file);
            store.load();

            Assertions.assertEquals(1, store.all().size());
            UnitStatusRecord mol1 = store.get("mol1").orElseThrow();
            Assertions.assertEquals(UnitStatus.ERROR, mol1.status());
            Assertions.assertNull(mol1.lastUpdated());
            Assertions.assertNull(mol1.startTime());
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

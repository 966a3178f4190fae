package io.phosflow.batch;

import com.fasterxml.jackson.databind.JsonNode;
import io.phosflow.config.PhosFlowConfig;
import io.phosflow.config.PipelineSettings;
import io.phosflow.model.Milestone;
import io.phosflow.model.UnitLayout;
import io.phosflow.model.UnitStatus;
import io.phosflow.model.UnitStatusRecord;
import io.phosflow.observability.AuditLogger;
import io.phosflow.pipeline.AdvanceResult;
import io.phosflow.storage.StatusStore;
import io.phosflow.testing.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

final class BatchControllerTest {

    @Test
    void admitsPendingUnitsUpToCapInDiscoveryOrder() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-batch-cap-");
        try {
            Harness h = new Harness(root, PipelineSettings.defaults().withRunOverrides(2, null, false, null));
            h.addSource("mol_c");
            h.addSource("mol_a");
            h.addSource("mol_b");

            CycleOutcome first = h.controller.runCycle();
            Assertions.assertEquals(List.of("mol_a", "mol_b", "mol_c"), first.discovered());
            Assertions.assertEquals(List.of("mol_a", "mol_b"), first.admitted());
            Assertions.assertEquals(2, first.active());
            Assertions.assertEquals(1, first.pending());
            Assertions.assertEquals(List.of("mol_a", "mol_b"), h.pipelines.advanced);
            Assertions.assertTrue(first.saved());

            UnitStatusRecord a = h.status("mol_a");
            Assertions.assertEquals(UnitStatus.RUNNING, a.status());
            Assertions.assertEquals(Milestone.STARTING.label(), a.currentStage());
            Assertions.assertEquals("Processing", a.remark());
            Assertions.assertNotNull(a.startTime());

            Files.createDirectories(h.config.unitDir("mol_a"));
            Files.writeString(h.config.unitDir("mol_a").resolve(UnitLayout.REPORT), "report");
            CycleOutcome second = h.controller.runCycle();
            Assertions.assertTrue(second.admitted().isEmpty());
            Assertions.assertEquals(UnitStatus.COMPLETED, h.status("mol_a").status());
            Assertions.assertEquals(UnitStatusRecord.STAGE_FINISHED, h.status("mol_a").currentStage());

            CycleOutcome third = h.controller.runCycle();
            Assertions.assertEquals(List.of("mol_c"), third.admitted());
            Assertions.assertEquals(1, third.completed());

            StatusStore reloaded = new StatusStore(h.config.statusFile());
            reloaded.load();
            Assertions.assertEquals(3, reloaded.all().size());
            Assertions.assertEquals(UnitStatus.COMPLETED, reloaded.get("mol_a").orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fatalLogRetiresUnitWithSingleAlert() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-batch-fatal-");
        try {
            Harness h = new Harness(root, PipelineSettings.defaults());
            h.addSource("mol1");
            h.controller.runCycle();

            Path fatal = h.config.unitDir("mol1").resolve(UnitLayout.FATAL_LOG);
            Files.createDirectories(fatal.getParent());
            Files.writeString(fatal, "[2026-03-02 08:00:00] FATAL ERROR:\nAbnormal termination in 01_S0_Opt\n");
            h.controller.runCycle();
            h.controller.runCycle();

            UnitStatusRecord record = h.status("mol1");
            Assertions.assertEquals(UnitStatus.FAILED, record.status());
            Assertions.assertEquals("Fatal Error (see FATAL_ERROR.txt)", record.remark());
            Assertions.assertEquals(1, h.alerts.sent.size());
            Assertions.assertTrue(h.alerts.sent.get(0).body().contains("Abnormal termination"));
            Assertions.assertEquals(1, h.pipelines.advanced.size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingSourceFailsUnit() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-batch-source-");
        try {
            Harness h = new Harness(root, PipelineSettings.defaults());
            Path source = h.addSource("mol1");
            h.controller.runCycle();
            Files.delete(source);

            CycleOutcome outcome = h.controller.runCycle();
            Assertions.assertEquals(1, outcome.failed());
            Assertions.assertEquals("XYZ Missing", h.status("mol1").remark());
            Assertions.assertEquals(1, h.alerts.countTitled("Source structure missing"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stallAlertFiresOncePerEpisode() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-batch-stall-");
        try {
            Harness h = new Harness(root, PipelineSettings.defaults());
            h.addSource("mol1");
            h.controller.runCycle();

            h.clock.advance(Duration.ofHours(49));
            h.controller.runCycle();
            Assertions.assertTrue(h.status("mol1").remark().endsWith("[Timeout Alert Sent]"));
            h.controller.runCycle();
            Assertions.assertEquals(1, h.alerts.countTitled("Unit stalled"));

            h.pipelines.results.put("mol1", new AdvanceResult(Milestone.S0_DONE, false, 2));
            h.controller.runCycle();
            Assertions.assertEquals("Processing", h.status("mol1").remark());
            Assertions.assertEquals(Milestone.S0_DONE.label(), h.status("mol1").currentStage());

            h.clock.advance(Duration.ofHours(49));
            h.controller.runCycle();
            Assertions.assertEquals(2, h.alerts.countTitled("Unit stalled"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void repeatedErrorsEscalateToFatal() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-batch-strikes-");
        try {
            Harness h = new Harness(root, PipelineSettings.defaults());
            h.addSource("mol1");
            h.pipelines.failing.add("mol1");

            CycleOutcome first = h.controller.runCycle();
            Assertions.assertEquals(1, first.errors());
            UnitStatusRecord errored = h.status("mol1");
            Assertions.assertEquals(UnitStatus.ERROR, errored.status());
            Assertions.assertTrue(errored.remark().startsWith("Error: sbatch: error"));

            h.pipelines.failing.clear();
            h.controller.runCycle();
            Assertions.assertEquals(UnitStatus.RUNNING, h.status("mol1").status());

            h.pipelines.failing.add("mol1");
            h.controller.runCycle();
            h.controller.runCycle();
            Path fatal = h.config.unitDir("mol1").resolve(UnitLayout.FATAL_LOG);
            Assertions.assertFalse(Files.exists(fatal));
            h.controller.runCycle();
            Assertions.assertTrue(Files.exists(fatal));

            h.controller.runCycle();
            Assertions.assertEquals(UnitStatus.FAILED, h.status("mol1").status());
            Assertions.assertEquals(4, h.alerts.countTitled("Unhandled error"));
            Assertions.assertEquals(1, h.alerts.countTitled("Fatal error"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void autoExitAfterIdleCycles() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-batch-idle-");
        try {
            Harness h = new Harness(root, PipelineSettings.defaults().withRunOverrides(null, null, true, 2));
            Files.createDirectories(h.config.sourceDir());

            CycleOutcome first = h.controller.runCycle();
            Assertions.assertTrue(first.idle());
            Assertions.assertFalse(first.exitRequested());
            CycleOutcome second = h.controller.runCycle();
            Assertions.assertTrue(second.exitRequested());
            Assertions.assertEquals(2, second.idleCycles());

            List<JsonNode> rows = h.audit.tail(10);
            Assertions.assertEquals("auto_exit", rows.get(rows.size() - 1).path("action").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void statusChangesAreAudited() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-batch-audit-");
        try {
            Harness h = new Harness(root, PipelineSettings.defaults());
            h.addSource("mol1");
            h.controller.runCycle();

            List<JsonNode> rows = h.audit.tail(10);
            Assertions.assertEquals(1, rows.size());
            Assertions.assertEquals("unit_status", rows.get(0).path("action").asText());
            Assertions.assertEquals("mol1", rows.get(0).path("unit").asText());
            Assertions.assertEquals("RUNNING", rows.get(0).path("result").asText());
            Assertions.assertEquals(0, h.audit.verify());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void undecodableFatalLogStillAlertsAndWatchdogRuns() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-batch-fatal-bytes-");
        try {
            Harness h = new Harness(root, PipelineSettings.defaults());
            h.addSource("a_mol");
            h.addSource("b_mol");
            h.controller.runCycle();

            h.clock.advance(Duration.ofHours(49));
            Path fatal = h.config.unitDir("a_mol").resolve(UnitLayout.FATAL_LOG);
            Files.createDirectories(fatal.getParent());
            Files.write(fatal, new byte[]{'F', 'A', 'T', 'A', 'L', '\n', (byte) 0xE9, (byte) 0xFF, '\n'});

            CycleOutcome outcome = h.controller.runCycle();
            Assertions.assertTrue(outcome.saved());
            Assertions.assertEquals(UnitStatus.FAILED, h.status("a_mol").status());
            Assertions.assertEquals(1, h.alerts.countTitled("Fatal error"));
            Assertions.assertEquals(1, h.alerts.countTitled("Unit stalled"));
            Assertions.assertTrue(h.status("b_mol").remark().contains(BatchController.REMARK_TIMEOUT.trim()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failingAlertSinkDoesNotAbortCycle() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-batch-alert-down-");
        try {
            Harness h = new Harness(root, PipelineSettings.defaults());
            h.addSource("mol1");
            h.controller.runCycle();
            h.alerts.broken = true;

            h.clock.advance(Duration.ofHours(49));
            CycleOutcome outcome = h.controller.runCycle();
            Assertions.assertTrue(outcome.saved());
            Assertions.assertEquals(0, outcome.alertsSent());
            Assertions.assertTrue(h.alerts.sent.isEmpty());

            StatusStore reloaded = new StatusStore(h.config.statusFile());
            reloaded.load();
            Assertions.assertTrue(reloaded.get("mol1").orElseThrow().remark()
                    .contains(BatchController.REMARK_TIMEOUT.trim()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedSaveStillRunsWatchdog() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-batch-save-fail-");
        try {
            Harness h = new Harness(root, PipelineSettings.defaults());
            Files.createDirectories(h.config.statusFile());
            Files.writeString(h.config.statusFile().resolve("keep"), "x");
            h.addSource("mol1");

            CycleOutcome first = h.controller.runCycle();
            Assertions.assertFalse(first.saved());
            Assertions.assertEquals(UnitStatus.RUNNING, h.status("mol1").status());

            h.clock.advance(Duration.ofHours(49));
            CycleOutcome second = h.controller.runCycle();
            Assertions.assertFalse(second.saved());
            Assertions.assertEquals(1, h.alerts.countTitled("Unit stalled"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void activeUnitResetsIdleCounter() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-batch-idle-reset-");
        try {
            Harness h = new Harness(root, PipelineSettings.defaults().withRunOverrides(null, null, true, 3));
            h.controller.runCycle();
            Assertions.assertEquals(2, h.controller.runCycle().idleCycles());

            Path source = h.addSource("mol1");
            CycleOutcome busy = h.controller.runCycle();
            Assertions.assertFalse(busy.idle());
            Assertions.assertEquals(0, busy.idleCycles());

            Files.delete(source);
            Assertions.assertEquals(0, h.controller.runCycle().idleCycles());
            CycleOutcome idleAgain = h.controller.runCycle();
            Assertions.assertEquals(1, idleAgain.idleCycles());
            Assertions.assertFalse(idleAgain.exitRequested());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stageLabelNeverMovesBackwards() {
        Assertions.assertEquals(Milestone.T1_DONE.label(),
                BatchController.monotonicLabel(Milestone.T1_DONE.label(), Milestone.S0_DONE));
        Assertions.assertEquals(Milestone.ORCA_DONE.label(),
                BatchController.monotonicLabel(Milestone.T1_DONE.label(), Milestone.ORCA_DONE));
        Assertions.assertEquals(Milestone.STARTING.label(),
                BatchController.monotonicLabel(UnitStatusRecord.STAGE_INIT, Milestone.STARTING));
    }

    private static final class Harness {
        final PhosFlowConfig config;
        final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T08:00:00Z"));
        final StatusStore store;
        final ScriptedPipelines pipelines = new ScriptedPipelines();
        final RecordingAlertSink alerts = new RecordingAlertSink();
        final AuditLogger audit;
        final BatchController controller;

        Harness(Path root, PipelineSettings settings) {
            this.config = PhosFlowConfig.fromRoot(root.toString());
            this.store = new StatusStore(config.statusFile());
            this.audit = new AuditLogger(config.auditFile(), clock);
            this.controller = new BatchController(config, settings, store, pipelines, alerts, audit, clock);
        }

        Path addSource(String unitId) throws IOException {
            Path source = config.sourceFile(unitId);
            Files.createDirectories(source.getParent());
            Files.writeString(source, "1\n" + unitId + "\nH 0.0 0.0 0.0\n");
            return source;
        }

        UnitStatusRecord status(String unitId) {
            return store.get(unitId).orElseThrow();
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

package io.phosflow.batch;

import io.phosflow.alert.Alert;
import io.phosflow.alert.AlertSink;
import io.phosflow.config.PhosFlowConfig;
import io.phosflow.config.PipelineSettings;
import io.phosflow.model.Milestone;
import io.phosflow.model.UnitLayout;
import io.phosflow.model.UnitStatus;
import io.phosflow.model.UnitStatusRecord;
import io.phosflow.observability.AuditLogger;
import io.phosflow.pipeline.AdvanceResult;
import io.phosflow.pipeline.FatalErrorLog;
import io.phosflow.pipeline.UnitPipelineFactory;
import io.phosflow.storage.StatusStore;
import io.phosflow.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Concurrency-capped batch loop over all units.
 *
 * <p>One {@link #runCycle()} discovers new source structures, admits pending units in discovery
 * order while fewer than {@code maxConcurrent} are active, classifies and advances every active
 * unit in name order, saves the status report, and runs the stall watchdog. Units in
 * {@code ERROR} stay active and are retried; after {@code maxErrorStrikes} consecutive errors the
 * unit's fatal log is written so the next cycle retires it as {@code FAILED}.
 */
public final class BatchController {
    private static final Logger log = LoggerFactory.getLogger(BatchController.class);

    static final String REMARK_ACTIVATED = "Activated";
    static final String REMARK_SOURCE_MISSING = "XYZ Missing";
    static final String REMARK_FATAL = "Fatal Error (see " + UnitLayout.FATAL_LOG + ")";
    static final String REMARK_REPORT = "PLQY Report Generated";
    static final String REMARK_PROCESSING = "Processing";
    static final String REMARK_TIMEOUT = " [Timeout Alert Sent]";
    static final int FATAL_ALERT_CHARS = 200;
    static final int ERROR_REMARK_CHARS = 50;

    private final PhosFlowConfig config;
    private final PipelineSettings settings;
    private final StatusStore statusStore;
    private final UnitPipelineFactory pipelines;
    private final AlertSink alerts;
    private final AuditLogger audit;
    private final Clock clock;
    private final Map<String, Integer> errorStrikes = new HashMap<>();
    private long cycle;
    private int idleCycles;
    private boolean idleLogged;

    public BatchController(
            PhosFlowConfig config,
            PipelineSettings settings,
            StatusStore statusStore,
            UnitPipelineFactory pipelines,
            AlertSink alerts,
            AuditLogger audit,
            Clock clock
    ) {
        this.config = config;
        this.settings = settings;
        this.statusStore = statusStore;
        this.pipelines = pipelines;
        this.alerts = alerts;
        this.audit = audit;
        this.clock = clock;
    }

    public CycleOutcome runCycle() {
        cycle++;
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        CycleCounters counters = new CycleCounters();

        List<String> discovered;
        try {
            discovered = discover(now);
        } catch (RuntimeException e) {
            log.error("Discovery failed, continuing with known units: {}", e.getMessage(), e);
            discovered = List.of();
        }
        List<String> admitted = admit(now);

        List<String> active = activeUnits();
        boolean idle = active.isEmpty();
        if (idle) {
            idleCycles++;
            if (!idleLogged) {
                log.info("No active units; {} pending", statusStore.count(UnitStatus.PENDING));
                idleLogged = true;
            }
        } else {
            idleCycles = 0;
            idleLogged = false;
        }

        for (String unitId : active) {
            try {
                process(unitId, now, counters);
            } catch (RuntimeException e) {
                counters.errors++;
                log.error("Classifying unit {} failed, skipping it this cycle: {}", unitId, e.getMessage(), e);
            }
        }

        boolean saved = persist();
        if (watchdog(now, counters)) {
            saved = persist() && saved;
        }

        boolean exitRequested = idle && settings.autoExit() && idleCycles >= settings.idleCycleThreshold();
        if (exitRequested) {
            audit("auto_exit", null, "ok", Map.of("idle_cycles", idleCycles));
        }
        return new CycleOutcome(
                cycle,
                discovered,
                admitted,
                activeUnits().size(),
                (int) statusStore.count(UnitStatus.PENDING),
                (int) statusStore.count(UnitStatus.COMPLETED),
                (int) statusStore.count(UnitStatus.FAILED),
                counters.errors,
                counters.alerts,
                idle,
                idleCycles,
                saved,
                exitRequested
        );
    }

    /**
     * Saves the status report. A failed save is logged and retried on the next cycle.
     */
    public boolean persist() {
        try {
            statusStore.save();
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to save status report {}: {}", statusStore.file(), e.getMessage(), e);
            return false;
        }
    }

    private List<String> discover(LocalDateTime now) {
        List<String> found = new ArrayList<>();
        Path sourceDir = config.sourceDir();
        if (!Files.isDirectory(sourceDir)) {
            log.warn("Source directory does not exist: {}", sourceDir);
            return found;
        }
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(sourceDir, "*.xyz")) {
            for (Path file : files) {
                if (Files.isRegularFile(file)) {
                    String name = file.getFileName().toString();
                    ids.add(name.substring(0, name.length() - ".xyz".length()));
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to scan source directory: " + sourceDir, e);
        }
        ids.sort(Comparator.naturalOrder());
        for (String id : ids) {
            if (statusStore.contains(id)) {
                continue;
            }
            statusStore.put(UnitStatusRecord.discovered(id, now));
            found.add(id);
            log.info("Discovered unit {}", id);
        }
        return found;
    }

    private List<String> admit(LocalDateTime now) {
        List<String> admitted = new ArrayList<>();
        int active = activeUnits().size();
        if (active >= settings.maxConcurrent()) {
            return admitted;
        }
        List<UnitStatusRecord> pending = new ArrayList<>();
        for (UnitStatusRecord record : statusStore.all()) {
            if (record.status() == UnitStatus.PENDING) {
                pending.add(record);
            }
        }
        pending.sort(Comparator
                .comparing(UnitStatusRecord::lastUpdated, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(UnitStatusRecord::name));
        for (UnitStatusRecord record : pending) {
            if (active >= settings.maxConcurrent()) {
                break;
            }
            update(record, record.withStatus(UnitStatus.RUNNING)
                    .withRemark(REMARK_ACTIVATED)
                    .startedAt(now), now);
            admitted.add(record.name());
            active++;
            log.info("Activated unit {} ({}/{} slots)", record.name(), active, settings.maxConcurrent());
        }
        return admitted;
    }

    private void process(String unitId, LocalDateTime now, CycleCounters counters) {
        UnitStatusRecord record = statusStore.get(unitId).orElseThrow();
        UnitLayout layout = new UnitLayout(unitId, config.unitDir(unitId), config.sourceFile(unitId));
        FatalErrorLog fatalLog = new FatalErrorLog(layout.fatalLog(), clock);

        if (!Files.isRegularFile(layout.sourceFile())) {
            update(record, record.withStatus(UnitStatus.FAILED).withRemark(REMARK_SOURCE_MISSING), now);
            alert(counters, Alert.forUnit(unitId, "Source structure missing: " + unitId,
                    "Expected " + layout.sourceFile()));
            return;
        }
        if (fatalLog.exists()) {
            String detail = fatalTail(fatalLog);
            update(record, record.withStatus(UnitStatus.FAILED).withRemark(REMARK_FATAL), now);
            alert(counters, Alert.forUnit(unitId, "Fatal error: " + unitId, detail));
            return;
        }
        if (Files.exists(layout.report())) {
            update(record, record.withStatus(UnitStatus.COMPLETED)
                    .withStage(UnitStatusRecord.STAGE_FINISHED)
                    .withRemark(REMARK_REPORT), now);
            return;
        }

        try {
            AdvanceResult result = pipelines.forUnit(unitId).advance();
            errorStrikes.remove(unitId);
            String label = result.fatal() ? result.stageLabel() : monotonicLabel(record.currentStage(), result.milestone());
            UnitStatusRecord next = record.withStatus(UnitStatus.RUNNING).withStage(label);
            if (next.status() != record.status() || !next.currentStage().equals(record.currentStage())) {
                next = next.withRemark(REMARK_PROCESSING);
            }
            update(record, next, now);
        } catch (RuntimeException e) {
            counters.errors++;
            int strikes = errorStrikes.merge(unitId, 1, Integer::sum);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.error("Unit {} failed to advance ({} of {}): {}", unitId, strikes, settings.maxErrorStrikes(), message, e);
            update(record, record.withStatus(UnitStatus.ERROR)
                    .withRemark("Error: " + Texts.singleLine(message, ERROR_REMARK_CHARS)), now);
            alert(counters, Alert.forUnit(unitId, "Unhandled error: " + unitId, stackTrace(e)));
            if (strikes >= settings.maxErrorStrikes()) {
                try {
                    fatalLog.append("Advancing failed " + strikes + " consecutive times. Last error:\n" + stackTrace(e));
                    errorStrikes.remove(unitId);
                } catch (RuntimeException appendFailed) {
                    log.error("Could not escalate unit {} to {}: {}", unitId, fatalLog.file(), appendFailed.getMessage());
                }
            }
        }
    }

    /**
     * Appends the timeout marker to stalled RUNNING units, once per stall episode.
     *
     * @return whether any remark changed
     */
    private boolean watchdog(LocalDateTime now, CycleCounters counters) {
        boolean changed = false;
        Duration limit = Duration.ofMillis(settings.stallTimeoutMs());
        for (UnitStatusRecord record : statusStore.all()) {
            if (record.status() != UnitStatus.RUNNING || record.lastUpdated() == null) {
                continue;
            }
            String remark = record.remark() == null ? "" : record.remark();
            if (remark.contains(REMARK_TIMEOUT.trim())) {
                continue;
            }
            Duration stalled = Duration.between(record.lastUpdated(), now);
            if (stalled.compareTo(limit) <= 0) {
                continue;
            }
            statusStore.put(record.withRemark(remark + REMARK_TIMEOUT));
            changed = true;
            long hours = stalled.toHours();
            alert(counters, Alert.forUnit(record.name(), "Unit stalled: " + record.name(),
                    "No progress for " + hours + " h at stage '" + record.currentStage() + "'"));
        }
        return changed;
    }

    private static String fatalTail(FatalErrorLog fatalLog) {
        try {
            return fatalLog.tail(FATAL_ALERT_CHARS);
        } catch (RuntimeException e) {
            log.warn("Fatal log {} unreadable: {}", fatalLog.file(), e.getMessage());
            return "See " + fatalLog.file();
        }
    }

    private void update(UnitStatusRecord before, UnitStatusRecord after, LocalDateTime now) {
        boolean statusChanged = before.status() != after.status();
        boolean stageChanged = !after.currentStage().equals(before.currentStage());
        UnitStatusRecord stored = statusChanged || stageChanged ? after.touchedAt(now) : after;
        statusStore.put(stored);
        if (statusChanged) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("from", before.status().name());
            details.put("stage", stored.currentStage());
            details.put("remark", stored.remark());
            audit("unit_status", before.name(), stored.status().name(), details);
        }
    }

    private void alert(CycleCounters counters, Alert alert) {
        try {
            alerts.send(alert);
            counters.alerts++;
            audit("alert", alert.unitId(), "sent", Map.of("title", alert.title()));
        } catch (RuntimeException e) {
            log.warn("Alert '{}' could not be delivered: {}", alert.title(), e.getMessage());
        }
    }

    private void audit(String action, String unitId, String result, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        try {
            audit.log(AuditLogger.AuditEvent.of(action, unitId, result, details));
        } catch (RuntimeException e) {
            log.warn("Audit write failed for {}: {}", action, e.getMessage());
        }
    }

    private List<String> activeUnits() {
        List<String> out = new ArrayList<>();
        for (UnitStatusRecord record : statusStore.all()) {
            if (record.status().active()) {
                out.add(record.name());
            }
        }
        return out;
    }

    /**
     * Stage labels never move backwards while a unit is progressing, even when a retry
     * resets an earlier step.
     */
    static String monotonicLabel(String previous, Milestone reached) {
        Milestone before = Milestone.fromLabel(previous);
        return reached.compareTo(before) >= 0 ? reached.label() : before.label();
    }

    private static String stackTrace(Throwable e) {
        StringWriter out = new StringWriter();
        e.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    private static final class CycleCounters {
        int errors;
        int alerts;
    }
}

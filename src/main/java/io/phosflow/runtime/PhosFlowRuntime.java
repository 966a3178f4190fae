package io.phosflow.runtime;

import io.phosflow.alert.AlertSink;
import io.phosflow.alert.AlertSinks;
import io.phosflow.batch.BatchController;
import io.phosflow.batch.CycleOutcome;
import io.phosflow.config.PhosFlowConfig;
import io.phosflow.config.PipelineSettings;
import io.phosflow.job.ExternalJobAdapter;
import io.phosflow.job.SlurmJobAdapter;
import io.phosflow.model.PipelineStep;
import io.phosflow.model.StageRecord;
import io.phosflow.model.UnitStatusRecord;
import io.phosflow.observability.AuditLogger;
import io.phosflow.pipeline.AdvanceResult;
import io.phosflow.pipeline.PipelineEngineFactory;
import io.phosflow.storage.Database;
import io.phosflow.storage.StageStateStore;
import io.phosflow.storage.StatusStore;
import io.phosflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wires stores, the scheduler adapter, alerts and the controller for one deployment root.
 */
public final class PhosFlowRuntime {
    private static final Logger log = LoggerFactory.getLogger(PhosFlowRuntime.class);

    private final PhosFlowConfig config;
    private final PipelineSettings settings;
    private final Clock clock;
    private final Database database;
    private final StageStateStore stageStore;
    private final StatusStore statusStore;
    private final PipelineEngineFactory pipelines;
    private final AlertSink alerts;
    private AuditLogger audit;
    private BatchController controller;

    public PhosFlowRuntime(PhosFlowConfig config, PipelineSettings settings) {
        this(config, settings, Clock.systemDefaultZone(), new SlurmJobAdapter(settings), null);
    }

    public PhosFlowRuntime(
            PhosFlowConfig config,
            PipelineSettings settings,
            Clock clock,
            ExternalJobAdapter adapter,
            AlertSink alerts
    ) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config.dbFile());
        this.stageStore = new StageStateStore(database);
        this.statusStore = new StatusStore(config.statusFile());
        this.pipelines = new PipelineEngineFactory(config, settings, stageStore, adapter, clock);
        this.alerts = alerts == null ? AlertSinks.fromSettings(settings, clock) : alerts;
    }

    public void init() {
        try {
            Files.createDirectories(config.sourceDir());
            Files.createDirectories(config.resultsDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories under: " + config.rootDir(), e);
        }
        database.init();
        statusStore.load();
        audit = new AuditLogger(config.auditFile(), clock);
    }

    /**
     * Writes the default settings file unless one exists.
     *
     * @return whether a file was written
     */
    public boolean writeDefaultSettings() {
        if (Files.exists(config.settingsFile())) {
            return false;
        }
        try {
            Files.writeString(config.settingsFile(), Jsons.toJson(PipelineSettings.defaults().toFile()));
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write settings: " + config.settingsFile(), e);
        }
    }

    public BatchController controller() {
        if (controller == null) {
            controller = new BatchController(config, settings, statusStore, pipelines, alerts, audit, clock);
        }
        return controller;
    }

    public CycleOutcome runCycle() {
        return controller().runCycle();
    }

    /**
     * Advances a single unit outside the controller. Status records are not touched.
     */
    public AdvanceResult advanceUnit(String unitId) {
        if (!Files.isRegularFile(config.sourceFile(unitId))) {
            throw new IllegalArgumentException("No source structure for unit: " + config.sourceFile(unitId));
        }
        AdvanceResult result = pipelines.forUnit(unitId).advance();
        log.info("Advanced {} to {}", unitId, result.stageLabel());
        return result;
    }

    public List<UnitStatusRecord> status() {
        return statusStore.all();
    }

    public UnitDetail unitDetail(String unitId, int historyLimit) {
        Map<PipelineStep, StageRecord> steps = stageStore.load(unitId);
        return new UnitDetail(
                unitId,
                statusStore.get(unitId).orElse(null),
                new ArrayList<>(steps.values()),
                stageStore.history(unitId, historyLimit)
        );
    }

    public AuditLogger audit() {
        return audit;
    }

    public PipelineSettings settings() {
        return settings;
    }

    public PhosFlowConfig config() {
        return config;
    }

    public record UnitDetail(
            String unitId,
            UnitStatusRecord status,
            List<StageRecord> steps,
            List<StageStateStore.TransitionEntry> history
    ) {
    }
}

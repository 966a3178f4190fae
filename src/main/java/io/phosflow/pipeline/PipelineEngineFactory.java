package io.phosflow.pipeline;

import io.phosflow.analysis.FinalAnalysis;
import io.phosflow.config.PhosFlowConfig;
import io.phosflow.config.PipelineSettings;
import io.phosflow.job.ExternalJobAdapter;
import io.phosflow.job.FileJobInputPreparer;
import io.phosflow.model.UnitLayout;
import io.phosflow.probe.FileArtifactProbe;
import io.phosflow.storage.StageStateStore;

import java.time.Clock;

/**
 * Wires a file-backed {@link PipelineEngine} for a unit. The gate, the table, the store and the
 * scheduler adapter are shared by all units.
 */
public final class PipelineEngineFactory implements UnitPipelineFactory {
    private final PhosFlowConfig config;
    private final PipelineSettings settings;
    private final StageStateStore store;
    private final ExternalJobAdapter adapter;
    private final Clock clock;
    private final StageGate gate = new StageGate();
    private final TransitionTable table = TransitionTable.standard();

    public PipelineEngineFactory(
            PhosFlowConfig config,
            PipelineSettings settings,
            StageStateStore store,
            ExternalJobAdapter adapter,
            Clock clock
    ) {
        this.config = config;
        this.settings = settings;
        this.store = store;
        this.adapter = adapter;
        this.clock = clock;
    }

    public UnitLayout layout(String unitId) {
        return new UnitLayout(unitId, config.unitDir(unitId), config.sourceFile(unitId));
    }

    @Override
    public PipelineEngine forUnit(String unitId) {
        UnitLayout layout = layout(unitId);
        return new PipelineEngine(
                layout,
                settings,
                new FileArtifactProbe(layout, settings.reorganizationThreshold()),
                gate,
                table,
                new FileJobInputPreparer(layout, settings),
                adapter,
                store,
                new UnitWorkspace(layout),
                new FatalErrorLog(layout.fatalLog(), clock),
                new FinalAnalysis(settings.temperatureK()),
                clock
        );
    }
}

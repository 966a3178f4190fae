package io.phosflow.pipeline;

import io.phosflow.analysis.ReportGenerator;
import io.phosflow.config.PipelineSettings;
import io.phosflow.job.ExternalJobAdapter;
import io.phosflow.job.InputPreparationException;
import io.phosflow.job.JobInputPreparer;
import io.phosflow.job.JobVariant;
import io.phosflow.job.PreparedJob;
import io.phosflow.job.SubmissionHandle;
import io.phosflow.model.Milestone;
import io.phosflow.model.PipelineStep;
import io.phosflow.model.StageRecord;
import io.phosflow.model.StageState;
import io.phosflow.model.StepKind;
import io.phosflow.model.UnitLayout;
import io.phosflow.probe.ArtifactProbe;
import io.phosflow.probe.FailureSignature;
import io.phosflow.probe.OverlapVerdict;
import io.phosflow.storage.StageStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stage state machine of one unit.
 *
 * <p>Each call loads the typed step states from the store, observes the unit tree through the
 * {@link ArtifactProbe}, and applies {@link TransitionTable} rows until no step changes state.
 * Side effects are limited to job submission, the unit's marker files, the fatal log and the
 * final report. Every applied row is persisted together with the records it produced.
 */
public final class PipelineEngine implements UnitPipeline {
    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);
    private static final int MAX_PASSES = PipelineStep.values().length * 3;

    private final UnitLayout layout;
    private final PipelineSettings settings;
    private final ArtifactProbe probe;
    private final StageGate gate;
    private final TransitionTable table;
    private final JobInputPreparer preparer;
    private final ExternalJobAdapter adapter;
    private final StageStateStore store;
    private final UnitWorkspace workspace;
    private final FatalErrorLog fatalLog;
    private final ReportGenerator reports;
    private final Clock clock;

    public PipelineEngine(
            UnitLayout layout,
            PipelineSettings settings,
            ArtifactProbe probe,
            StageGate gate,
            TransitionTable table,
            JobInputPreparer preparer,
            ExternalJobAdapter adapter,
            StageStateStore store,
            UnitWorkspace workspace,
            FatalErrorLog fatalLog,
            ReportGenerator reports,
            Clock clock
    ) {
        this.layout = layout;
        this.settings = settings;
        this.probe = probe;
        this.gate = gate;
        this.table = table;
        this.preparer = preparer;
        this.adapter = adapter;
        this.store = store;
        this.workspace = workspace;
        this.fatalLog = fatalLog;
        this.reports = reports;
        this.clock = clock;
    }

    @Override
    public AdvanceResult advance() {
        if (probe.fatalLogPresent()) {
            return AdvanceResult.blocked();
        }
        Map<PipelineStep, StageRecord> records = reconcile(store.load(layout.unitId()));
        for (StageRecord record : records.values()) {
            if (record.state() == StageState.FATAL) {
                log.warn("{}: step {} is FATAL but {} is missing", layout.unitId(), record.step(), fatalLog.file());
                return AdvanceResult.blocked();
            }
        }

        Set<PipelineStep> submitted = EnumSet.noneOf(PipelineStep.class);
        boolean changed = true;
        int passes = 0;
        while (changed && passes < MAX_PASSES) {
            changed = false;
            passes++;
            for (PipelineStep step : PipelineStep.values()) {
                StageState current = records.get(step).state();
                if (current == StageState.READY) {
                    continue;
                }
                if (apply(step, records, submitted)) {
                    changed = true;
                }
                if (records.get(step).state() == StageState.FATAL) {
                    return new AdvanceResult(Milestone.STARTING, true, submitted.size());
                }
            }
        }
        if (changed) {
            log.warn("{}: state machine did not settle after {} passes", layout.unitId(), passes);
        }

        Map<PipelineStep, StageState> states = statesOf(records);
        boolean reportPresent = probe.reportPresent();
        if (!reportPresent && gate.analysisEligible(states)) {
            reports.writeReport(layout);
            reportPresent = true;
        }
        return new AdvanceResult(Milestone.reached(states, reportPresent), false, submitted.size());
    }

    /**
     * Applies the row for the step's current observation.
     *
     * @return whether any step changed state
     */
    private boolean apply(PipelineStep step, Map<PipelineStep, StageRecord> records, Set<PipelineStep> submitted) {
        StageRecord record = records.get(step);
        Observation seen = observe(step, record, records);
        Transition transition = table.lookup(step.kind(), record.state(), seen.event());
        if (transition.action() == StageAction.NONE && transition.next() == record.state()) {
            return false;
        }
        if (transition.action() == StageAction.SUBMIT && submitted.contains(step)) {
            return false;
        }
        List<StageRecord> updated;
        try {
            updated = execute(step, record, transition, seen, records, submitted);
        } catch (InputPreparationException e) {
            seen = Observation.detailed(StageEvent.INPUT_UNUSABLE,
                    "Cannot prepare " + step + " inputs: " + e.getMessage());
            transition = table.lookup(step.kind(), record.state(), seen.event());
            updated = execute(step, record, transition, seen, records, submitted);
        }
        if (updated.isEmpty()) {
            return false;
        }
        long now = clock.millis();
        store.save(updated, new StageStateStore.TransitionEntry(
                layout.unitId(),
                step,
                record.state(),
                seen.event().name(),
                transition.action().name(),
                transition.next(),
                seen.detail(),
                now
        ));
        boolean stateChanged = false;
        for (StageRecord next : updated) {
            StageRecord previous = records.put(next.step(), next);
            if (previous == null || previous.state() != next.state()) {
                stateChanged = true;
            }
        }
        log.info("{} {}: {} --{}/{}--> {}", layout.unitId(), step, record.state(), seen.event(),
                transition.action(), transition.next());
        return stateChanged;
    }

    private List<StageRecord> execute(
            PipelineStep step,
            StageRecord record,
            Transition transition,
            Observation seen,
            Map<PipelineStep, StageRecord> records,
            Set<PipelineStep> submitted
    ) {
        long now = clock.millis();
        StageState next = transition.next();
        switch (transition.action()) {
            case NONE:
                return List.of(record.withState(next, now));
            case SUBMIT: {
                Optional<PreparedJob> job = preparer.prepare(step, variantFor(step, record));
                if (job.isEmpty()) {
                    log.debug("{} {}: inputs not ready", layout.unitId(), step);
                    return List.of();
                }
                SubmissionHandle handle = adapter.submit(job.get());
                submitted.add(step);
                return List.of(record.withState(next, now).withJobId(handle.jobId(), now));
            }
            case ACCEPT: {
                if (step.kind() != StepKind.OVERLAP) {
                    return List.of(record.withState(next, now));
                }
                String selected = seen.selectedFile();
                if (!probe.selectionMarker(step).map(selected::equals).orElse(false)) {
                    workspace.recordSelection(step.stage(), selected);
                }
                return List.of(record.withSelectedArtifact(selected, now).withState(next, now));
            }
            case MARK_FATAL:
                fatalLog.append(seen.detail());
                log.error("{} {}: {}", layout.unitId(), step, seen.detail());
                return List.of(record.withState(next, now));
            case REOPTIMIZE_STRICT: {
                PipelineStep optimization = step.optimizationStep();
                workspace.discardGeometry(step.geometry());
                StageRecord opt = records.get(optimization)
                        .withRetryUsed(now)
                        .withState(StageState.NOT_STARTED, now)
                        .withJobId(null, now);
                return List.of(opt, record.withState(next, now).withJobId(null, now));
            }
            case RESUBMIT_CARTESIAN: {
                workspace.discardOverlapAttempt(step.stage());
                PreparedJob job = preparer.prepare(step, JobVariant.CARTESIAN_COORDINATES)
                        .orElseThrow(() -> new IllegalStateException("Overlap inputs vanished for " + step));
                SubmissionHandle handle = adapter.submit(job);
                submitted.add(step);
                return List.of(record.withRetryUsed(now).withState(next, now).withJobId(handle.jobId(), now));
            }
            default:
                throw new IllegalStateException("Unhandled action " + transition.action());
        }
    }

    private Observation observe(PipelineStep step, StageRecord record, Map<PipelineStep, StageRecord> records) {
        return switch (record.state()) {
            case NOT_STARTED -> observeIdle(step, records);
            case AWAITING_COMPLETION -> observeRunning(step);
            case VALIDATION_FAILED -> observeRejected(step, record, records);
            default -> throw new IllegalStateException("Nothing to observe for " + step + " in " + record.state());
        };
    }

    private Observation observeIdle(PipelineStep step, Map<PipelineStep, StageRecord> records) {
        if (step.kind() == StepKind.OVERLAP) {
            Optional<String> selected = probe.selectionMarker(step);
            if (selected.isPresent()) {
                return Observation.selected(StageEvent.ACCEPTED_ON_DISK, selected.get());
            }
        }
        if (probe.submissionRecordPresent(step) || probe.completionMarkerPresent(step)) {
            return Observation.of(StageEvent.ALREADY_SUBMITTED);
        }
        return gate.isEligible(step, statesOf(records))
                ? Observation.of(StageEvent.GATE_OPEN)
                : Observation.of(StageEvent.GATE_CLOSED);
    }

    private Observation observeRunning(PipelineStep step) {
        boolean complete = probe.completionMarkerPresent(step);
        if (step.kind() == StepKind.OVERLAP) {
            Optional<String> selected = probe.selectionMarker(step);
            if (selected.isPresent()) {
                return Observation.selected(StageEvent.ACCEPTED_ON_DISK, selected.get());
            }
            if (!complete) {
                FailureSignature signature = probe.errorSignature(step);
                if (signature == FailureSignature.COORDINATE) {
                    return Observation.detailed(StageEvent.DIAGNOSABLE_ERROR,
                            "Internal coordinate error in " + layout.overlapErrorLog(step.stage()));
                }
                if (signature == FailureSignature.CRASH) {
                    return Observation.detailed(StageEvent.JOB_CRASHED,
                            "MOMAP overlap job crashed, see " + layout.overlapErrorLog(step.stage()));
                }
            }
        }
        if (!complete) {
            return probe.submissionRecordPresent(step)
                    ? Observation.of(StageEvent.JOB_PENDING)
                    : Observation.of(StageEvent.GATE_OPEN);
        }
        if (probe.abnormalTermination(step)) {
            return Observation.detailed(StageEvent.ABNORMAL_TERMINATION,
                    "Abnormal termination in " + step.stage().dirName() + ": " + primaryOutput(step));
        }
        if (step.kind() == StepKind.OVERLAP) {
            OverlapVerdict verdict = probe.overlapVerdict(step);
            return switch (verdict.outcome()) {
                case ACCEPTED -> new Observation(StageEvent.VALIDATION_PASSED, verdict.detail(), verdict.selectedFile());
                case THRESHOLD_EXCEEDED -> Observation.detailed(StageEvent.THRESHOLD_EXCEEDED,
                        step.stage().dirName() + ": " + verdict.detail());
                case NO_CANDIDATE -> Observation.detailed(StageEvent.VALIDATION_REJECTED,
                        step.stage().dirName() + ": " + verdict.detail());
            };
        }
        if (probe.unacceptableResult(step)) {
            return Observation.detailed(StageEvent.VALIDATION_REJECTED,
                    "Imaginary frequency in " + primaryOutput(step));
        }
        return Observation.of(StageEvent.VALIDATION_PASSED);
    }

    private Observation observeRejected(PipelineStep step, StageRecord record, Map<PipelineStep, StageRecord> records) {
        if (step.kind() == StepKind.FREQUENCY) {
            if (records.get(step.optimizationStep()).retryUsed()) {
                return Observation.detailed(StageEvent.RETRY_EXHAUSTED,
                        "Imaginary frequency persists after opt=calcall retry: " + primaryOutput(step));
            }
            double hours = probe.elapsedHours(step);
            double budgetHours = settings.retryTimeBudgetMs() / 3_600_000.0;
            // A run that used up the whole budget gets no retry.
            if (hours >= budgetHours) {
                return Observation.detailed(StageEvent.BUDGET_EXCEEDED, String.format(Locale.ROOT,
                        "Imaginary frequency in %s and the rejected run took %.1f h, reaching the %.1f h retry budget",
                        primaryOutput(step), hours, budgetHours));
            }
            return Observation.of(StageEvent.RETRY_AVAILABLE);
        }
        if (record.retryUsed()) {
            return Observation.detailed(StageEvent.RETRY_EXHAUSTED,
                    "Internal coordinate error persists after Cartesian retry in " + step.stage().dirName());
        }
        return Observation.of(StageEvent.RETRY_AVAILABLE);
    }

    /**
     * Steps without a stored row start NOT_STARTED; retry markers found on disk carry over.
     */
    private Map<PipelineStep, StageRecord> reconcile(Map<PipelineStep, StageRecord> loaded) {
        long now = clock.millis();
        Map<PipelineStep, StageRecord> out = new EnumMap<>(PipelineStep.class);
        List<StageRecord> created = new ArrayList<>();
        for (PipelineStep step : PipelineStep.values()) {
            StageRecord record = loaded.get(step);
            if (record == null) {
                record = StageRecord.initial(layout.unitId(), step, now);
                boolean ownsRetryMarker = step.kind() == StepKind.OPTIMIZATION || step.kind() == StepKind.OVERLAP;
                if (ownsRetryMarker && probe.retryMarkerPresent(step)) {
                    record = record.withRetryUsed(now);
                }
                created.add(record);
            }
            out.put(step, record);
        }
        if (!created.isEmpty()) {
            store.save(created, null);
        }
        return out;
    }

    private JobVariant variantFor(PipelineStep step, StageRecord record) {
        if (!record.retryUsed()) {
            return JobVariant.STANDARD;
        }
        return switch (step.kind()) {
            case OPTIMIZATION -> JobVariant.STRICT_CONVERGENCE;
            case OVERLAP -> JobVariant.CARTESIAN_COORDINATES;
            default -> JobVariant.STANDARD;
        };
    }

    private Path primaryOutput(PipelineStep step) {
        return switch (step.kind()) {
            case OPTIMIZATION, FREQUENCY -> layout.gaussianLog(step.stage());
            case COUPLING -> layout.orcaOutput();
            case OVERLAP -> layout.overlapErrorLog(step.stage());
            case RATE -> layout.rateLog(step.stage());
        };
    }

    private static Map<PipelineStep, StageState> statesOf(Map<PipelineStep, StageRecord> records) {
        Map<PipelineStep, StageState> out = new EnumMap<>(PipelineStep.class);
        records.forEach((step, record) -> out.put(step, record.state()));
        return out;
    }

    private record Observation(StageEvent event, String detail, String selectedFile) {
        static Observation of(StageEvent event) {
            return new Observation(event, null, null);
        }

        static Observation detailed(StageEvent event, String detail) {
            return new Observation(event, detail, null);
        }

        static Observation selected(StageEvent event, String file) {
            return new Observation(event, "selected " + file, file);
        }
    }
}

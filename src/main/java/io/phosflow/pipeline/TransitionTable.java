package io.phosflow.pipeline;

import io.phosflow.model.StageState;
import io.phosflow.model.StepKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@code (step kind, state, event) -> (action, next state)} for every step of a unit.
 *
 * <p>Rows shared by all kinds cover submission and completion. Frequency steps add the
 * imaginary-mode retry, overlap phases add the threshold gate and the coordinate retry.
 * A pair without a row is a programming error and throws.
 */
public final class TransitionTable {
    private static final TransitionTable STANDARD = buildStandard();

    private final Map<StepKind, Map<Key, Transition>> rows;

    private TransitionTable(Map<StepKind, Map<Key, Transition>> rows) {
        this.rows = rows;
    }

    public static TransitionTable standard() {
        return STANDARD;
    }

    public Transition lookup(StepKind kind, StageState state, StageEvent event) {
        Transition transition = find(kind, state, event).orElse(null);
        if (transition == null) {
            throw new IllegalStateException("No transition for " + kind + " in " + state + " on " + event);
        }
        return transition;
    }

    public Optional<Transition> find(StepKind kind, StageState state, StageEvent event) {
        Map<Key, Transition> forKind = rows.get(kind);
        if (forKind == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(forKind.get(new Key(state, event)));
    }

    public int size() {
        int total = 0;
        for (Map<Key, Transition> forKind : rows.values()) {
            total += forKind.size();
        }
        return total;
    }

    private static TransitionTable buildStandard() {
        Map<StepKind, Map<Key, Transition>> rows = new EnumMap<>(StepKind.class);
        for (StepKind kind : StepKind.values()) {
            Map<Key, Transition> forKind = new HashMap<>();
            put(forKind, StageState.NOT_STARTED, StageEvent.GATE_CLOSED, StageAction.NONE, StageState.NOT_STARTED);
            put(forKind, StageState.NOT_STARTED, StageEvent.GATE_OPEN, StageAction.SUBMIT, StageState.AWAITING_COMPLETION);
            put(forKind, StageState.NOT_STARTED, StageEvent.ALREADY_SUBMITTED, StageAction.NONE, StageState.AWAITING_COMPLETION);
            put(forKind, StageState.AWAITING_COMPLETION, StageEvent.JOB_PENDING, StageAction.NONE, StageState.AWAITING_COMPLETION);
            // Submission record lost while waiting: submit again.
            put(forKind, StageState.AWAITING_COMPLETION, StageEvent.GATE_OPEN, StageAction.SUBMIT, StageState.AWAITING_COMPLETION);
            put(forKind, StageState.AWAITING_COMPLETION, StageEvent.ABNORMAL_TERMINATION, StageAction.MARK_FATAL, StageState.FATAL);
            put(forKind, StageState.AWAITING_COMPLETION, StageEvent.VALIDATION_PASSED, StageAction.ACCEPT, StageState.READY);
            // Upstream artifact present but unreadable while preparing a submission.
            put(forKind, StageState.NOT_STARTED, StageEvent.INPUT_UNUSABLE, StageAction.MARK_FATAL, StageState.FATAL);
            put(forKind, StageState.AWAITING_COMPLETION, StageEvent.INPUT_UNUSABLE, StageAction.MARK_FATAL, StageState.FATAL);
            rows.put(kind, forKind);
        }

        Map<Key, Transition> frequency = rows.get(StepKind.FREQUENCY);
        put(frequency, StageState.AWAITING_COMPLETION, StageEvent.VALIDATION_REJECTED, StageAction.NONE, StageState.VALIDATION_FAILED);
        put(frequency, StageState.VALIDATION_FAILED, StageEvent.RETRY_AVAILABLE, StageAction.REOPTIMIZE_STRICT, StageState.NOT_STARTED);
        put(frequency, StageState.VALIDATION_FAILED, StageEvent.RETRY_EXHAUSTED, StageAction.MARK_FATAL, StageState.FATAL);
        put(frequency, StageState.VALIDATION_FAILED, StageEvent.BUDGET_EXCEEDED, StageAction.MARK_FATAL, StageState.FATAL);

        Map<Key, Transition> overlap = rows.get(StepKind.OVERLAP);
        put(overlap, StageState.NOT_STARTED, StageEvent.ACCEPTED_ON_DISK, StageAction.ACCEPT, StageState.READY);
        put(overlap, StageState.AWAITING_COMPLETION, StageEvent.ACCEPTED_ON_DISK, StageAction.ACCEPT, StageState.READY);
        put(overlap, StageState.AWAITING_COMPLETION, StageEvent.THRESHOLD_EXCEEDED, StageAction.MARK_FATAL, StageState.FATAL);
        put(overlap, StageState.AWAITING_COMPLETION, StageEvent.VALIDATION_REJECTED, StageAction.MARK_FATAL, StageState.FATAL);
        put(overlap, StageState.AWAITING_COMPLETION, StageEvent.JOB_CRASHED, StageAction.MARK_FATAL, StageState.FATAL);
        put(overlap, StageState.AWAITING_COMPLETION, StageEvent.DIAGNOSABLE_ERROR, StageAction.NONE, StageState.VALIDATION_FAILED);
        put(overlap, StageState.VALIDATION_FAILED, StageEvent.RETRY_AVAILABLE, StageAction.RESUBMIT_CARTESIAN, StageState.AWAITING_COMPLETION);
        put(overlap, StageState.VALIDATION_FAILED, StageEvent.RETRY_EXHAUSTED, StageAction.MARK_FATAL, StageState.FATAL);
        put(overlap, StageState.VALIDATION_FAILED, StageEvent.INPUT_UNUSABLE, StageAction.MARK_FATAL, StageState.FATAL);

        Map<StepKind, Map<Key, Transition>> frozen = new EnumMap<>(StepKind.class);
        rows.forEach((kind, forKind) -> frozen.put(kind, Collections.unmodifiableMap(forKind)));
        return new TransitionTable(Collections.unmodifiableMap(frozen));
    }

    private static void put(Map<Key, Transition> rows, StageState state, StageEvent event, StageAction action, StageState next) {
        rows.put(new Key(state, event), new Transition(action, next));
    }

    private record Key(StageState state, StageEvent event) {
    }
}

package io.phosflow.pipeline;

import io.phosflow.model.StageState;

public record Transition(StageAction action, StageState next) {
}

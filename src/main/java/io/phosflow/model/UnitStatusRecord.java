package io.phosflow.model;

import java.time.LocalDateTime;

/**
 * One row of the status report. {@code startTime} is null until the unit is first admitted.
 */
public record UnitStatusRecord(
        String name,
        UnitStatus status,
        String currentStage,
        LocalDateTime lastUpdated,
        String remark,
        LocalDateTime startTime
) {
    public static final String STAGE_INIT = "Init";
    public static final String STAGE_FINISHED = "Finished";

    public static UnitStatusRecord discovered(String name, LocalDateTime now) {
        return new UnitStatusRecord(name, UnitStatus.PENDING, STAGE_INIT, now, "Newly added", null);
    }

    public UnitStatusRecord withStatus(UnitStatus next) {
        return new UnitStatusRecord(name, next, currentStage, lastUpdated, remark, startTime);
    }

    public UnitStatusRecord withStage(String next) {
        return new UnitStatusRecord(name, status, next, lastUpdated, remark, startTime);
    }

    public UnitStatusRecord withRemark(String next) {
        return new UnitStatusRecord(name, status, currentStage, lastUpdated, next, startTime);
    }

    public UnitStatusRecord touchedAt(LocalDateTime when) {
        return new UnitStatusRecord(name, status, currentStage, when, remark, startTime);
    }

    public UnitStatusRecord startedAt(LocalDateTime when) {
        return new UnitStatusRecord(name, status, currentStage, lastUpdated, remark, when);
    }
}

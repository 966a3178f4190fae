package io.phosflow.analysis;

import io.phosflow.model.UnitLayout;

/**
 * Produces the final report of a unit whose three rate steps are READY.
 */
@FunctionalInterface
public interface ReportGenerator {
    void writeReport(UnitLayout layout);
}

package io.phosflow.pipeline;

@FunctionalInterface
public interface UnitPipelineFactory {
    UnitPipeline forUnit(String unitId);
}

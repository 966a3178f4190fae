package io.phosflow.config;

import io.phosflow.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

final class PipelineSettingsTest {

    @Test
    void fileValuesAreClampedAndMissingKeysKeepDefaults() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-settings-file-");
        try {
            PhosFlowConfig config = PhosFlowConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), """
                    {
                      "maxConcurrent": 0,
                      "pollIntervalMs": 5,
                      "webhookUrl": "  https://open.feishu.cn/open-apis/bot/v2/hook/abc  ",
                      "reorganizationThreshold": 4200.5,
                      "unknownKey": true
                    }
                    """);
            PipelineSettings settings = PipelineSettings.load(config, Map.of());
            Assertions.assertEquals(1, settings.maxConcurrent());
            Assertions.assertEquals(1_000L, settings.pollIntervalMs());
            Assertions.assertEquals("https://open.feishu.cn/open-apis/bot/v2/hook/abc", settings.webhookUrl());
            Assertions.assertEquals(4200.5, settings.reorganizationThreshold(), 0.0);
            Assertions.assertEquals(PipelineSettings.DEFAULT_STALL_TIMEOUT_MS, settings.stallTimeoutMs());
            Assertions.assertEquals(PipelineSettings.DEFAULT_TEMPERATURE_K, settings.temperatureK(), 0.0);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void environmentThenRunOverridesWin() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-settings-env-");
        try {
            PhosFlowConfig config = PhosFlowConfig.fromRoot(root.toString());
            PipelineSettings settings = PipelineSettings.load(config, Map.of(
                    "PHOSFLOW_MAX_CONCURRENT", "4",
                    "PHOSFLOW_POLL_INTERVAL_S", "30",
                    "PHOSFLOW_STALL_TIMEOUT_H", "12",
                    "PHOSFLOW_AUTO_EXIT", "yes"
            ));
            Assertions.assertEquals(4, settings.maxConcurrent());
            Assertions.assertEquals(30_000L, settings.pollIntervalMs());
            Assertions.assertEquals(12L * 3_600_000L, settings.stallTimeoutMs());
            Assertions.assertTrue(settings.autoExit());

            PipelineSettings run = settings.withRunOverrides(2, 60L, false, 5);
            Assertions.assertEquals(2, run.maxConcurrent());
            Assertions.assertEquals(60_000L, run.pollIntervalMs());
            Assertions.assertFalse(run.autoExit());
            Assertions.assertEquals(5, run.idleCycleThreshold());
            Assertions.assertEquals(settings.stallTimeoutMs(), run.stallTimeoutMs());

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> PipelineSettings.load(config, Map.of("PHOSFLOW_IDLE_CYCLES", "three")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void writtenDefaultsReadBackUnchanged() throws Exception {
        Path root = Files.createTempDirectory("phosflow-test-settings-roundtrip-");
        try {
            PhosFlowConfig config = PhosFlowConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), Jsons.toJson(PipelineSettings.defaults().toFile()));
            Assertions.assertEquals(PipelineSettings.defaults(), PipelineSettings.load(config, Map.of()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void configResolvesRelativeDirectoriesAgainstRoot() {
        PhosFlowConfig config = PhosFlowConfig.fromRoot("/data/batch")
                .withSourceDir("inputs")
                .withResultsDir("out")
                .withStatusFile("report.csv")
                .withSourceDir(" ");
        Assertions.assertEquals(Path.of("/data/batch/inputs/mol1.xyz"), config.sourceFile("mol1"));
        Assertions.assertEquals(Path.of("/data/batch/out/mol1"), config.unitDir("mol1"));
        Assertions.assertEquals(Path.of("/data/batch/report.csv"), config.statusFile());
        Assertions.assertEquals(Path.of("/data/batch/phosflow-settings.json"), config.settingsFile());
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

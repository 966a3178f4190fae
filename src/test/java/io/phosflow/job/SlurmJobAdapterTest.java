package io.phosflow.job;

import io.phosflow.config.PipelineSettings;
import io.phosflow.model.Stage;
import io.phosflow.model.UnitLayout;
import io.phosflow.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

final class SlurmJobAdapterTest {

    @Test
    void acceptedSubmissionKeepsScript() throws Exception {
        Assumptions.assumeTrue(Files.isExecutable(Path.of("/bin/echo")));
        Path root = Files.createTempDirectory("phosflow-test-slurm-ok-");
        try {
            SlurmJobAdapter adapter = new SlurmJobAdapter(withSubmitCommand("/bin/echo Submitted batch job 4242"));
            PreparedJob job = new PreparedJob(Stage.S0_OPT, JobKind.GAUSSIAN, "mol1_s0_opt", root, "mol1_s0_opt.gjf", JobVariant.STANDARD);

            SubmissionHandle handle = adapter.submit(job);
            Assertions.assertEquals("4242", handle.jobId());
            String script = Files.readString(root.resolve(UnitLayout.SUBMISSION_RECORD));
            Assertions.assertTrue(script.contains("#SBATCH --job-name=\"mol1_s0_opt\""));
            Assertions.assertTrue(script.contains("export jobname=\"mol1_s0_opt.gjf\""));
            Assertions.assertTrue(script.contains("touch \"$SLURM_SUBMIT_DIR/job.done\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectedSubmissionRemovesScript() throws Exception {
        Assumptions.assumeTrue(Files.isExecutable(Path.of("/bin/false")));
        Path root = Files.createTempDirectory("phosflow-test-slurm-fail-");
        try {
            SlurmJobAdapter adapter = new SlurmJobAdapter(withSubmitCommand("/bin/false"));
            PreparedJob job = new PreparedJob(Stage.KR, JobKind.MOMAP, "mol1_kr", root, "momap.inp", JobVariant.STANDARD);

            JobSubmissionException error = Assertions.assertThrows(JobSubmissionException.class, () -> adapter.submit(job));
            Assertions.assertTrue(error.getMessage().contains("exit=1"));
            Assertions.assertFalse(Files.exists(root.resolve(UnitLayout.SUBMISSION_RECORD)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingSubmitCommandIsRejectedUpFront() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new SlurmJobAdapter(withSubmitCommand(" ")));
    }

    private static PipelineSettings withSubmitCommand(String command) throws IOException {
        PipelineSettings.SettingsFile file = Jsons.mapper().readValue(
                Jsons.toJson(Map.of("submitCommand", command)), PipelineSettings.SettingsFile.class);
        return PipelineSettings.fromFile(file, PipelineSettings.defaults());
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

package io.phosflow.job;

import io.phosflow.config.PipelineSettings;
import io.phosflow.model.UnitLayout;
import io.phosflow.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes {@code run.slurm} into the stage directory and runs the submit command there.
 *
 * <p>If the scheduler refuses the job the script is removed again, so the missing submission
 * record lets the next cycle retry instead of waiting on a job that does not exist.
 */
public final class SlurmJobAdapter implements ExternalJobAdapter {
    private static final Logger log = LoggerFactory.getLogger(SlurmJobAdapter.class);
    private static final int MAX_ERROR_CHARS = 512;
    private static final Pattern JOB_ID = Pattern.compile("Submitted batch job\\s+(\\d+)");

    private final PipelineSettings settings;
    private final List<String> submitCommand;
    private final long timeoutMs;

    public SlurmJobAdapter(PipelineSettings settings) {
        this.settings = settings;
        String raw = settings.submitCommand();
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("submit command cannot be empty");
        }
        this.submitCommand = List.of(raw.trim().split("\\s+"));
        this.timeoutMs = Math.max(1_000L, settings.submitTimeoutMs());
    }

    @Override
    public SubmissionHandle submit(PreparedJob job) {
        Path script = job.workDir().resolve(UnitLayout.SUBMISSION_RECORD);
        try {
            Files.createDirectories(job.workDir());
            Files.writeString(script, JobScripts.render(job, settings), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new JobSubmissionException("Failed to write job script: " + script, e);
        }

        List<String> command = new ArrayList<>(submitCommand);
        command.add(UnitLayout.SUBMISSION_RECORD);
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(job.workDir().toFile());
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            discard(script);
            throw new JobSubmissionException("Submit command spawn failed for " + job.jobName() + ": " + e.getMessage(), e);
        }

        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                discard(script);
                throw new JobSubmissionException("Submit command timeout after " + Duration.ofMillis(timeoutMs)
                        + " for " + job.jobName());
            }
            String combined = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                discard(script);
                throw new JobSubmissionException("Submit command exit=" + process.exitValue()
                        + " for " + job.jobName() + " output=" + Texts.singleLine(combined, MAX_ERROR_CHARS));
            }
            Matcher m = JOB_ID.matcher(combined);
            String jobId = m.find() ? m.group(1) : "";
            log.info("Submitted {} ({}) from {}", job.jobName(), jobId.isEmpty() ? "no id" : "job " + jobId, job.workDir());
            return new SubmissionHandle(jobId, script);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            discard(script);
            throw new JobSubmissionException("Interrupted while submitting " + job.jobName(), e);
        } catch (IOException e) {
            process.destroyForcibly();
            discard(script);
            throw new JobSubmissionException("Submit command failed for " + job.jobName() + ": " + e.getMessage(), e);
        }
    }

    private static void discard(Path script) {
        try {
            Files.deleteIfExists(script);
        } catch (IOException e) {
            log.warn("Could not remove rejected job script {}: {}", script, e.getMessage());
        }
    }
}

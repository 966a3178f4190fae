package io.phosflow.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.phosflow.batch.CancellationToken;
import io.phosflow.batch.CycleOutcome;
import io.phosflow.batch.CycleRunner;
import io.phosflow.batch.FixedIntervalTickSource;
import io.phosflow.config.PhosFlowConfig;
import io.phosflow.config.PipelineSettings;
import io.phosflow.observability.SensitiveDataMasker;
import io.phosflow.pipeline.AdvanceResult;
import io.phosflow.runtime.PhosFlowRuntime;
import io.phosflow.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "phosflow",
        mixinStandardHelpOptions = true,
        description = "Batch controller for phosphorescence yield pipelines on a Slurm cluster",
        subcommands = {
                PhosFlowCommand.InitCommand.class,
                PhosFlowCommand.RunCommand.class,
                PhosFlowCommand.CycleCommand.class,
                PhosFlowCommand.StatusCommand.class,
                PhosFlowCommand.UnitCommand.class,
                PhosFlowCommand.AdvanceCommand.class,
                PhosFlowCommand.SettingsCommand.class,
                PhosFlowCommand.AuditTailCommand.class,
                PhosFlowCommand.AuditVerifyCommand.class
        }
)
public final class PhosFlowCommand implements Runnable {
    @Option(names = {"--root"}, description = "Deployment root directory", defaultValue = ".")
    String root;

    @Option(names = {"--source-dir"}, description = "Source structure directory, relative to root")
    String sourceDir;

    @Option(names = {"--results-dir"}, description = "Results directory, relative to root")
    String resultsDir;

    @Option(names = {"--status-file"}, description = "Status report CSV, relative to root")
    String statusFile;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | cycle | status | unit | advance | settings | audit-tail | audit-verify");
    }

    PhosFlowConfig config() {
        return PhosFlowConfig.fromRoot(root)
                .withSourceDir(sourceDir)
                .withResultsDir(resultsDir)
                .withStatusFile(statusFile);
    }

    PipelineSettings settings(PhosFlowConfig config) {
        return PipelineSettings.load(config, System.getenv());
    }

    PhosFlowRuntime runtime() {
        PhosFlowConfig config = config();
        return new PhosFlowRuntime(config, settings(config));
    }

    @Command(name = "init", description = "Create directories, the SQLite schema and a default settings file")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        PhosFlowCommand parent;

        @Override
        public Integer call() {
            PhosFlowRuntime runtime = parent.runtime();
            runtime.init();
            boolean wrote = runtime.writeDefaultSettings();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("root", runtime.config().rootDir().toString());
            out.put("sourceDir", runtime.config().sourceDir().toString());
            out.put("resultsDir", runtime.config().resultsDir().toString());
            out.put("settingsWritten", wrote);
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "run", description = "Run controller cycles until auto-exit or interrupt")
    static final class RunCommand implements Callable<Integer> {
        private static final long GRACEFUL_SHUTDOWN_MS = 15_000L;

        @ParentCommand
        PhosFlowCommand parent;

        @Option(names = {"--max-concurrent"}, description = "Maximum number of active units")
        Integer maxConcurrent;

        @Option(names = {"--interval-s"}, description = "Seconds between cycles")
        Long intervalSeconds;

        @Option(names = {"--auto-exit"}, negatable = true, description = "Exit after consecutive idle cycles")
        Boolean autoExit;

        @Option(names = {"--idle-cycles"}, description = "Idle cycles before auto-exit")
        Integer idleCycles;

        @Override
        public Integer call() throws Exception {
            PhosFlowConfig config = parent.config();
            PipelineSettings settings = parent.settings(config)
                    .withRunOverrides(maxConcurrent, intervalSeconds, autoExit, idleCycles);
            PhosFlowRuntime runtime = new PhosFlowRuntime(config, settings);
            runtime.init();

            CancellationToken token = new CancellationToken();
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                token.cancel();
                try {
                    stopped.await(GRACEFUL_SHUTDOWN_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }, "phosflow-shutdown-hook"));

            CycleRunner runner = new CycleRunner(
                    runtime.controller(),
                    new FixedIntervalTickSource(settings.pollIntervalMs()),
                    outcome -> System.out.println(Jsons.toCompactJson(outcome))
            );
            try {
                runner.run(token);
            } finally {
                stopped.countDown();
            }
            return 0;
        }
    }

    @Command(name = "cycle", description = "Run exactly one controller cycle")
    static final class CycleCommand implements Callable<Integer> {
        @ParentCommand
        PhosFlowCommand parent;

        @Override
        public Integer call() {
            PhosFlowRuntime runtime = parent.runtime();
            runtime.init();
            CycleOutcome outcome = runtime.runCycle();
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "status", description = "Show the status report")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        PhosFlowCommand parent;

        @Override
        public Integer call() {
            PhosFlowRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.status()));
            return 0;
        }
    }

    @Command(name = "unit", description = "Show step states and recent transitions of one unit")
    static final class UnitCommand implements Callable<Integer> {
        @ParentCommand
        PhosFlowCommand parent;

        @Option(names = {"--unit"}, required = true, description = "Unit id (source file stem)")
        String unitId;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Transitions to show")
        int limit;

        @Override
        public Integer call() {
            PhosFlowRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.unitDetail(unitId, limit)));
            return 0;
        }
    }

    @Command(name = "advance", description = "Advance one unit's pipeline without touching the status report")
    static final class AdvanceCommand implements Callable<Integer> {
        @ParentCommand
        PhosFlowCommand parent;

        @Option(names = {"--unit"}, required = true, description = "Unit id (source file stem)")
        String unitId;

        @Override
        public Integer call() {
            PhosFlowRuntime runtime = parent.runtime();
            runtime.init();
            AdvanceResult result = runtime.advanceUnit(unitId);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("unit", unitId);
            out.put("stage", result.stageLabel());
            out.put("fatal", result.fatal());
            out.put("submissions", result.submissions());
            System.out.println(Jsons.toJson(out));
            return result.fatal() ? 2 : 0;
        }
    }

    @Command(name = "settings", description = "Show effective settings with secrets masked")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        PhosFlowCommand parent;

        @Override
        public Integer call() {
            PhosFlowConfig config = parent.config();
            JsonNode node = Jsons.mapper().valueToTree(parent.settings(config));
            System.out.println(Jsons.toJson(SensitiveDataMasker.masked(node)));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show the latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        PhosFlowCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Rows to show")
        int limit;

        @Override
        public Integer call() {
            PhosFlowRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.audit().tail(limit)));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        PhosFlowCommand parent;

        @Override
        public Integer call() {
            PhosFlowRuntime runtime = parent.runtime();
            runtime.init();
            int broken = runtime.audit().verify();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("valid", broken == 0);
            out.put("firstBrokenRow", broken);
            System.out.println(Jsons.toJson(out));
            return broken == 0 ? 0 : 1;
        }
    }
}

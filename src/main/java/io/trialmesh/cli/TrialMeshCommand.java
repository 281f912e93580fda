package io.trialmesh.cli;

import io.trialmesh.config.TrialMeshConfig;
import io.trialmesh.dispatch.DispatchSummary;
import io.trialmesh.model.RunStatus;
import io.trialmesh.runtime.TrialMeshRuntime;
import io.trialmesh.storage.Database;
import io.trialmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
        name = "trialmesh",
        mixinStandardHelpOptions = true,
        description = "TrialMesh Monte Carlo trial orchestration CLI",
        subcommands = {
                TrialMeshCommand.InitCommand.class,
                TrialMeshCommand.NewSimCommand.class,
                TrialMeshCommand.ResumeInputsCommand.class,
                TrialMeshCommand.SimulationsCommand.class,
                TrialMeshCommand.ScheduleCommand.class,
                TrialMeshCommand.RunCommand.class,
                TrialMeshCommand.WorkerCommand.class,
                TrialMeshCommand.StatusCommand.class,
                TrialMeshCommand.RunsCommand.class,
                TrialMeshCommand.CancelCommand.class,
                TrialMeshCommand.RequeueCommand.class,
                TrialMeshCommand.CollectCommand.class,
                TrialMeshCommand.ResultsCommand.class,
                TrialMeshCommand.ParamsCommand.class,
                TrialMeshCommand.AuditVerifyCommand.class,
                TrialMeshCommand.SchemaMigrationsCommand.class
        }
)
public final class TrialMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--project"}, description = "Project name (sandbox scope)", defaultValue = TrialMeshConfig.DEFAULT_PROJECT)
    String project;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | new-sim | resume-inputs | simulations | schedule | run | worker | status | runs | cancel | requeue | collect | results | params | audit-verify | schema-migrations");
    }

    TrialMeshConfig config() {
        return TrialMeshConfig.fromRoot(root, project);
    }

    TrialMeshRuntime runtime() {
        TrialMeshRuntime runtime = new TrialMeshRuntime(config());
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                System.out.println("Initialized TrialMesh at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "new-sim", description = "Create a simulation from a JSON definition and write its input values")
    static final class NewSimCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Parameters(index = "0", description = "Simulation definition file")
        Path definition;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.createSimulation(definition)));
            }
            return 0;
        }
    }

    @Command(name = "resume-inputs", description = "Write any input values missing after an interrupted creation")
    static final class ResumeInputsCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Parameters(index = "0", description = "Simulation name or id")
        String simulation;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(Map.of("inserted", runtime.resumeInputs(simulation))));
            }
            return 0;
        }
    }

    @Command(name = "simulations", description = "List simulations")
    static final class SimulationsCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.simulations()));
            }
            return 0;
        }
    }

    @Command(name = "schedule", description = "Create PENDING runs without dispatching them")
    static final class ScheduleCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Parameters(index = "0", description = "Simulation name or id")
        String simulation;

        @Option(names = {"--trials"}, description = "Trial numbers, e.g. 0-9,15 (default: all)")
        String trials;

        @Option(names = {"--experiments"}, split = ",", description = "Experiments to run (baseline is always included)")
        List<String> experiments;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.schedule(simulation, experiments, trials)));
            }
            return 0;
        }
    }

    @Command(name = "run", description = "Schedule runs and dispatch them until none is active")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Parameters(index = "0", description = "Simulation name or id")
        String simulation;

        @Option(names = {"--trials"}, description = "Trial numbers, e.g. 0-9,15 (default: all)")
        String trials;

        @Option(names = {"--experiments"}, split = ",", description = "Experiments to run (baseline is always included)")
        List<String> experiments;

        @Option(names = {"--workers"}, description = "Override the maximum worker count")
        Integer workers;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                if (workers != null) {
                    runtime.overrideSettings(runtime.settings().withMaxWorkers(workers));
                }
                runtime.schedule(simulation, experiments, trials);
                DispatchSummary summary = runtime.run(simulation);
                System.out.println(Jsons.toJson(summary));
                return summary.failures().isEmpty() ? 0 : 1;
            }
        }
    }

    @Command(name = "worker", description = "Execute runs of a simulation in this process until none is claimable")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Parameters(index = "0", description = "Simulation name or id")
        String simulation;

        @Option(names = {"--worker-id"}, required = true, description = "Worker id recorded on claimed runs")
        String workerId;

        @Option(names = {"--job-id"}, description = "Cluster job id recorded on started runs")
        String jobId;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                int executed = runtime.runWorker(simulation, workerId, jobId);
                System.out.println(Jsons.toJson(Map.of("workerId", workerId, "executed", executed)));
            }
            return 0;
        }
    }

    @Command(name = "status", description = "Run counts per experiment and status")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Parameters(index = "0", description = "Simulation name or id")
        String simulation;

        @Option(names = {"--summary"}, description = "Latest-attempt summary with failures")
        boolean summary;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                Object out = summary ? runtime.summary(simulation) : runtime.status(simulation);
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "runs", description = "List run attempts")
    static final class RunsCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Parameters(index = "0", description = "Simulation name or id")
        String simulation;

        @Option(names = {"--status"}, description = "Filter by run status")
        String status;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.runs(simulation, status, limit)));
            }
            return 0;
        }
    }

    @Command(name = "cancel", description = "Abort a simulation's runs and cancel its cluster jobs")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Parameters(index = "0", description = "Simulation name or id")
        String simulation;

        @Option(names = {"--reason"}, description = "Cancellation reason")
        String reason;

        @Option(names = {"--mode"}, defaultValue = "soft", description = "Cancellation mode: hard|soft")
        String mode;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.cancel(simulation, mode, reason)));
            }
            return 0;
        }
    }

    @Command(name = "requeue", description = "Schedule new attempts for units whose latest run ended in a given status")
    static final class RequeueCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Parameters(index = "0", description = "Simulation name or id")
        String simulation;

        @Option(names = {"--status"}, split = ",", defaultValue = "FAILED,ABORTED", description = "Terminal statuses to requeue")
        List<String> statuses;

        @Option(names = {"--trials"}, description = "Trial numbers, e.g. 0-9,15 (default: all)")
        String trials;

        @Override
        public Integer call() {
            Set<RunStatus> parsed = EnumSet.noneOf(RunStatus.class);
            statuses.forEach(s -> parsed.add(RunStatus.fromString(s)));
            try (TrialMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(Map.of("requeued", runtime.requeue(simulation, parsed, trials))));
            }
            return 0;
        }
    }

    @Command(name = "collect", description = "Re-collect results for succeeded runs")
    static final class CollectCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Parameters(index = "0", description = "Simulation name or id")
        String simulation;

        @Option(names = {"--trials"}, description = "Trial numbers, e.g. 0-9,15 (default: all)")
        String trials;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.collect(simulation, trials)));
            }
            return 0;
        }
    }

    @Command(name = "results", description = "Show collected output values")
    static final class ResultsCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Parameters(index = "0", description = "Simulation name or id")
        String simulation;

        @Option(names = {"--name"}, description = "Only this result")
        String name;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.results(simulation, name)));
            }
            return 0;
        }
    }

    @Command(name = "params", description = "Show drawn parameter values")
    static final class ParamsCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Parameters(index = "0", description = "Simulation name or id")
        String simulation;

        @Option(names = {"--trial"}, description = "Only this trial")
        Integer trial;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.parameterValues(simulation, trial)));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Override
        public Integer call() {
            try (TrialMeshRuntime runtime = parent.runtime()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("rows", runtime.verifyAudit());
                out.put("ok", true);
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        TrialMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            Database database = new Database(parent.config());
            database.init();
            System.out.println(Jsons.toJson(database.listSchemaMigrations(limit)));
            return 0;
        }
    }
}

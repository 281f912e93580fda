package io.trialmesh.runtime;

import io.trialmesh.config.ConfigurationException;
import io.trialmesh.config.DispatchSettings;
import io.trialmesh.config.TrialMeshConfig;
import io.trialmesh.dispatch.BatchClusterManager;
import io.trialmesh.dispatch.ClusterManager;
import io.trialmesh.dispatch.ControlTick;
import io.trialmesh.dispatch.DispatchSummary;
import io.trialmesh.dispatch.Dispatcher;
import io.trialmesh.dispatch.JsonTrialInputWriter;
import io.trialmesh.dispatch.LocalClusterManager;
import io.trialmesh.dispatch.ModelRunner;
import io.trialmesh.dispatch.ScriptModelRunner;
import io.trialmesh.dispatch.SimulationPlan;
import io.trialmesh.dispatch.TrialInputWriter;
import io.trialmesh.dispatch.TrialWorker;
import io.trialmesh.model.ExperimentDef;
import io.trialmesh.model.RunStatus;
import io.trialmesh.model.RunView;
import io.trialmesh.model.SimulationView;
import io.trialmesh.observability.AuditLogger;
import io.trialmesh.parameter.ApplyFunctionRegistry;
import io.trialmesh.parameter.CompiledParameters;
import io.trialmesh.parameter.ParameterApplier;
import io.trialmesh.parameter.ParameterCompiler;
import io.trialmesh.parameter.ParameterDef;
import io.trialmesh.parameter.ParameterSet;
import io.trialmesh.result.ResultCollector;
import io.trialmesh.sampling.DistributionSampler;
import io.trialmesh.storage.Database;
import io.trialmesh.storage.SimulationStore;
import io.trialmesh.util.TrialNumbers;
import io.trialmesh.workflow.TrialPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.LongSupplier;

public final class TrialMeshRuntime implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TrialMeshRuntime.class);
    private static final String ACTOR = "runtime";

    private final TrialMeshConfig config;
    private final Database database;
    private final SimulationStore store;
    private final ApplyFunctionRegistry applyFunctions;
    private final ParameterApplier applier;
    private final ParameterCompiler compiler;
    private final TrialPaths paths;
    private final ModelRunner modelRunner;
    private final TrialInputWriter inputWriter;
    private final LongSupplier clock;
    private final AuditLogger auditLogger;
    private final ConcurrentMap<Long, SimulationPlan> plans;
    private final Object dispatchLock;
    private volatile DispatchSettings settings;
    private ClusterManager clusterManager;
    private Dispatcher dispatcher;

    public TrialMeshRuntime(TrialMeshConfig config) {
        this(config, new ScriptModelRunner(), new JsonTrialInputWriter(), System::currentTimeMillis);
    }

    public TrialMeshRuntime(TrialMeshConfig config, ModelRunner modelRunner, TrialInputWriter inputWriter, LongSupplier clock) {
        this.config = config;
        this.database = new Database(config);
        this.store = new SimulationStore(database);
        this.applyFunctions = new ApplyFunctionRegistry();
        this.applier = new ParameterApplier(applyFunctions);
        this.compiler = new ParameterCompiler(new DistributionSampler(), applier);
        this.paths = new TrialPaths(config);
        this.modelRunner = modelRunner;
        this.inputWriter = inputWriter;
        this.clock = clock;
        this.auditLogger = new AuditLogger(config.auditFile(), config.project());
        this.plans = new ConcurrentHashMap<>();
        this.dispatchLock = new Object();
        this.settings = DispatchSettings.defaults();
    }

    public void init() {
        database.init();
        settings = DispatchSettings.load(config.settingsFile());
        try {
            Files.createDirectories(config.sandboxDir());
            Files.createDirectories(config.batchDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize sandbox directories under " + config.rootDir(), e);
        }
        logger.info("TrialMesh initialized at {} (project {}, cluster {})", config.rootDir(), config.project(), settings.clusterManager());
    }

    public TrialMeshConfig config() {
        return config;
    }

    public DispatchSettings settings() {
        return settings;
    }

    /**
     * Replaces the dispatch settings for this process. Must be called before the first
     * dispatch.
     */
    public void overrideSettings(DispatchSettings value) {
        synchronized (dispatchLock) {
            if (dispatcher != null) {
                throw new IllegalStateException("Settings cannot change after dispatch has started");
            }
            this.settings = value;
        }
    }

    public ApplyFunctionRegistry applyFunctions() {
        return applyFunctions;
    }

    public SimulationStore store() {
        return store;
    }

    public CreateOutcome createSimulation(Path definitionFile) {
        return createSimulation(SimulationDefinition.read(definitionFile));
    }

    /**
     * Validates the definition, compiles every input value and persists the simulation in one
     * transaction. Any configuration error surfaces before a row is written.
     */
    public CreateOutcome createSimulation(SimulationDefinition definition) {
        definition.validate();
        List<ExperimentDef> experiments = definition.toExperiments();
        List<ParameterDef> parameters = definition.toParameters();
        CompiledParameters compiled = compile(definition, experiments, parameters);
        SimulationView sim = store.createSimulation(
                new SimulationStore.NewSimulation(
                        definition.name().trim(),
                        definition.trials(),
                        definition.seedOrDefault(),
                        definition.description(),
                        definition.toJson()
                ),
                experiments,
                parameters,
                compiled.rows(),
                clock.getAsLong()
        );
        int inputRows = compiled.rows().size();
        logger.info("Created simulation {} '{}' with {} trials, {} experiments, {} input values",
                sim.simId(), sim.name(), sim.trialCount(), experiments.size(), inputRows);
        audit("simulation.create", sim.simId(), "ok", Map.of("name", sim.name(), "trials", sim.trialCount()));
        return new CreateOutcome(sim, experiments.stream().map(ExperimentDef::name).toList(), inputRows);
    }

    /**
     * Recompiles the stored definition and inserts any input value that is missing. Existing
     * rows are left as they are; the same seed reproduces them exactly.
     */
    public int resumeInputs(String simRef) {
        SimulationView sim = resolveSimulation(simRef);
        SimulationDefinition definition = storedDefinition(sim.simId());
        List<ExperimentDef> experiments = definition.toExperiments();
        CompiledParameters compiled = compile(definition, experiments, definition.toParameters());
        int inserted = store.insertInputValues(sim.simId(), compiled.rows());
        logger.info("Simulation {}: {} missing input values written", sim.simId(), inserted);
        return inserted;
    }

    public SimulationStore.ScheduleOutcome schedule(String simRef, List<String> experiments, String trialSpec) {
        SimulationView sim = resolveSimulation(simRef);
        List<Integer> trials = TrialNumbers.parse(trialSpec, sim.trialCount());
        return dispatcher().schedule(sim.simId(), experiments, trials);
    }

    public int requeue(String simRef, Set<RunStatus> statuses, String trialSpec) {
        SimulationView sim = resolveSimulation(simRef);
        List<Integer> trials = trialSpec == null || trialSpec.isBlank() ? null : TrialNumbers.parse(trialSpec, sim.trialCount());
        return dispatcher().requeue(sim.simId(), statuses, trials);
    }

    public DispatchSummary run(String simRef) {
        SimulationView sim = resolveSimulation(simRef);
        return dispatcher().runToCompletion(sim.simId());
    }

    public ControlOutcome tick(String simRef) {
        SimulationView sim = resolveSimulation(simRef);
        return new ControlOutcome(sim.simId(), dispatcher().tick(sim.simId()));
    }

    /**
     * Runs a worker in this process until the simulation has no claimable work. Used by batch
     * jobs.
     */
    public int runWorker(String simRef, String workerId, String jobId) {
        SimulationView sim = resolveSimulation(simRef);
        TrialWorker worker = newWorker(workerId, jobId);
        int executed = worker.runUntilIdle(sim.simId(), () -> false);
        logger.info("Worker {} executed {} runs of simulation {}", workerId, executed, sim.simId());
        return executed;
    }

    public SimulationStore.CancelResult cancel(String simRef, String modeRaw, String reason) {
        SimulationView sim = resolveSimulation(simRef);
        return dispatcher().cancel(sim.simId(), SimulationStore.CancelMode.fromString(modeRaw), reason);
    }

    public StatusOutcome status(String simRef) {
        SimulationView sim = resolveSimulation(simRef);
        return new StatusOutcome(sim, store.statusSummary(sim.simId()), store.activeCounts(sim.simId()));
    }

    public List<SimulationView> simulations() {
        return store.listSimulations();
    }

    public List<RunView> runs(String simRef, String statusRaw, int limit) {
        SimulationView sim = resolveSimulation(simRef);
        RunStatus status = statusRaw == null || statusRaw.isBlank() ? null : RunStatus.fromString(statusRaw);
        return store.listRuns(sim.simId(), status, limit);
    }

    public DispatchSummary summary(String simRef) {
        SimulationView sim = resolveSimulation(simRef);
        return dispatcher().summarize(sim.simId());
    }

    public List<SimulationStore.ResultRow> results(String simRef, String resultName) {
        SimulationView sim = resolveSimulation(simRef);
        return store.results(sim.simId(), resultName == null || resultName.isBlank() ? null : resultName.trim());
    }

    public List<SimulationStore.ParamRow> parameterValues(String simRef, Integer trialNum) {
        SimulationView sim = resolveSimulation(simRef);
        return store.paramValues(sim.simId(), trialNum);
    }

    /**
     * Re-collects results for the latest succeeded run of each selected trial.
     */
    public List<ResultCollector.CollectionOutcome> collect(String simRef, String trialSpec) {
        SimulationView sim = resolveSimulation(simRef);
        Set<Integer> trials = Set.copyOf(TrialNumbers.parse(trialSpec, sim.trialCount()));
        SimulationPlan plan = plan(sim.simId());
        ResultCollector collector = newCollector();
        List<ResultCollector.CollectionOutcome> out = new ArrayList<>();
        for (RunView run : store.latestRuns(sim.simId())) {
            if (run.status() == RunStatus.SUCCEEDED && trials.contains(run.trialNum())) {
                out.add(collector.collect(run, plan.results()));
            }
        }
        audit("results.collect", sim.simId(), "ok", Map.of("runs", out.size()));
        return out;
    }

    public int verifyAudit() {
        return auditLogger.verifyChain();
    }

    public SimulationView resolveSimulation(String ref) {
        if (ref == null || ref.isBlank()) {
            throw new ConfigurationException("Simulation name or id is required");
        }
        String trimmed = ref.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return store.findSimulation(Long.parseLong(trimmed))
                    .orElseThrow(() -> new ConfigurationException("Unknown simulation id: " + trimmed));
        }
        return store.findSimulationByName(trimmed)
                .orElseThrow(() -> new ConfigurationException("Unknown simulation: " + trimmed));
    }

    public SimulationPlan plan(long simId) {
        return plans.computeIfAbsent(simId, id -> {
            SimulationDefinition definition = storedDefinition(id);
            return new SimulationPlan(
                    id,
                    definition.baselineName(),
                    definition.toParameters(),
                    definition.toStepSet().steps(),
                    definition.toVariables(),
                    definition.toResults(),
                    definition.toSelection(),
                    definition.toBaseValues()
            );
        });
    }

    TrialWorker newWorker(String workerId, String jobId) {
        return new TrialWorker(
                workerId,
                jobId,
                store,
                this::plan,
                modelRunner,
                inputWriter,
                applier,
                newCollector(),
                paths,
                settings,
                auditLogger,
                clock
        );
    }

    @Override
    public void close() {
        synchronized (dispatchLock) {
            if (dispatcher != null) {
                dispatcher.stop();
            }
            if (clusterManager != null) {
                clusterManager.close();
            }
        }
    }

    private Dispatcher dispatcher() {
        synchronized (dispatchLock) {
            if (dispatcher == null) {
                clusterManager = createClusterManager();
                dispatcher = new Dispatcher(store, clusterManager, settings, auditLogger, clock);
            }
            return dispatcher;
        }
    }

    private ClusterManager createClusterManager() {
        if (DispatchSettings.BATCH_CLUSTER.equals(settings.clusterManager())) {
            return new BatchClusterManager(settings.batch(), config.rootDir());
        }
        return new LocalClusterManager(settings.maxWorkers(),
                (jobId, launch, stop) -> () -> newWorker(launch.workerId(), jobId).runUntilIdle(launch.simId(), stop));
    }

    private ResultCollector newCollector() {
        return new ResultCollector(store, paths, settings.startYear(), settings.endYear());
    }

    private CompiledParameters compile(SimulationDefinition definition, List<ExperimentDef> experiments, List<ParameterDef> parameters) {
        return compiler.compile(
                new ParameterSet(parameters, definition.seedOrDefault()),
                experiments.stream().map(ExperimentDef::name).toList(),
                definition.trials()
        );
    }

    private SimulationDefinition storedDefinition(long simId) {
        String json = store.simulationDefinition(simId)
                .orElseThrow(() -> new ConfigurationException("Simulation " + simId + " has no stored definition"));
        return SimulationDefinition.parse(json);
    }

    private void audit(String action, long simId, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(action, ACTOR, "simulation:" + simId, result, simId, null, details));
    }

    public record CreateOutcome(SimulationView simulation, List<String> experiments, int inputValues) {
    }

    public record StatusOutcome(SimulationView simulation, List<SimulationStore.StatusCount> counts, SimulationStore.ActiveCounts active) {
    }

    public record ControlOutcome(long simId, ControlTick tick) {
    }
}

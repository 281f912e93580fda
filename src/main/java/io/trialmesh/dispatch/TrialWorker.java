package io.trialmesh.dispatch;

import io.trialmesh.config.DispatchSettings;
import io.trialmesh.model.RunView;
import io.trialmesh.observability.AuditLogger;
import io.trialmesh.parameter.ParameterApplier;
import io.trialmesh.parameter.ParameterDef;
import io.trialmesh.result.ResultCollector;
import io.trialmesh.storage.SimulationStore;
import io.trialmesh.workflow.RenderedStep;
import io.trialmesh.workflow.TrialPaths;
import io.trialmesh.workflow.VariableEnvironment;
import io.trialmesh.workflow.WorkflowScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

/**
 * Claims runs of one simulation and executes them: realize inputs, render steps, run the
 * model, commit the outcome, collect results.
 */
public final class TrialWorker {
    private static final Logger logger = LoggerFactory.getLogger(TrialWorker.class);

    private final String workerId;
    private final String jobId;
    private final SimulationStore store;
    private final SimulationPlans plans;
    private final ModelRunner runner;
    private final TrialInputWriter inputWriter;
    private final ParameterApplier applier;
    private final WorkflowScheduler scheduler;
    private final ResultCollector collector;
    private final TrialPaths paths;
    private final DispatchSettings settings;
    private final AuditLogger audit;
    private final LongSupplier clock;

    public TrialWorker(
            String workerId,
            String jobId,
            SimulationStore store,
            SimulationPlans plans,
            ModelRunner runner,
            TrialInputWriter inputWriter,
            ParameterApplier applier,
            ResultCollector collector,
            TrialPaths paths,
            DispatchSettings settings,
            AuditLogger audit,
            LongSupplier clock
    ) {
        this.workerId = workerId;
        this.jobId = jobId;
        this.store = store;
        this.plans = plans;
        this.runner = runner;
        this.inputWriter = inputWriter;
        this.applier = applier;
        this.scheduler = new WorkflowScheduler();
        this.collector = collector;
        this.paths = paths;
        this.settings = settings;
        this.audit = audit;
        this.clock = clock;
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Claims and executes at most one run. Returns false when nothing was claimable.
     */
    public boolean runOnce(long simId) {
        List<RunView> candidates = store.claimCandidates(simId, settings.claimBatchSize());
        for (RunView candidate : candidates) {
            SimulationStore.ClaimResult claim = store.claimRun(candidate.runId(), workerId, clock.getAsLong());
            if (claim.outcome() == SimulationStore.ClaimOutcome.CLAIMED) {
                execute(claim.run());
                return true;
            }
            logger.debug("Worker {} skipped run {}: {}", workerId, candidate.runId(), claim.outcome());
        }
        return false;
    }

    /**
     * Keeps executing until the simulation has no PENDING run left or a stop is requested.
     * Waits between attempts while pending runs are still blocked on their baseline.
     */
    public int runUntilIdle(long simId, BooleanSupplier stopRequested) {
        int executed = 0;
        while (!stopRequested.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
            if (runOnce(simId)) {
                executed++;
                continue;
            }
            if (store.activeCounts(simId).pending() == 0) {
                break;
            }
            try {
                Thread.sleep(settings.pollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        logger.debug("Worker {} exiting after {} runs", workerId, executed);
        return executed;
    }

    void execute(RunView run) {
        long startedAt = clock.getAsLong();
        if (!store.markRunning(run.runId(), workerId, jobId, startedAt)) {
            logger.info("Run {} was taken from worker {} before it started", run.runId(), workerId);
            return;
        }
        audit(run, "run.start", "ok", Map.of("trial", run.trialNum(), "experiment", run.expName()));
        RunContext context = new RunContext(
                run.simId(),
                run.runId(),
                run.trialNum(),
                run.expName(),
                workerId,
                paths.scenarioDir(run.simId(), run.trialNum(), run.expName()),
                startedAt + settings.runTimeoutMs()
        );
        String failure;
        boolean interrupted = false;
        try {
            failure = executeSteps(run, context);
        } catch (InterruptedException e) {
            logger.warn("Run {} (trial {}, {}) interrupted on worker {}", run.runId(), run.trialNum(), run.expName(), workerId);
            interrupted = true;
            failure = "interrupted";
        } catch (Exception e) {
            logger.warn("Run {} (trial {}, {}) raised {}", run.runId(), run.trialNum(), run.expName(), e.toString());
            failure = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        }
        if (failure == null) {
            commitSuccess(run);
        } else {
            commitFailure(run, failure);
        }
        // Restored after the commit: audit writes go through interruptible file channels.
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Returns null on success, otherwise the failure cause.
     */
    private String executeSteps(RunView run, RunContext context) throws Exception {
        SimulationPlan plan = plans.plan(run.simId());
        inputWriter.write(context, realize(plan, run));
        VariableEnvironment env = VariableEnvironment.builder(settings.configVariables())
                .user(plan.variables())
                .auto(paths.autoVariables(run.simId(), run.trialNum(), run.expName(), plan.baseline()))
                .build();
        List<RenderedStep> steps = scheduler.resolve(plan.steps(), run.role(), env, plan.selection());
        for (RenderedStep step : steps) {
            long remaining = context.remainingMs(clock.getAsLong());
            if (remaining <= 0) {
                return "timeout";
            }
            ModelResult result = runner.run(context, step, remaining);
            if (!result.success()) {
                return result.error() == null ? "step '" + step.name() + "' failed" : result.error();
            }
            logger.debug("Run {} step {} ok", run.runId(), step.name());
        }
        return null;
    }

    Map<String, Double> realize(SimulationPlan plan, RunView run) {
        Map<String, Double> draws = store.inputValues(run.simId(), run.trialNum(), run.expId());
        Map<String, Double> realized = new LinkedHashMap<>();
        for (ParameterDef def : plan.parameters()) {
            Double draw = draws.get(def.name());
            if (!def.active() || draw == null) {
                continue;
            }
            realized.put(def.name(), applier.realize(def, draw, plan.baseValues().baseValue(def.name(), run.expName())));
        }
        return realized;
    }

    private void commitSuccess(RunView run) {
        if (!store.markSucceeded(run.runId(), workerId, clock.getAsLong())) {
            logger.warn("Discarding result of run {}: it is no longer RUNNING for worker {}", run.runId(), workerId);
            audit(run, "run.commit", "stale", Map.of());
            return;
        }
        audit(run, "run.succeeded", "ok", Map.of());
        SimulationPlan plan = plans.plan(run.simId());
        if (plan.results().isEmpty()) {
            return;
        }
        RunView succeeded = store.findRun(run.runId()).orElseThrow();
        ResultCollector.CollectionOutcome outcome;
        try {
            outcome = collector.collect(succeeded, plan.results());
        } catch (RuntimeException e) {
            // The run stays SUCCEEDED; `collect` can be re-run once the cause is fixed.
            logger.error("Result collection failed for run {} (trial {}, {})", run.runId(), run.trialNum(), run.expName(), e);
            audit(run, "results.collect", "error", Map.of("error", String.valueOf(e.getMessage())));
            return;
        }
        if (!outcome.gaps().isEmpty()) {
            audit(run, "results.collect", "gaps", Map.of("written", outcome.written(), "gaps", outcome.gaps()));
        }
    }

    private void commitFailure(RunView run, String cause) {
        SimulationStore.FailureResolution resolution =
                store.markFailed(run.runId(), workerId, cause, settings.maxRetries(), clock.getAsLong());
        switch (resolution.outcome()) {
            case STALE -> {
                logger.warn("Discarding failure of run {}: it is no longer active for worker {}", run.runId(), workerId);
                return;
            }
            case RETRY_SCHEDULED -> logger.info("Run {} (trial {}, {}) failed, retry {} scheduled as run {}: {}",
                    run.runId(), run.trialNum(), run.expName(), resolution.retryCount(), resolution.retryRunId(), cause);
            case EXHAUSTED -> logger.warn("Run {} (trial {}, {}) failed after {} retries: {}",
                    run.runId(), run.trialNum(), run.expName(), resolution.retryCount(), cause);
        }
        audit(run, "run.failed", resolution.outcome().name().toLowerCase(Locale.ROOT), Map.of("cause", cause));
        if (run.isBaseline() && resolution.outcome() == SimulationStore.FailureOutcome.EXHAUSTED) {
            int aborted = store.cascadeBaselineFailures(run.simId(), clock.getAsLong());
            if (aborted > 0) {
                logger.warn("Baseline of trial {} failed; aborted {} policy runs", run.trialNum(), aborted);
            }
        }
    }

    private void audit(RunView run, String action, String result, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        audit.log(AuditLogger.AuditEvent.of(action, workerId, "run:" + run.runId(), result, run.simId(), run.runId(), details));
    }
}

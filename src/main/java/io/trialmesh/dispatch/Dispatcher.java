package io.trialmesh.dispatch;

import io.trialmesh.config.ConfigurationException;
import io.trialmesh.config.DispatchSettings;
import io.trialmesh.model.ExperimentView;
import io.trialmesh.model.RunStatus;
import io.trialmesh.model.RunView;
import io.trialmesh.observability.AuditLogger;
import io.trialmesh.storage.SimulationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Controller side of a simulation: creates runs, enforces timeouts and baseline cascades,
 * and keeps the cluster's worker count matched to the outstanding work.
 */
public final class Dispatcher {
    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);
    private static final String ACTOR = "dispatcher";

    private final SimulationStore store;
    private final ClusterManager cluster;
    private final DispatchSettings settings;
    private final AuditLogger audit;
    private final LongSupplier clock;
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicLong workerSequence = new AtomicLong();
    private final Map<Long, Set<String>> jobsBySimulation = new ConcurrentHashMap<>();
    private final Set<Long> cancelled = ConcurrentHashMap.newKeySet();

    public Dispatcher(SimulationStore store, ClusterManager cluster, DispatchSettings settings, AuditLogger audit, LongSupplier clock) {
        this.store = store;
        this.cluster = cluster;
        this.settings = settings;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Creates PENDING runs for the named experiments (all when empty) over {@code trials}.
     * The baseline is always included so policy runs can be satisfied.
     */
    public SimulationStore.ScheduleOutcome schedule(long simId, Collection<String> experiments, List<Integer> trials) {
        List<ExperimentView> all = store.listExperiments(simId);
        if (all.isEmpty()) {
            throw new ConfigurationException("Unknown simulation or no experiments: " + simId);
        }
        Set<Long> expIds = new LinkedHashSet<>();
        Map<String, ExperimentView> byName = new LinkedHashMap<>();
        all.forEach(e -> byName.put(e.name(), e));
        if (experiments == null || experiments.isEmpty()) {
            all.forEach(e -> expIds.add(e.expId()));
        } else {
            all.stream().filter(ExperimentView::isBaseline).forEach(e -> expIds.add(e.expId()));
            for (String name : experiments) {
                ExperimentView exp = byName.get(name);
                if (exp == null) {
                    throw new ConfigurationException("Unknown experiment '" + name + "' in simulation " + simId);
                }
                expIds.add(exp.expId());
            }
        }
        cancelled.remove(simId);
        SimulationStore.ScheduleOutcome outcome = store.scheduleRuns(simId, expIds, trials, clock.getAsLong());
        logger.info("Scheduled simulation {}: {} runs created, {} skipped", simId, outcome.created(), outcome.skipped());
        audit("runs.schedule", simId, "ok", Map.of("created", outcome.created(), "skipped", outcome.skipped()));
        return outcome;
    }

    public int requeue(long simId, Set<RunStatus> statuses, List<Integer> trials) {
        int created = store.requeue(simId, statuses, trials, clock.getAsLong());
        logger.info("Requeued {} runs of simulation {} with status in {}", created, simId, statuses);
        audit("runs.requeue", simId, "ok", Map.of("created", created, "statuses", statuses.toString()));
        cancelled.remove(simId);
        return created;
    }

    /**
     * One controller pass: expire timed-out runs, cascade failed baselines, then grow or
     * release the worker pool.
     */
    public ControlTick tick(long simId) {
        long now = clock.getAsLong();
        SimulationStore.TimeoutSummary timeouts = store.failTimedOut(simId, settings.runTimeoutMs(), settings.maxRetries(), now);
        if (timeouts.failed() > 0) {
            logger.warn("Simulation {}: {} runs timed out, {} retried", simId, timeouts.failed(), timeouts.retried());
        }
        int cascaded = store.cascadeBaselineFailures(simId, now);
        if (cascaded > 0) {
            logger.warn("Simulation {}: aborted {} policy runs after baseline failures", simId, cascaded);
        }
        SimulationStore.ActiveCounts counts = store.activeCounts(simId);
        int required = requiredWorkers(counts);
        int submitted = 0;
        int released = 0;
        if (!stopping.get() && !cancelled.contains(simId)) {
            int missing = Math.min(required - cluster.activeJobs(), cluster.availableSlots());
            for (int i = 0; i < missing; i++) {
                String workerId = "w" + simId + "-" + workerSequence.incrementAndGet();
                try {
                    String jobId = cluster.submitWorker(WorkerLaunch.forSimulation(simId, workerId));
                    jobsBySimulation.computeIfAbsent(simId, k -> ConcurrentHashMap.newKeySet()).add(jobId);
                    submitted++;
                } catch (ClusterException e) {
                    logger.warn("Simulation {}: worker submission failed: {}", simId, e.getMessage());
                    break;
                }
            }
        }
        if (counts.waiting() == 0 && settings.idleShutdown()) {
            released = cluster.releaseIdle(busyJobs(simId));
        }
        return new ControlTick(timeouts.failed(), timeouts.retried(), cascaded, required, submitted, released, counts);
    }

    public int requiredWorkers(SimulationStore.ActiveCounts counts) {
        return Math.min(settings.maxWorkers(), counts.waiting());
    }

    /**
     * Ticks until no run of the simulation is active, or until it is cancelled or the
     * dispatcher is stopped.
     */
    public DispatchSummary runToCompletion(long simId) {
        logger.info("Dispatching simulation {} with at most {} workers", simId, settings.maxWorkers());
        while (!stopping.get() && !cancelled.contains(simId)) {
            ControlTick tick = tick(simId);
            if (tick.idle()) {
                break;
            }
            try {
                Thread.sleep(settings.pollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        DispatchSummary summary = summarize(simId);
        logger.info("Simulation {} finished: {} succeeded, {} failed, {} aborted", simId,
                summary.total(RunStatus.SUCCEEDED), summary.total(RunStatus.FAILED), summary.total(RunStatus.ABORTED));
        return summary;
    }

    public DispatchSummary summarize(long simId) {
        Map<String, Map<RunStatus, Integer>> counts = new LinkedHashMap<>();
        List<DispatchSummary.FailedUnit> failures = new ArrayList<>();
        for (RunView run : store.latestRuns(simId)) {
            counts.computeIfAbsent(run.expName(), k -> new EnumMap<>(RunStatus.class)).merge(run.status(), 1, Integer::sum);
            if (run.status() == RunStatus.FAILED || run.status() == RunStatus.ABORTED) {
                failures.add(new DispatchSummary.FailedUnit(run.trialNum(), run.expName(), run.status(), run.cause()));
            }
        }
        return new DispatchSummary(simId, counts, failures, cancelled.contains(simId));
    }

    /**
     * Aborts the simulation's runs and asks the cluster to cancel its jobs. Job cancellation
     * is best effort.
     */
    public SimulationStore.CancelResult cancel(long simId, SimulationStore.CancelMode mode, String reason) {
        cancelled.add(simId);
        SimulationStore.CancelResult result = store.cancelSimulation(simId, mode, reason, clock.getAsLong());
        Set<String> jobs = new LinkedHashSet<>(result.jobIds());
        jobs.addAll(jobsBySimulation.getOrDefault(simId, Set.of()));
        for (String jobId : jobs) {
            try {
                cluster.cancel(jobId);
            } catch (ClusterException e) {
                logger.warn("Cancel of job {} for simulation {} failed: {}", jobId, simId, e.getMessage());
            }
        }
        jobsBySimulation.remove(simId);
        logger.info("Cancelled simulation {} ({}): {} runs aborted, {} jobs signalled", simId, result.mode(), result.aborted(), jobs.size());
        audit("simulation.cancel", simId, result.mode(), Map.of("aborted", result.aborted(), "jobs", jobs.size()));
        return result;
    }

    public void stop() {
        stopping.set(true);
    }

    private Set<String> busyJobs(long simId) {
        Set<String> busy = new HashSet<>();
        for (RunView run : store.listRuns(simId, RunStatus.RUNNING, Integer.MAX_VALUE)) {
            if (run.jobId() != null) {
                busy.add(run.jobId());
            }
        }
        return busy;
    }

    private void audit(String action, long simId, String result, Map<String, Object> details) {
        if (audit != null) {
            audit.log(AuditLogger.AuditEvent.of(action, ACTOR, "simulation:" + simId, result, simId, null, details));
        }
    }
}

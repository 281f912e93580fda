package io.trialmesh.storage;

import io.trialmesh.config.ConfigurationException;
import io.trialmesh.model.ExperimentDef;
import io.trialmesh.model.ExperimentRole;
import io.trialmesh.model.ExperimentView;
import io.trialmesh.model.RunStatus;
import io.trialmesh.model.RunView;
import io.trialmesh.model.SimulationView;
import io.trialmesh.parameter.InputValue;
import io.trialmesh.parameter.ParameterDef;
import io.trialmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Authoritative persistence for simulations and their runs.
 *
 * <p>Every run transition is a single-row compare-and-set on {@code status}; a lost race is
 * reported through the return value and never throws.
 */
public final class SimulationStore {
    private static final String ACTIVE_STATUSES = "('PENDING','QUEUED','RUNNING')";

    // Baseline runs are always claimable; policy runs need a settled, successful baseline.
    private static final String DEPENDENCY_SATISFIED = """
            (run.exp_id IN (SELECT exp_id FROM experiment WHERE role='BASELINE')
             OR (EXISTS (SELECT 1 FROM run b JOIN experiment be ON be.exp_id=b.exp_id
                         WHERE b.sim_id=run.sim_id AND b.trial_num=run.trial_num
                           AND be.role='BASELINE' AND b.status='SUCCEEDED')
                 AND NOT EXISTS (SELECT 1 FROM run b JOIN experiment be ON be.exp_id=b.exp_id
                         WHERE b.sim_id=run.sim_id AND b.trial_num=run.trial_num
                           AND be.role='BASELINE' AND b.status IN ('PENDING','QUEUED','RUNNING'))))
            """;

    private final Database database;

    public SimulationStore(Database database) {
        this.database = database;
    }

    /**
     * Persists a simulation with its experiments, trials, parameters and input values in one
     * transaction; a failure leaves no rows behind.
     */
    public SimulationView createSimulation(NewSimulation sim, List<ExperimentDef> experiments, List<ParameterDef> parameters,
                                           List<InputValue> inputs, long nowMs) {
        long baselines = experiments.stream().filter(e -> e.role() == ExperimentRole.BASELINE).count();
        if (baselines != 1) {
            throw new ConfigurationException("Simulation '" + sim.name() + "' needs exactly one baseline experiment, found " + baselines);
        }
        if (findSimulationByName(sim.name()).isPresent()) {
            throw new ConfigurationException("Simulation already exists: " + sim.name());
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psSim = c.prepareStatement(
                    "INSERT INTO simulation(name,trial_count,seed,description,definition,created_at_ms) VALUES(?,?,?,?,?,?)");
                 PreparedStatement psExp = c.prepareStatement(
                         "INSERT INTO experiment(sim_id,name,role,description,created_at_ms) VALUES(?,?,?,?,?)");
                 PreparedStatement psTrial = c.prepareStatement("INSERT INTO trial(sim_id,trial_num) VALUES(?,?)");
                 PreparedStatement psParam = c.prepareStatement(
                         "INSERT INTO parameter(sim_id,name,mode,dist_spec,low_bound,high_bound,apply_op,active) VALUES(?,?,?,?,?,?,?,?)")) {
                psSim.setString(1, sim.name());
                psSim.setInt(2, sim.trialCount());
                psSim.setLong(3, sim.seed());
                psSim.setString(4, sim.description());
                psSim.setString(5, sim.definitionJson());
                psSim.setLong(6, nowMs);
                psSim.executeUpdate();
                long simId = lastInsertId(c);

                for (ExperimentDef exp : experiments) {
                    psExp.setLong(1, simId);
                    psExp.setString(2, exp.name());
                    psExp.setString(3, exp.role().name());
                    psExp.setString(4, exp.description());
                    psExp.setLong(5, nowMs);
                    psExp.executeUpdate();
                }
                for (int t = 0; t < sim.trialCount(); t++) {
                    psTrial.setLong(1, simId);
                    psTrial.setInt(2, t);
                    psTrial.addBatch();
                }
                psTrial.executeBatch();
                for (ParameterDef def : parameters) {
                    psParam.setLong(1, simId);
                    psParam.setString(2, def.name());
                    psParam.setString(3, def.mode().name());
                    psParam.setString(4, Jsons.toCompactJson(def.distribution().toMap()));
                    setNullableDouble(psParam, 5, def.lowBound());
                    setNullableDouble(psParam, 6, def.highBound());
                    psParam.setString(7, def.apply());
                    psParam.setInt(8, def.active() ? 1 : 0);
                    psParam.executeUpdate();
                }
                insertInputs(c, simId, inputs);
                c.commit();
                return new SimulationView(simId, sim.name(), sim.trialCount(), sim.seed(), sim.description(), nowMs);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to create simulation: " + sim.name(), e);
        }
    }

    /**
     * Write-once insert; rows already present are left untouched. Returns rows inserted.
     */
    public int insertInputValues(long simId, List<InputValue> inputs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                int inserted = insertInputs(c, simId, inputs);
                c.commit();
                return inserted;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to insert input values for simulation " + simId, e);
        }
    }

    private int insertInputs(Connection c, long simId, List<InputValue> inputs) throws SQLException {
        Map<String, Long> paramIds = idsByName(c, "SELECT param_id AS id, name FROM parameter WHERE sim_id=?", simId);
        Map<String, Long> expIds = idsByName(c, "SELECT exp_id AS id, name FROM experiment WHERE sim_id=?", simId);
        int inserted = 0;
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR IGNORE INTO input_value(param_id,sim_id,trial_num,exp_id,value) VALUES(?,?,?,?,?)")) {
            for (InputValue input : inputs) {
                Long paramId = paramIds.get(input.parameter());
                if (paramId == null) {
                    throw new IllegalArgumentException("Unknown parameter for input value: " + input.parameter());
                }
                long expId = 0L;
                if (input.experiment() != null) {
                    Long found = expIds.get(input.experiment());
                    if (found == null) {
                        throw new IllegalArgumentException("Unknown experiment for input value: " + input.experiment());
                    }
                    expId = found;
                }
                ps.setLong(1, paramId);
                ps.setLong(2, simId);
                ps.setInt(3, input.trialNum());
                ps.setLong(4, expId);
                ps.setDouble(5, input.value());
                inserted += ps.executeUpdate();
            }
        }
        return inserted;
    }

    public Optional<SimulationView> findSimulation(long simId) {
        return querySimulation("SELECT * FROM simulation WHERE sim_id=?", ps -> ps.setLong(1, simId));
    }

    public Optional<SimulationView> findSimulationByName(String name) {
        return querySimulation("SELECT * FROM simulation WHERE name=?", ps -> ps.setString(1, name));
    }

    public List<SimulationView> listSimulations() {
        List<SimulationView> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT * FROM simulation ORDER BY sim_id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(readSimulation(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list simulations", e);
        }
    }

    public Optional<String> simulationDefinition(long simId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT definition FROM simulation WHERE sim_id=?")) {
            ps.setLong(1, simId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString("definition")) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read simulation definition: " + simId, e);
        }
    }

    public List<ExperimentView> listExperiments(long simId) {
        List<ExperimentView> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT exp_id,sim_id,name,role,description FROM experiment WHERE sim_id=? ORDER BY CASE role WHEN 'BASELINE' THEN 0 ELSE 1 END, exp_id")) {
            ps.setLong(1, simId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ExperimentView(
                            rs.getLong("exp_id"),
                            rs.getLong("sim_id"),
                            rs.getString("name"),
                            ExperimentRole.valueOf(rs.getString("role")),
                            rs.getString("description")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list experiments for simulation " + simId, e);
        }
    }

    public List<StoredParameter> listParameters(long simId) {
        List<StoredParameter> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT * FROM parameter WHERE sim_id=? ORDER BY param_id")) {
            ps.setLong(1, simId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StoredParameter(
                            rs.getLong("param_id"),
                            rs.getString("name"),
                            rs.getString("mode"),
                            rs.getString("dist_spec"),
                            nullableDouble(rs, "low_bound"),
                            nullableDouble(rs, "high_bound"),
                            rs.getString("apply_op"),
                            rs.getInt("active") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list parameters for simulation " + simId, e);
        }
    }

    /**
     * Draws visible to one (trial, experiment): shared rows plus the experiment's own
     * independent rows, keyed by parameter name.
     */
    public Map<String, Double> inputValues(long simId, int trialNum, long expId) {
        Map<String, Double> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     SELECT param_name, value FROM param_view
                     WHERE sim_id=? AND trial_num=? AND exp_id IN (0, ?)
                     ORDER BY param_name
                     """)) {
            ps.setLong(1, simId);
            ps.setInt(2, trialNum);
            ps.setLong(3, expId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString("param_name"), rs.getDouble("value"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read input values for trial " + trialNum, e);
        }
    }

    public List<ParamRow> paramValues(long simId, Integer trialNum) {
        String sql = "SELECT trial_num, exp_id, param_name, value FROM param_view WHERE sim_id=?"
                + (trialNum == null ? "" : " AND trial_num=?")
                + " ORDER BY trial_num, param_name, exp_id";
        List<ParamRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, simId);
            if (trialNum != null) {
                ps.setInt(2, trialNum);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ParamRow(rs.getInt("trial_num"), rs.getLong("exp_id"), rs.getString("param_name"), rs.getDouble("value")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read parameter values for simulation " + simId, e);
        }
    }

    /**
     * Creates PENDING runs for each (experiment, trial) pair that has neither an active nor a
     * succeeded run.
     */
    public ScheduleOutcome scheduleRuns(long simId, Collection<Long> expIds, Collection<Integer> trials, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement check = c.prepareStatement(
                    "SELECT 1 FROM run WHERE sim_id=? AND exp_id=? AND trial_num=? AND status IN ('PENDING','QUEUED','RUNNING','SUCCEEDED') LIMIT 1")) {
                int created = 0;
                int skipped = 0;
                for (int trial : trials) {
                    for (long expId : expIds) {
                        check.setLong(1, simId);
                        check.setLong(2, expId);
                        check.setInt(3, trial);
                        boolean exists;
                        try (ResultSet rs = check.executeQuery()) {
                            exists = rs.next();
                        }
                        if (exists) {
                            skipped++;
                            continue;
                        }
                        insertPendingRun(c, simId, expId, trial, 0, nowMs);
                        created++;
                    }
                }
                c.commit();
                return new ScheduleOutcome(created, skipped);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to schedule runs for simulation " + simId, e);
        }
    }

    /**
     * Schedules a fresh attempt for every pair whose latest run ended in one of
     * {@code statuses}. A null trial list means all trials.
     */
    public int requeue(long simId, Set<RunStatus> statuses, Collection<Integer> trials, long nowMs) {
        for (RunStatus status : statuses) {
            if (!status.isTerminal()) {
                throw new IllegalArgumentException("Only terminal statuses can be requeued: " + status);
            }
        }
        String latest = """
                SELECT r.exp_id, r.trial_num, r.status FROM run r
                WHERE r.sim_id=?
                  AND r.run_id=(SELECT MAX(x.run_id) FROM run x
                                WHERE x.sim_id=r.sim_id AND x.exp_id=r.exp_id AND x.trial_num=r.trial_num)
                ORDER BY r.trial_num, r.exp_id
                """;
        Set<Integer> trialFilter = trials == null ? null : new LinkedHashSet<>(trials);
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(latest)) {
                ps.setLong(1, simId);
                List<long[]> targets = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        RunStatus status = RunStatus.valueOf(rs.getString("status"));
                        int trial = rs.getInt("trial_num");
                        if (statuses.contains(status) && (trialFilter == null || trialFilter.contains(trial))) {
                            targets.add(new long[]{rs.getLong("exp_id"), trial});
                        }
                    }
                }
                for (long[] target : targets) {
                    insertPendingRun(c, simId, target[0], (int) target[1], 0, nowMs);
                }
                c.commit();
                return targets.size();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to requeue runs for simulation " + simId, e);
        }
    }

    /**
     * PENDING runs whose dependency is satisfied, baseline runs first.
     */
    public List<RunView> claimCandidates(long simId, int limit) {
        String sql = "SELECT * FROM run_info AS run WHERE run.sim_id=? AND run.status='PENDING' AND "
                + DEPENDENCY_SATISFIED
                + " ORDER BY CASE run.role WHEN 'BASELINE' THEN 0 ELSE 1 END, run.trial_num, run.run_id LIMIT ?";
        List<RunView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, simId);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readRun(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list claim candidates for simulation " + simId, e);
        }
    }

    /**
     * Atomically moves one run PENDING -> QUEUED for {@code workerId}, provided its baseline
     * dependency holds at the moment of the update.
     */
    public ClaimResult claimRun(long runId, String workerId, long nowMs) {
        String sql = "UPDATE run SET status='QUEUED', worker_id=?, queued_at_ms=?, updated_at_ms=? "
                + "WHERE run_id=? AND status='PENDING' AND " + DEPENDENCY_SATISFIED;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, workerId);
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setLong(4, runId);
            if (ps.executeUpdate() == 0) {
                Optional<RunStatus> actual = readStatus(c, runId);
                if (actual.isPresent() && actual.get() == RunStatus.PENDING) {
                    return ClaimResult.blocked();
                }
                return ClaimResult.lost();
            }
            return ClaimResult.claimed(findRun(runId).orElseThrow());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim run " + runId, e);
        }
    }

    public boolean markRunning(long runId, String workerId, String jobId, long nowMs) {
        String sql = "UPDATE run SET status='RUNNING', started_at_ms=?, job_id=COALESCE(?, job_id), updated_at_ms=? "
                + "WHERE run_id=? AND status='QUEUED' AND worker_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, jobId);
            ps.setLong(3, nowMs);
            ps.setLong(4, runId);
            ps.setString(5, workerId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed mark running: " + runId, e);
        }
    }

    public boolean markSucceeded(long runId, String workerId, long nowMs) {
        String sql = "UPDATE run SET status='SUCCEEDED', cause=NULL, ended_at_ms=?, updated_at_ms=? "
                + "WHERE run_id=? AND status='RUNNING' AND worker_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setLong(2, nowMs);
            ps.setLong(3, runId);
            ps.setString(4, workerId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed mark succeeded: " + runId, e);
        }
    }

    /**
     * Marks a QUEUED or RUNNING run FAILED and, while retries remain, appends a new PENDING
     * row for the same pair in the same transaction. A null {@code workerId} skips the owner
     * check (controller-side timeouts).
     */
    public FailureResolution markFailed(long runId, String workerId, String cause, int maxRetries, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement read = c.prepareStatement(
                    "SELECT sim_id,exp_id,trial_num,status,worker_id,retry_count FROM run WHERE run_id=?");
                 PreparedStatement fail = c.prepareStatement(
                         "UPDATE run SET status='FAILED', cause=?, ended_at_ms=?, updated_at_ms=? WHERE run_id=? AND status=?")) {
                read.setLong(1, runId);
                long simId;
                long expId;
                int trial;
                String status;
                String owner;
                int retryCount;
                try (ResultSet rs = read.executeQuery()) {
                    if (!rs.next()) {
                        c.rollback();
                        return FailureResolution.stale();
                    }
                    simId = rs.getLong("sim_id");
                    expId = rs.getLong("exp_id");
                    trial = rs.getInt("trial_num");
                    status = rs.getString("status");
                    owner = rs.getString("worker_id");
                    retryCount = rs.getInt("retry_count");
                }
                boolean failable = RunStatus.RUNNING.name().equals(status) || RunStatus.QUEUED.name().equals(status);
                if (!failable || (workerId != null && !workerId.equals(owner))) {
                    c.rollback();
                    return FailureResolution.stale();
                }
                fail.setString(1, truncateCause(cause));
                fail.setLong(2, nowMs);
                fail.setLong(3, nowMs);
                fail.setLong(4, runId);
                fail.setString(5, status);
                if (fail.executeUpdate() == 0) {
                    c.rollback();
                    return FailureResolution.stale();
                }
                if (retryCount < maxRetries) {
                    long retryRunId = insertPendingRun(c, simId, expId, trial, retryCount + 1, nowMs);
                    c.commit();
                    return FailureResolution.retryScheduled(retryRunId, retryCount + 1);
                }
                c.commit();
                return FailureResolution.exhausted(retryCount);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed complete failure: " + runId, e);
        }
    }

    /**
     * Fails RUNNING runs started before {@code nowMs - timeoutMs}, and QUEUED runs claimed
     * before it whose worker never started them.
     */
    public TimeoutSummary failTimedOut(long simId, long timeoutMs, int maxRetries, long nowMs) {
        long cutoff = nowMs - timeoutMs;
        List<Long> expired = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     SELECT run_id FROM run
                     WHERE sim_id=? AND ((status='RUNNING' AND started_at_ms<?) OR (status='QUEUED' AND queued_at_ms<?))
                     ORDER BY run_id
                     """)) {
            ps.setLong(1, simId);
            ps.setLong(2, cutoff);
            ps.setLong(3, cutoff);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    expired.add(rs.getLong("run_id"));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to scan timed-out runs for simulation " + simId, e);
        }
        int failed = 0;
        int retried = 0;
        for (long runId : expired) {
            FailureResolution resolution = markFailed(runId, null, "timeout", maxRetries, nowMs);
            if (resolution.outcome() == FailureOutcome.STALE) {
                continue;
            }
            failed++;
            if (resolution.outcome() == FailureOutcome.RETRY_SCHEDULED) {
                retried++;
            }
        }
        return new TimeoutSummary(failed, retried);
    }

    /**
     * Aborts waiting policy runs of trials whose baseline has no active or successful run left
     * but at least one failed or aborted one.
     */
    public int cascadeBaselineFailures(long simId, long nowMs) {
        String sql = """
                UPDATE run SET status='ABORTED', cause='baseline_failed', ended_at_ms=?, updated_at_ms=?
                WHERE sim_id=? AND status IN ('PENDING','QUEUED')
                  AND exp_id IN (SELECT exp_id FROM experiment WHERE sim_id=? AND role='POLICY')
                  AND NOT EXISTS (SELECT 1 FROM run b JOIN experiment be ON be.exp_id=b.exp_id
                                  WHERE b.sim_id=run.sim_id AND b.trial_num=run.trial_num AND be.role='BASELINE'
                                    AND b.status IN ('PENDING','QUEUED','RUNNING','SUCCEEDED'))
                  AND EXISTS (SELECT 1 FROM run b JOIN experiment be ON be.exp_id=b.exp_id
                              WHERE b.sim_id=run.sim_id AND b.trial_num=run.trial_num AND be.role='BASELINE'
                                AND b.status IN ('FAILED','ABORTED'))
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setLong(2, nowMs);
            ps.setLong(3, simId);
            ps.setLong(4, simId);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cascade baseline failures for simulation " + simId, e);
        }
    }

    /**
     * SOFT aborts runs that have not started; HARD also aborts RUNNING ones. Returns the
     * cluster job ids attached to the aborted runs.
     */
    public CancelResult cancelSimulation(long simId, CancelMode mode, String reason, long nowMs) {
        String targets = mode == CancelMode.HARD ? ACTIVE_STATUSES : "('PENDING','QUEUED')";
        String cause = reason == null || reason.isBlank() ? "cancelled by operator" : reason;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement jobs = c.prepareStatement(
                    "SELECT DISTINCT job_id FROM run WHERE sim_id=? AND job_id IS NOT NULL AND status IN " + targets);
                 PreparedStatement abort = c.prepareStatement(
                         "UPDATE run SET status='ABORTED', cause=?, ended_at_ms=?, updated_at_ms=? WHERE sim_id=? AND status IN " + targets)) {
                jobs.setLong(1, simId);
                List<String> jobIds = new ArrayList<>();
                try (ResultSet rs = jobs.executeQuery()) {
                    while (rs.next()) {
                        jobIds.add(rs.getString("job_id"));
                    }
                }
                abort.setString(1, cause);
                abort.setLong(2, nowMs);
                abort.setLong(3, nowMs);
                abort.setLong(4, simId);
                int aborted = abort.executeUpdate();
                c.commit();
                return new CancelResult(simId, mode.name().toLowerCase(Locale.ROOT), aborted, jobIds);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to cancel simulation: " + simId, e);
        }
    }

    public ActiveCounts activeCounts(long simId) {
        Map<RunStatus, Integer> counts = new EnumMap<>(RunStatus.class);
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT status, COUNT(*) AS n FROM run WHERE sim_id=? AND status IN " + ACTIVE_STATUSES + " GROUP BY status")) {
            ps.setLong(1, simId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(RunStatus.valueOf(rs.getString("status")), rs.getInt("n"));
                }
            }
            return new ActiveCounts(
                    counts.getOrDefault(RunStatus.PENDING, 0),
                    counts.getOrDefault(RunStatus.QUEUED, 0),
                    counts.getOrDefault(RunStatus.RUNNING, 0)
            );
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count active runs for simulation " + simId, e);
        }
    }

    public List<StatusCount> statusSummary(long simId) {
        List<StatusCount> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT exp_name, status, run_count FROM status_summary WHERE sim_id=? ORDER BY exp_name, status")) {
            ps.setLong(1, simId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StatusCount(rs.getString("exp_name"), RunStatus.valueOf(rs.getString("status")), rs.getInt("run_count")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read status summary for simulation " + simId, e);
        }
    }

    public Optional<RunView> findRun(long runId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT * FROM run_info WHERE run_id=?")) {
            ps.setLong(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readRun(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read run " + runId, e);
        }
    }

    public Optional<RunView> findSucceededRun(long simId, long expId, int trialNum) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT * FROM run_info WHERE sim_id=? AND exp_id=? AND trial_num=? AND status='SUCCEEDED' ORDER BY run_id DESC LIMIT 1")) {
            ps.setLong(1, simId);
            ps.setLong(2, expId);
            ps.setInt(3, trialNum);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readRun(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read succeeded run for trial " + trialNum, e);
        }
    }

    public List<RunView> listRuns(long simId, RunStatus status, int limit) {
        String sql = "SELECT * FROM run_info WHERE sim_id=?" + (status == null ? "" : " AND status=?") + " ORDER BY run_id LIMIT ?";
        List<RunView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            ps.setLong(idx++, simId);
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readRun(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list runs for simulation " + simId, e);
        }
    }

    /**
     * The most recent attempt of every (trial, experiment) pair.
     */
    public List<RunView> latestRuns(long simId) {
        String sql = """
                SELECT * FROM run_info
                WHERE run_id IN (SELECT MAX(run_id) FROM run WHERE sim_id=? GROUP BY exp_id, trial_num)
                ORDER BY trial_num, CASE role WHEN 'BASELINE' THEN 0 ELSE 1 END, exp_name
                """;
        List<RunView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, simId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readRun(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list latest runs for simulation " + simId, e);
        }
    }

    /**
     * Replaces the run's outputs. Only SUCCEEDED runs may carry outputs.
     */
    public void saveOutputs(long runId, List<OutputRow> outputs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement delSeries = c.prepareStatement("DELETE FROM output_series WHERE run_id=?");
                 PreparedStatement delValues = c.prepareStatement("DELETE FROM output_value WHERE run_id=?");
                 PreparedStatement insValue = c.prepareStatement("INSERT INTO output_value(run_id,result_name,value) VALUES(?,?,?)");
                 PreparedStatement insSeries = c.prepareStatement("INSERT INTO output_series(run_id,result_name,year,value) VALUES(?,?,?,?)")) {
                Optional<RunStatus> status = readStatus(c, runId);
                if (status.isEmpty() || status.get() != RunStatus.SUCCEEDED) {
                    throw new IllegalStateException("Outputs require a SUCCEEDED run, run " + runId + " is " + status.orElse(null));
                }
                delSeries.setLong(1, runId);
                delSeries.executeUpdate();
                delValues.setLong(1, runId);
                delValues.executeUpdate();
                for (OutputRow row : outputs) {
                    insValue.setLong(1, runId);
                    insValue.setString(2, row.resultName());
                    setNullableDouble(insValue, 3, row.value());
                    insValue.executeUpdate();
                    for (Map.Entry<Integer, Double> point : row.series().entrySet()) {
                        insSeries.setLong(1, runId);
                        insSeries.setString(2, row.resultName());
                        insSeries.setInt(3, point.getKey());
                        insSeries.setDouble(4, point.getValue());
                        insSeries.executeUpdate();
                    }
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to save outputs for run " + runId, e);
        }
    }

    public Map<String, Double> outputValues(long runId) {
        Map<String, Double> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT result_name, value FROM output_value WHERE run_id=? ORDER BY result_name")) {
            ps.setLong(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString("result_name"), nullableDouble(rs, "value"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read outputs for run " + runId, e);
        }
    }

    public SortedMap<Integer, Double> outputSeries(long runId, String resultName) {
        SortedMap<Integer, Double> out = new TreeMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT year, value FROM output_series WHERE run_id=? AND result_name=?")) {
            ps.setLong(1, runId);
            ps.setString(2, resultName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getInt("year"), rs.getDouble("value"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read output series for run " + runId, e);
        }
    }

    public List<ResultRow> results(long simId, String resultName) {
        String sql = "SELECT run_id, trial_num, exp_name, result_name, value FROM result_view WHERE sim_id=?"
                + (resultName == null ? "" : " AND result_name=?")
                + " ORDER BY result_name, trial_num, exp_name";
        List<ResultRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, simId);
            if (resultName != null) {
                ps.setString(2, resultName);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ResultRow(
                            rs.getLong("run_id"),
                            rs.getInt("trial_num"),
                            rs.getString("exp_name"),
                            rs.getString("result_name"),
                            nullableDouble(rs, "value")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read results for simulation " + simId, e);
        }
    }

    private long insertPendingRun(Connection c, long simId, long expId, int trial, int retryCount, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO run(sim_id,exp_id,trial_num,status,retry_count,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?)")) {
            ps.setLong(1, simId);
            ps.setLong(2, expId);
            ps.setInt(3, trial);
            ps.setString(4, RunStatus.PENDING.name());
            ps.setInt(5, retryCount);
            ps.setLong(6, nowMs);
            ps.setLong(7, nowMs);
            ps.executeUpdate();
        }
        return lastInsertId(c);
    }

    private Optional<RunStatus> readStatus(Connection c, long runId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT status FROM run WHERE run_id=?")) {
            ps.setLong(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RunStatus.valueOf(rs.getString("status"))) : Optional.empty();
            }
        }
    }

    private Optional<SimulationView> querySimulation(String sql, Binder binder) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readSimulation(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read simulation", e);
        }
    }

    private static Map<String, Long> idsByName(Connection c, String sql, long simId) throws SQLException {
        Map<String, Long> out = new HashMap<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, simId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString("name"), rs.getLong("id"));
                }
            }
        }
        return out;
    }

    private static long lastInsertId(Connection c) throws SQLException {
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }

    private static SimulationView readSimulation(ResultSet rs) throws SQLException {
        return new SimulationView(
                rs.getLong("sim_id"),
                rs.getString("name"),
                rs.getInt("trial_count"),
                rs.getLong("seed"),
                rs.getString("description"),
                rs.getLong("created_at_ms")
        );
    }

    private static RunView readRun(ResultSet rs) throws SQLException {
        return new RunView(
                rs.getLong("run_id"),
                rs.getLong("sim_id"),
                rs.getLong("exp_id"),
                rs.getInt("trial_num"),
                rs.getString("exp_name"),
                ExperimentRole.valueOf(rs.getString("role")),
                RunStatus.valueOf(rs.getString("status")),
                rs.getInt("retry_count"),
                rs.getString("worker_id"),
                rs.getString("job_id"),
                rs.getString("cause"),
                nullableLong(rs, "queued_at_ms"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "ended_at_ms"),
                rs.getLong("created_at_ms")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableDouble(PreparedStatement ps, int idx, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.REAL);
        } else {
            ps.setDouble(idx, value);
        }
    }

    private static String truncateCause(String cause) {
        if (cause == null) {
            return null;
        }
        return cause.length() <= 512 ? cause : cause.substring(0, 512) + "...";
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    public record NewSimulation(String name, int trialCount, long seed, String description, String definitionJson) {}
    public record StoredParameter(long paramId, String name, String mode, String distSpec, Double lowBound, Double highBound,
                                  String apply, boolean active) {}
    public record ScheduleOutcome(int created, int skipped) {}
    public enum ClaimOutcome { CLAIMED, LOST, BLOCKED }
    public record ClaimResult(ClaimOutcome outcome, RunView run) {
        public static ClaimResult claimed(RunView run) { return new ClaimResult(ClaimOutcome.CLAIMED, run); }
        public static ClaimResult lost() { return new ClaimResult(ClaimOutcome.LOST, null); }
        public static ClaimResult blocked() { return new ClaimResult(ClaimOutcome.BLOCKED, null); }
    }
    public enum FailureOutcome { RETRY_SCHEDULED, EXHAUSTED, STALE }
    public record FailureResolution(FailureOutcome outcome, Long retryRunId, int retryCount) {
        public static FailureResolution retryScheduled(long retryRunId, int retryCount) { return new FailureResolution(FailureOutcome.RETRY_SCHEDULED, retryRunId, retryCount); }
        public static FailureResolution exhausted(int retryCount) { return new FailureResolution(FailureOutcome.EXHAUSTED, null, retryCount); }
        public static FailureResolution stale() { return new FailureResolution(FailureOutcome.STALE, null, 0); }
    }
    public record TimeoutSummary(int failed, int retried) {}
    public enum CancelMode {
        HARD,
        SOFT;

        public static CancelMode fromString(String raw) {
            if (raw == null || raw.isBlank()) {
                return SOFT;
            }
            String v = raw.trim().toUpperCase(Locale.ROOT);
            if ("HARD".equals(v)) {
                return HARD;
            }
            if ("SOFT".equals(v)) {
                return SOFT;
            }
            throw new IllegalArgumentException("Unsupported cancel mode: " + raw);
        }
    }
    public record CancelResult(long simId, String mode, int aborted, List<String> jobIds) {}
    public record ActiveCounts(int pending, int queued, int running) {
        public int waiting() { return pending + queued; }
        public int total() { return pending + queued + running; }
    }
    public record StatusCount(String expName, RunStatus status, int count) {}
    public record ParamRow(int trialNum, long expId, String paramName, double value) {}
    public record ResultRow(long runId, int trialNum, String expName, String resultName, Double value) {}
    public record OutputRow(String resultName, Double value, Map<Integer, Double> series) {
        public OutputRow {
            series = series == null ? Map.of() : Map.copyOf(series);
        }
    }
}

package io.trialmesh.result;

import io.trialmesh.model.ExperimentView;
import io.trialmesh.model.RunStatus;
import io.trialmesh.model.RunView;
import io.trialmesh.storage.SimulationStore;
import io.trialmesh.workflow.TrialPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Extracts result values from a succeeded run's query-result tables and writes them back as
 * output values. Missing inputs are gaps: logged, counted, never fatal.
 */
public final class ResultCollector {
    private static final Logger logger = LoggerFactory.getLogger(ResultCollector.class);
    static final String QUERY_RESULTS_DIR = "queryResults";

    private final SimulationStore store;
    private final TrialPaths paths;
    private final int startYear;
    private final int endYear;

    public ResultCollector(SimulationStore store, TrialPaths paths, int startYear, int endYear) {
        if (startYear > endYear) {
            throw new IllegalArgumentException("startYear must not exceed endYear: " + startYear + " > " + endYear);
        }
        this.store = store;
        this.paths = paths;
        this.startYear = startYear;
        this.endYear = endYear;
    }

    public CollectionOutcome collect(RunView run, List<ResultDef> results) {
        if (run.status() != RunStatus.SUCCEEDED) {
            throw new IllegalStateException("Results can only be collected for SUCCEEDED runs, run " + run.runId() + " is " + run.status());
        }
        List<String> gaps = new ArrayList<>();
        List<SimulationStore.OutputRow> rows = new ArrayList<>();
        Optional<ExperimentView> baseline = Optional.empty();
        boolean baselineLoaded = false;
        for (ResultDef def : results) {
            if (def.type() == ResultType.DIFF && run.isBaseline()) {
                continue;
            }
            Optional<ResultValue> own = extract(run, run.expName(), def, gaps);
            if (own.isEmpty()) {
                continue;
            }
            ResultValue value = def.cumulative() ? ResultValue.scalar(own.get().total()) : own.get();
            if (def.type() == ResultType.DIFF) {
                if (!baselineLoaded) {
                    baseline = store.listExperiments(run.simId()).stream().filter(ExperimentView::isBaseline).findFirst();
                    baselineLoaded = true;
                }
                Optional<ResultValue> diffed = diff(run, def, value, baseline, gaps);
                if (diffed.isEmpty()) {
                    continue;
                }
                value = diffed.get();
            }
            rows.add(new SimulationStore.OutputRow(def.name(), value.scalar(), value.series()));
        }
        store.saveOutputs(run.runId(), rows);
        logger.debug("Collected {} results for run {} ({} gaps)", rows.size(), run.runId(), gaps.size());
        return new CollectionOutcome(run.runId(), rows.size(), gaps);
    }

    private Optional<ResultValue> diff(RunView run, ResultDef def, ResultValue policy, Optional<ExperimentView> baseline, List<String> gaps) {
        if (baseline.isEmpty()) {
            return gap(gaps, run, def, "simulation has no baseline experiment");
        }
        ExperimentView base = baseline.get();
        if (store.findSucceededRun(run.simId(), base.expId(), run.trialNum()).isEmpty()) {
            return gap(gaps, run, def, "baseline '" + base.name() + "' has no succeeded run for trial " + run.trialNum());
        }
        Optional<ResultValue> reference = extract(run, base.name(), def, gaps);
        if (reference.isEmpty()) {
            return Optional.empty();
        }
        ResultValue ref = def.cumulative() ? ResultValue.scalar(reference.get().total()) : reference.get();
        if (!policy.isSeries()) {
            OptionalDouble d = difference(policy.scalar(), ref.total(), def.percentage());
            if (d.isEmpty()) {
                return gap(gaps, run, def, "baseline value is zero");
            }
            return Optional.of(ResultValue.scalar(d.getAsDouble()));
        }
        SortedMap<Integer, Double> out = new TreeMap<>();
        for (Map.Entry<Integer, Double> e : policy.series().entrySet()) {
            Double b = ref.series().get(e.getKey());
            if (b == null) {
                continue;
            }
            difference(e.getValue(), b, def.percentage()).ifPresent(v -> out.put(e.getKey(), v));
        }
        if (out.isEmpty()) {
            return gap(gaps, run, def, "no aligned non-zero baseline years");
        }
        return Optional.of(ResultValue.series(out));
    }

    static OptionalDouble difference(double policy, double baseline, boolean percentage) {
        double d = policy - baseline;
        if (!percentage) {
            return OptionalDouble.of(d);
        }
        if (baseline == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(d / baseline);
    }

    private Optional<ResultValue> extract(RunView run, String scenario, ResultDef def, List<String> gaps) {
        Path file = paths.scenarioDir(run.simId(), run.trialNum(), scenario)
                .resolve(QUERY_RESULTS_DIR)
                .resolve(def.fileFor(scenario));
        if (!Files.isRegularFile(file)) {
            return gap(gaps, run, def, "missing file " + file);
        }
        QueryResultTable table;
        try {
            table = QueryResultTable.read(file);
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", file, e.getMessage());
            return gap(gaps, run, def, "unreadable file " + file);
        }
        List<Map<String, String>> selected = table.select(def.constraints());
        if (selected.isEmpty()) {
            return gap(gaps, run, def, "no rows match in " + file.getFileName());
        }
        if (def.column() != null) {
            OptionalDouble v = QueryResultTable.parseNumber(selected.get(0).get(def.column()));
            if (v.isEmpty()) {
                return gap(gaps, run, def, "column '" + def.column() + "' is missing or not numeric in " + file.getFileName());
            }
            return Optional.of(ResultValue.scalar(v.getAsDouble()));
        }
        SortedMap<Integer, Double> series = table.sumYears(selected, startYear, endYear);
        if (series.isEmpty()) {
            return gap(gaps, run, def, "no year columns in [" + startYear + ", " + endYear + "] in " + file.getFileName());
        }
        return Optional.of(ResultValue.series(series));
    }

    private static Optional<ResultValue> gap(List<String> gaps, RunView run, ResultDef def, String reason) {
        String message = def.name() + ": " + reason;
        logger.warn("Result gap for run {} (trial {}, {}): {}", run.runId(), run.trialNum(), run.expName(), message);
        gaps.add(message);
        return Optional.empty();
    }

    public record CollectionOutcome(long runId, int written, List<String> gaps) {
        public CollectionOutcome {
            gaps = List.copyOf(gaps);
        }
    }
}

package io.trialmesh.result;

import io.trialmesh.config.ConfigurationException;
import io.trialmesh.config.TrialMeshConfig;
import io.trialmesh.model.ExperimentDef;
import io.trialmesh.model.ExperimentView;
import io.trialmesh.model.RunView;
import io.trialmesh.model.SimulationView;
import io.trialmesh.storage.Database;
import io.trialmesh.storage.SimulationStore;
import io.trialmesh.workflow.TrialPaths;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Stream;

final class ResultCollectorTest {
    private static final String REFERENCE_TABLE = """
            Regional emissions
            region,sector,2020,2021,2060
            USA,elec,10,20,99
            USA,trans,1,2,99
            EU,elec,5,5,99
            """;
    private static final String POLICY_TABLE = """
            Regional emissions
            region,sector,2020,2021,2060
            USA,elec,12,24,99
            USA,trans,1,2,99
            EU,elec,0,0,99
            """;

    @Test
    void scenarioResultsSumSelectedRowsPerYear() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-collect-series-");
        try {
            Fixture f = Fixture.create(root);
            f.writeTable("Reference", "emissions-Reference.csv", REFERENCE_TABLE);
            RunView baseline = f.succeed("Reference");

            ResultDef usa = ResultDef.scenario("usa", "emissions").withConstraints(List.of(Constraint.parse("region", "==", "USA")));
            ResultDef usaTotal = ResultDef.scenario("usa-total", "emissions")
                    .withConstraints(List.of(Constraint.parse("region", "eq", "USA"))).asCumulative();
            ResultDef elec2020 = ResultDef.scenario("elec-2020", "emissions").withColumn("2020")
                    .withConstraints(List.of(Constraint.parse("sector", "startswith", "ele")));
            ResultDef skippedDiff = ResultDef.diff("usa-diff", "emissions");

            ResultCollector.CollectionOutcome outcome = f.collector.collect(baseline, List.of(usa, usaTotal, elec2020, skippedDiff));
            Assertions.assertEquals(3, outcome.written());
            Assertions.assertTrue(outcome.gaps().isEmpty());

            Assertions.assertEquals(Map.of(2020, 11.0, 2021, 22.0), f.store.outputSeries(baseline.runId(), "usa"));
            Map<String, Double> values = f.store.outputValues(baseline.runId());
            Assertions.assertEquals(33.0, values.get("usa-total"));
            Assertions.assertEquals(10.0, values.get("elec-2020"));
            Assertions.assertFalse(values.containsKey("usa-diff"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedTableIsAGapAndOtherResultsAreStillWritten() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-collect-malformed-");
        try {
            Fixture f = Fixture.create(root);
            f.writeTable("Reference", "emissions-Reference.csv", REFERENCE_TABLE);
            f.writeTable("Reference", "prices-Reference.csv", """
                    Prices
                    region,2020
                    "USA,10
                    """);
            RunView baseline = f.succeed("Reference");

            ResultDef prices = ResultDef.scenario("prices", "prices").withColumn("2020");
            ResultDef total = ResultDef.scenario("total", "emissions").asCumulative();
            ResultCollector.CollectionOutcome outcome = f.collector.collect(baseline, List.of(prices, total));

            Assertions.assertEquals(1, outcome.written());
            Assertions.assertEquals(1, outcome.gaps().size());
            Assertions.assertTrue(outcome.gaps().get(0).contains("unreadable"), outcome.gaps().get(0));
            Assertions.assertEquals(Map.of("total", (10.0 + 1.0 + 5.0) + (20.0 + 2.0 + 5.0)), f.store.outputValues(baseline.runId()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void diffResultsSubtractTheBaselineOfTheSameTrial() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-collect-diff-");
        try {
            Fixture f = Fixture.create(root);
            f.writeTable("Reference", "emissions-Reference.csv", REFERENCE_TABLE);
            f.writeTable("Tax", "emissions-Tax.csv", POLICY_TABLE);
            f.succeed("Reference");
            RunView policy = f.succeed("Tax");

            List<Constraint> usaOnly = List.of(Constraint.parse("region", "==", "USA"));
            ResultDef diff = ResultDef.diff("usa-diff", "emissions").withConstraints(usaOnly);
            ResultDef pct = ResultDef.diff("usa-pct", "emissions").withConstraints(usaOnly).asPercentage().asCumulative();
            ResultDef zeroBase = ResultDef.diff("eu-pct", "emissions").withColumn("2020")
                    .withConstraints(List.of(Constraint.parse("region", "==", "EU"))).asPercentage();

            ResultCollector.CollectionOutcome outcome = f.collector.collect(policy, List.of(diff, pct, zeroBase));
            Assertions.assertEquals(3, outcome.written());

            Assertions.assertEquals(Map.of(2020, 2.0, 2021, 4.0), f.store.outputSeries(policy.runId(), "usa-diff"));
            Assertions.assertEquals(6.0 / 33.0, f.store.outputValues(policy.runId()).get("usa-pct"), 1e-9);
            Assertions.assertEquals(-1.0, f.store.outputValues(policy.runId()).get("eu-pct"), 1e-9);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingInputsAreGapsNotFailures() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-collect-gaps-");
        try {
            Fixture f = Fixture.create(root);
            f.writeTable("Tax", "emissions-Tax.csv", POLICY_TABLE);
            f.succeed("Reference");
            RunView policy = f.succeed("Tax");

            ResultDef diff = ResultDef.diff("usa-diff", "emissions");
            ResultDef absent = ResultDef.scenario("other", "missing-table");
            ResultDef noMatch = ResultDef.scenario("none", "emissions")
                    .withConstraints(List.of(Constraint.parse("region", "==", "Mars")));
            ResultDef own = ResultDef.scenario("all", "emissions");

            ResultCollector.CollectionOutcome outcome = f.collector.collect(policy, List.of(diff, absent, noMatch, own));
            Assertions.assertEquals(1, outcome.written());
            Assertions.assertEquals(3, outcome.gaps().size());
            Assertions.assertTrue(outcome.gaps().get(0).startsWith("usa-diff"));
            Assertions.assertEquals(Map.of(2020, 13.0, 2021, 26.0), f.store.outputSeries(policy.runId(), "all"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void differenceHandlesZeroBaselineForPercentages() {
        Assertions.assertEquals(OptionalDouble.of(2.0), ResultCollector.difference(5.0, 3.0, false));
        Assertions.assertEquals(OptionalDouble.of(0.5), ResultCollector.difference(6.0, 4.0, true));
        Assertions.assertTrue(ResultCollector.difference(6.0, 0.0, true).isEmpty());
    }

    @Test
    void resultDefinitionsRejectUnsafeOrInconsistentSettings() {
        Assertions.assertThrows(ConfigurationException.class, () -> ResultDef.scenario("x", "../etc/passwd"));
        Assertions.assertThrows(ConfigurationException.class, () -> ResultDef.scenario("x", "/abs/file"));
        Assertions.assertThrows(ConfigurationException.class, () -> ResultDef.scenario("x", "t").asPercentage());
        Assertions.assertEquals("custom.csv", ResultDef.scenario("x", "custom.csv").fileFor("Tax"));
        Assertions.assertThrows(ConfigurationException.class, () -> Constraint.parse("region", "~=", "US"));
    }

    private static final class Fixture {
        private final SimulationStore store;
        private final TrialPaths paths;
        private final ResultCollector collector;
        private final SimulationView sim;

        private Fixture(SimulationStore store, TrialPaths paths, SimulationView sim) {
            this.store = store;
            this.paths = paths;
            this.sim = sim;
            this.collector = new ResultCollector(store, paths, 2015, 2050);
        }

        static Fixture create(Path root) {
            TrialMeshConfig config = new TrialMeshConfig(root, "test");
            Database database = new Database(config);
            database.init();
            SimulationStore store = new SimulationStore(database);
            SimulationView sim = store.createSimulation(new SimulationStore.NewSimulation("collect", 1, 1L, null, "{}"),
                    List.of(ExperimentDef.baseline("Reference"), ExperimentDef.policy("Tax")), List.of(), List.of(), 1L);
            store.scheduleRuns(sim.simId(), store.listExperiments(sim.simId()).stream().map(ExperimentView::expId).toList(),
                    List.of(0), 2L);
            return new Fixture(store, new TrialPaths(config), sim);
        }

        void writeTable(String scenario, String fileName, String content) throws IOException {
            Path dir = paths.scenarioDir(sim.simId(), 0, scenario).resolve(ResultCollector.QUERY_RESULTS_DIR);
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(fileName), content);
        }

        RunView succeed(String experiment) {
            RunView run = store.claimCandidates(sim.simId(), 10).stream()
                    .filter(r -> r.expName().equals(experiment)).findFirst().orElseThrow();
            store.claimRun(run.runId(), "w1", 3L);
            store.markRunning(run.runId(), "w1", null, 4L);
            store.markSucceeded(run.runId(), "w1", 5L);
            return store.findRun(run.runId()).orElseThrow();
        }
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

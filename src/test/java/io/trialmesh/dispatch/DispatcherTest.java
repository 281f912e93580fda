package io.trialmesh.dispatch;

import io.trialmesh.config.ConfigurationException;
import io.trialmesh.config.DispatchSettings;
import io.trialmesh.config.TrialMeshConfig;
import io.trialmesh.model.ExperimentDef;
import io.trialmesh.model.RunStatus;
import io.trialmesh.model.RunView;
import io.trialmesh.model.SimulationView;
import io.trialmesh.observability.AuditLogger;
import io.trialmesh.storage.Database;
import io.trialmesh.storage.SimulationStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

final class DispatcherTest {

    @Test
    void workerPoolFollowsOutstandingWork() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-dispatch-pool-");
        try {
            SimulationStore store = newStore(root);
            SimulationView sim = createSimulation(store, 5);
            RecordingCluster cluster = new RecordingCluster(10);
            Dispatcher dispatcher = new Dispatcher(store, cluster, DispatchSettings.defaults().withMaxWorkers(3),
                    new AuditLogger(root.resolve("audit.log"), "test"), new AtomicLong(1_000L)::get);

            SimulationStore.ScheduleOutcome scheduled = dispatcher.schedule(sim.simId(), List.of(), List.of(0, 1, 2, 3, 4));
            Assertions.assertEquals(10, scheduled.created());

            ControlTick first = dispatcher.tick(sim.simId());
            Assertions.assertEquals(3, first.requiredWorkers());
            Assertions.assertEquals(3, first.submitted());
            Assertions.assertEquals(3, cluster.submitted.size());
            Assertions.assertEquals("w" + sim.simId() + "-1", cluster.submitted.get(0).workerId());

            ControlTick second = dispatcher.tick(sim.simId());
            Assertions.assertEquals(0, second.submitted());
            Assertions.assertFalse(second.idle());

            SimulationStore.CancelResult cancelled = dispatcher.cancel(sim.simId(), SimulationStore.CancelMode.SOFT, "operator");
            Assertions.assertEquals(10, cancelled.aborted());
            Assertions.assertEquals(3, cluster.cancelled.size());

            ControlTick afterCancel = dispatcher.tick(sim.simId());
            Assertions.assertEquals(0, afterCancel.submitted());
            Assertions.assertTrue(afterCancel.idle());
            Assertions.assertEquals(1, cluster.releaseCalls);

            DispatchSummary summary = dispatcher.summarize(sim.simId());
            Assertions.assertTrue(summary.cancelled());
            Assertions.assertEquals(10, summary.total(RunStatus.ABORTED));
            Assertions.assertEquals(10, summary.failures().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void submissionStopsAtClusterCapacity() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-dispatch-slots-");
        try {
            SimulationStore store = newStore(root);
            SimulationView sim = createSimulation(store, 4);
            RecordingCluster cluster = new RecordingCluster(1);
            Dispatcher dispatcher = new Dispatcher(store, cluster, DispatchSettings.defaults().withMaxWorkers(8), null,
                    new AtomicLong(1L)::get);
            dispatcher.schedule(sim.simId(), List.of(), List.of(0, 1, 2, 3));

            ControlTick tick = dispatcher.tick(sim.simId());
            Assertions.assertEquals(8, tick.requiredWorkers());
            Assertions.assertEquals(1, tick.submitted());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void scheduleAlwaysIncludesBaselineAndRejectsUnknownExperiments() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-dispatch-schedule-");
        try {
            SimulationStore store = newStore(root);
            SimulationView sim = createSimulation(store, 2);
            Dispatcher dispatcher = new Dispatcher(store, new RecordingCluster(1), DispatchSettings.defaults(), null,
                    new AtomicLong(1L)::get);

            SimulationStore.ScheduleOutcome outcome = dispatcher.schedule(sim.simId(), List.of("Tax"), List.of(1));
            Assertions.assertEquals(2, outcome.created());
            Assertions.assertThrows(ConfigurationException.class, () -> dispatcher.schedule(sim.simId(), List.of("Nope"), List.of(0)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tickFailsRunsPastTheirDeadlineAndSchedulesRetries() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-dispatch-timeout-");
        try {
            SimulationStore store = newStore(root);
            SimulationView sim = createSimulation(store, 1);
            AtomicLong clock = new AtomicLong(0L);
            Dispatcher dispatcher = new Dispatcher(store, new RecordingCluster(0),
                    DispatchSettings.defaults().withTimeouts(1_000L, 10L).withRetries(1), null, clock::get);
            dispatcher.schedule(sim.simId(), List.of(), List.of(0));

            RunView baseline = store.claimCandidates(sim.simId(), 1).get(0);
            store.claimRun(baseline.runId(), "w1", 0L);
            store.markRunning(baseline.runId(), "w1", null, 0L);

            clock.set(5_000L);
            ControlTick tick = dispatcher.tick(sim.simId());
            Assertions.assertEquals(1, tick.timedOut());
            Assertions.assertEquals(1, tick.retried());
            Assertions.assertEquals(0, tick.cascaded());
            Assertions.assertEquals(RunStatus.FAILED, store.findRun(baseline.runId()).orElseThrow().status());
            Assertions.assertEquals(2, tick.counts().pending());
        } finally {
            deleteRecursively(root);
        }
    }

    private static SimulationStore newStore(Path root) {
        Database database = new Database(new TrialMeshConfig(root, "test"));
        database.init();
        return new SimulationStore(database);
    }

    private static SimulationView createSimulation(SimulationStore store, int trials) {
        return store.createSimulation(new SimulationStore.NewSimulation("dispatch", trials, 1L, null, "{}"),
                List.of(ExperimentDef.baseline("Reference"), ExperimentDef.policy("Tax")), List.of(), List.of(), 1L);
    }

    private static final class RecordingCluster implements ClusterManager {
        private final int slots;
        private final List<WorkerLaunch> submitted = new ArrayList<>();
        private final List<String> cancelled = new ArrayList<>();
        private final Set<String> active = new HashSet<>();
        private int releaseCalls;

        private RecordingCluster(int slots) {
            this.slots = slots;
        }

        @Override
        public String submitWorker(WorkerLaunch launch) {
            submitted.add(launch);
            String jobId = "job-" + submitted.size();
            active.add(jobId);
            return jobId;
        }

        @Override
        public void cancel(String jobId) {
            cancelled.add(jobId);
            active.remove(jobId);
        }

        @Override
        public JobState poll(String jobId) {
            return active.contains(jobId) ? JobState.RUNNING : JobState.DONE;
        }

        @Override
        public int availableSlots() {
            return Math.max(0, slots - active.size());
        }

        @Override
        public int activeJobs() {
            return active.size();
        }

        @Override
        public int releaseIdle(Set<String> busyJobIds) {
            releaseCalls++;
            int released = 0;
            for (String jobId : Set.copyOf(active)) {
                if (!busyJobIds.contains(jobId)) {
                    active.remove(jobId);
                    released++;
                }
            }
            return released;
        }

        @Override
        public void close() {
            active.clear();
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

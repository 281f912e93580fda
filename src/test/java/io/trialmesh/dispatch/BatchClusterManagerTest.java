package io.trialmesh.dispatch;

import io.trialmesh.config.DispatchSettings;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

final class BatchClusterManagerTest {

    @Test
    void parsesJobIdsFromCommonSubmitOutputs() {
        Assertions.assertEquals("4242", BatchClusterManager.parseJobId("4242\n"));
        Assertions.assertEquals("4242", BatchClusterManager.parseJobId("4242;cluster-a"));
        Assertions.assertEquals("981.head", BatchClusterManager.parseJobId("Submitted batch job 981.head\nextra"));
        Assertions.assertThrows(ClusterException.class, () -> BatchClusterManager.parseJobId(""));
        Assertions.assertThrows(ClusterException.class, () -> BatchClusterManager.parseJobId("job id is $(rm)"));
    }

    @Test
    void fillLeavesUnknownPlaceholdersUntouched() {
        String filled = BatchClusterManager.fill("run {simId} as {workerId} in {unknown}", Map.of("simId", "3", "workerId", "w3-1"));
        Assertions.assertEquals("run 3 as w3-1 in {unknown}", filled);
    }

    @Test
    void submitPollAndReleaseRunThroughCommandTemplates() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-batch-");
        try {
            Path submitted = root.resolve("submitted.txt");
            DispatchSettings.BatchCommands commands = new DispatchSettings.BatchCommands(
                    "echo '{workerCommand}' > " + submitted + " && echo 'Submitted batch job 4242'",
                    "true",
                    "echo PENDING",
                    "trialmesh --root {root} worker {simId} --worker-id {workerId}",
                    2
            );
            BatchClusterManager cluster = new BatchClusterManager(commands, root);

            String jobId = cluster.submitWorker(WorkerLaunch.forSimulation(7, "w7-1"));
            Assertions.assertEquals("4242", jobId);
            Assertions.assertEquals("trialmesh --root " + root + " worker 7 --worker-id w7-1",
                    Files.readString(submitted).strip());
            Assertions.assertEquals(JobState.PENDING, cluster.poll(jobId));
            Assertions.assertEquals(1, cluster.activeJobs());
            Assertions.assertEquals(1, cluster.availableSlots());

            Assertions.assertEquals(0, cluster.releaseIdle(Set.of(jobId)));
            Assertions.assertEquals(1, cluster.releaseIdle(Set.of()));
            Assertions.assertTrue(cluster.trackedJobs().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failingSubmitIsAClusterError() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-batch-fail-");
        try {
            DispatchSettings.BatchCommands commands = new DispatchSettings.BatchCommands("exit 3", "true", "true", "worker", null);
            BatchClusterManager cluster = new BatchClusterManager(commands, root);
            Assertions.assertThrows(ClusterException.class, () -> cluster.submitWorker(WorkerLaunch.forSimulation(1, "w1-1")));
            Assertions.assertEquals(JobState.DONE, cluster.poll("missing"));
        } finally {
            deleteRecursively(root);
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

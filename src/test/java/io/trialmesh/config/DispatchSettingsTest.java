package io.trialmesh.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class DispatchSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-settings-default-");
        try {
            DispatchSettings settings = DispatchSettings.load(root.resolve("absent.json"));
            Assertions.assertEquals(TrialMeshConfig.DEFAULT_MAX_WORKERS, settings.maxWorkers());
            Assertions.assertEquals(DispatchSettings.LOCAL_CLUSTER, settings.clusterManager());
            Assertions.assertTrue(settings.idleShutdown());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesOverrideAndAreSanitized() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-settings-file-");
        try {
            Path file = root.resolve("trialmesh-settings.json");
            Files.writeString(file, """
                    {
                      "maxWorkers": 0,
                      "maxRetries": 5,
                      "idleShutdown": false,
                      "startYear": 2020,
                      "endYear": 2010,
                      "clusterManager": "BATCH",
                      "batch": {"submitCommand": "qsub {jobName}"},
                      "variables": {"Python": "/opt/py"}
                    }
                    """);
            DispatchSettings settings = DispatchSettings.load(file);
            Assertions.assertEquals(1, settings.maxWorkers());
            Assertions.assertEquals(5, settings.maxRetries());
            Assertions.assertFalse(settings.idleShutdown());
            Assertions.assertEquals(2020, settings.endYear());
            Assertions.assertEquals(DispatchSettings.BATCH_CLUSTER, settings.clusterManager());
            Assertions.assertEquals("qsub {jobName}", settings.batch().submitCommand());
            Assertions.assertEquals("scancel {jobId}", settings.batch().cancelCommand());
            Assertions.assertEquals("/opt/py", settings.configVariables().get("Python").orElseThrow());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownClusterManagerIsRejected() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-settings-bad-");
        try {
            Path file = root.resolve("trialmesh-settings.json");
            Files.writeString(file, "{\"clusterManager\": \"kubernetes\"}");
            Assertions.assertThrows(ConfigurationException.class, () -> DispatchSettings.load(file));
            Files.writeString(file, "{not json");
            Assertions.assertThrows(ConfigurationException.class, () -> DispatchSettings.load(file));
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

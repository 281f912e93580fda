package io.trialmesh.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void chainSurvivesReopenAndDetectsTampering() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger first = new AuditLogger(file, "proj");
            first.log(AuditLogger.AuditEvent.of("run.start", "w1", "run:1", "ok", 1L, 1L, Map.of("trial", 0)));
            first.log(AuditLogger.AuditEvent.of("run.succeeded", "w1", "run:1", "ok", 1L, 1L, null));

            AuditLogger reopened = new AuditLogger(file, "proj");
            Assertions.assertEquals(first.currentHash(), reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("run.failed", "w2", "run:2", "exhausted", 1L, 2L, Map.of("cause", "exit 1")));
            Assertions.assertEquals(3, reopened.verifyChain());

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(1, lines.get(1).replace("run.succeeded", "run.failed"));
            Files.write(file, lines, StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalStateException.class, reopened::verifyChain);
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

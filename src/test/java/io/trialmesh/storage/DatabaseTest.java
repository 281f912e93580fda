package io.trialmesh.storage;

import io.trialmesh.config.TrialMeshConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.stream.Stream;

final class DatabaseTest {
    @Test
    void initIsIdempotentAndRecordsMigrationsOnce() throws Exception {
        Path root = Files.createTempDirectory("trialmesh-db-");
        try {
            Database database = new Database(new TrialMeshConfig(root, "test"));
            database.init();
            List<Database.AppliedMigration> first = database.listSchemaMigrations(50);
            database.init();
            List<Database.AppliedMigration> second = database.listSchemaMigrations(50);

            Assertions.assertEquals(2, first.size());
            Assertions.assertEquals(first, second);
            Assertions.assertEquals("20261019_002_run_timeout_scan", first.get(0).version());
            Assertions.assertEquals(64, first.get(0).checksum().length());

            try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
                try (ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
                    Assertions.assertTrue(rs.next());
                    Assertions.assertTrue("wal".equalsIgnoreCase(rs.getString(1)));
                }
                try (ResultSet rs = st.executeQuery(
                        "SELECT name FROM sqlite_master WHERE type='view' ORDER BY name")) {
                    StringBuilder views = new StringBuilder();
                    while (rs.next()) {
                        views.append(rs.getString(1)).append(',');
                    }
                    Assertions.assertEquals("param_view,result_view,run_info,status_summary,", views.toString());
                }
            }
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

package io.trialmesh.storage;

import io.trialmesh.config.TrialMeshConfig;
import io.trialmesh.util.Hashing;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

public final class Database {
    private static final Map<String, String> EXPECTED_PRAGMAS = Map.of(
            "journal_mode", "wal",
            "foreign_keys", "1"
    );
    private static final List<Migration> MIGRATIONS = List.of(
            new Migration(
                    "20261019_001_output_lookup_indexes",
                    "Index outputs by result name for result_view scans",
                    List.of(
                            "CREATE INDEX IF NOT EXISTS idx_output_value_result ON output_value(result_name)",
                            "CREATE INDEX IF NOT EXISTS idx_output_series_result ON output_series(result_name, year)"
                    )
            ),
            new Migration(
                    "20261019_002_run_timeout_scan",
                    "Index runs by status and start time for timeout sweeps",
                    List.of("CREATE INDEX IF NOT EXISTS idx_run_status_started ON run(status, started_at_ms)")
            )
    );

    private final TrialMeshConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(TrialMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.connectionProperties = new Properties();
        // Per-connection pragmas; sqlite-jdbc applies them on open.
        connectionProperties.setProperty("foreign_keys", "true");
        connectionProperties.setProperty("busy_timeout", Long.toString(TrialMeshConfig.DEFAULT_BUSY_TIMEOUT_MS));
        connectionProperties.setProperty("transaction_mode", "IMMEDIATE");
    }

    public void init() {
        initDirectories();
        applyAndValidatePragmas();
        initSchema();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.sandboxDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS simulation (
                        sim_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        name TEXT NOT NULL UNIQUE,
                        trial_count INTEGER NOT NULL,
                        seed INTEGER NOT NULL,
                        description TEXT,
                        definition TEXT,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS experiment (
                        exp_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        sim_id INTEGER NOT NULL,
                        name TEXT NOT NULL,
                        role TEXT NOT NULL,
                        description TEXT,
                        created_at_ms INTEGER NOT NULL,
                        UNIQUE(sim_id, name),
                        FOREIGN KEY(sim_id) REFERENCES simulation(sim_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS trial (
                        sim_id INTEGER NOT NULL,
                        trial_num INTEGER NOT NULL,
                        PRIMARY KEY(sim_id, trial_num),
                        FOREIGN KEY(sim_id) REFERENCES simulation(sim_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS parameter (
                        param_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        sim_id INTEGER NOT NULL,
                        name TEXT NOT NULL,
                        mode TEXT NOT NULL,
                        dist_spec TEXT NOT NULL,
                        low_bound REAL,
                        high_bound REAL,
                        apply_op TEXT NOT NULL DEFAULT 'direct',
                        active INTEGER NOT NULL DEFAULT 1,
                        UNIQUE(sim_id, name),
                        FOREIGN KEY(sim_id) REFERENCES simulation(sim_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS input_value (
                        param_id INTEGER NOT NULL,
                        sim_id INTEGER NOT NULL,
                        trial_num INTEGER NOT NULL,
                        exp_id INTEGER NOT NULL DEFAULT 0,
                        value REAL NOT NULL,
                        PRIMARY KEY(param_id, trial_num, exp_id),
                        FOREIGN KEY(param_id) REFERENCES parameter(param_id),
                        FOREIGN KEY(sim_id, trial_num) REFERENCES trial(sim_id, trial_num)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS run (
                        run_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        sim_id INTEGER NOT NULL,
                        exp_id INTEGER NOT NULL,
                        trial_num INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        worker_id TEXT,
                        job_id TEXT,
                        retry_count INTEGER NOT NULL DEFAULT 0,
                        cause TEXT,
                        queued_at_ms INTEGER,
                        started_at_ms INTEGER,
                        ended_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(exp_id) REFERENCES experiment(exp_id),
                        FOREIGN KEY(sim_id, trial_num) REFERENCES trial(sim_id, trial_num)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS output_value (
                        run_id INTEGER NOT NULL,
                        result_name TEXT NOT NULL,
                        value REAL,
                        PRIMARY KEY(run_id, result_name),
                        FOREIGN KEY(run_id) REFERENCES run(run_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS output_series (
                        run_id INTEGER NOT NULL,
                        result_name TEXT NOT NULL,
                        year INTEGER NOT NULL,
                        value REAL NOT NULL,
                        PRIMARY KEY(run_id, result_name, year),
                        FOREIGN KEY(run_id) REFERENCES run(run_id)
                    )
                    """);

            // At most one non-terminal run per (trial, experiment).
            st.execute("""
                    CREATE UNIQUE INDEX IF NOT EXISTS ux_run_active
                    ON run(sim_id, exp_id, trial_num)
                    WHERE status IN ('PENDING','QUEUED','RUNNING')
                    """);
            st.execute("""
                    CREATE UNIQUE INDEX IF NOT EXISTS ux_experiment_baseline
                    ON experiment(sim_id)
                    WHERE role='BASELINE'
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_run_sim_status ON run(sim_id, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_run_sim_trial ON run(sim_id, trial_num, exp_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_input_value_sim_trial ON input_value(sim_id, trial_num)");

            st.execute("""
                    CREATE VIEW IF NOT EXISTS status_summary AS
                    SELECT r.sim_id AS sim_id, e.name AS exp_name, r.status AS status, COUNT(*) AS run_count
                    FROM run r JOIN experiment e ON e.exp_id = r.exp_id
                    GROUP BY r.sim_id, e.name, r.status
                    """);
            st.execute("""
                    CREATE VIEW IF NOT EXISTS result_view AS
                    SELECT o.run_id AS run_id, r.sim_id AS sim_id, r.exp_id AS exp_id, r.trial_num AS trial_num,
                           e.name AS exp_name, o.result_name AS result_name, o.value AS value
                    FROM output_value o
                    JOIN run r ON r.run_id = o.run_id
                    JOIN experiment e ON e.exp_id = r.exp_id
                    """);
            st.execute("""
                    CREATE VIEW IF NOT EXISTS param_view AS
                    SELECT iv.sim_id AS sim_id, iv.trial_num AS trial_num, iv.exp_id AS exp_id,
                           p.name AS param_name, iv.value AS value
                    FROM input_value iv JOIN parameter p ON p.param_id = iv.param_id
                    """);
            st.execute("""
                    CREATE VIEW IF NOT EXISTS run_info AS
                    SELECT r.run_id AS run_id, r.sim_id AS sim_id, r.exp_id AS exp_id, r.trial_num AS trial_num,
                           e.name AS exp_name, e.role AS role, r.status AS status, r.retry_count AS retry_count,
                           r.worker_id AS worker_id, r.job_id AS job_id, r.cause AS cause,
                           r.queued_at_ms AS queued_at_ms, r.started_at_ms AS started_at_ms,
                           r.ended_at_ms AS ended_at_ms, r.created_at_ms AS created_at_ms
                    FROM run r JOIN experiment e ON e.exp_id = r.exp_id
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL
                    )
                    """);
        }
    }

    /**
     * Applies every migration whose version is not yet in the ledger. Each one runs in its own
     * transaction together with its ledger row. A recorded migration whose statements have
     * changed since it was applied fails initialization.
     */
    private void applyVersionedMigrations(Connection conn) throws SQLException {
        Map<String, String> applied = appliedChecksums(conn);
        for (Migration migration : MIGRATIONS) {
            String recorded = applied.get(migration.version());
            if (recorded == null) {
                apply(conn, migration);
            } else if (!recorded.equals(migration.checksum())) {
                throw new IllegalStateException("Migration " + migration.version() + " was modified after it was applied");
            }
        }
    }

    private static Map<String, String> appliedChecksums(Connection conn) throws SQLException {
        Map<String, String> out = new HashMap<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT version, checksum FROM schema_migrations")) {
            while (rs.next()) {
                out.put(rs.getString(1), rs.getString(2));
            }
        }
        return out;
    }

    private static void apply(Connection conn, Migration migration) throws SQLException {
        conn.setAutoCommit(false);
        try (Statement st = conn.createStatement();
             PreparedStatement ledger = conn.prepareStatement(
                     "INSERT INTO schema_migrations(version, description, checksum, applied_at_ms) VALUES(?,?,?,?)")) {
            for (String sql : migration.statements()) {
                st.execute(sql);
            }
            ledger.setString(1, migration.version());
            ledger.setString(2, migration.description());
            ledger.setString(3, migration.checksum());
            ledger.setLong(4, Instant.now().toEpochMilli());
            ledger.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private record Migration(String version, String description, List<String> statements) {
        String checksum() {
            return Hashing.sha256Hex(version + "\n" + String.join(";\n", statements));
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            for (Map.Entry<String, String> expected : EXPECTED_PRAGMAS.entrySet()) {
                try (ResultSet rs = st.executeQuery("PRAGMA " + expected.getKey())) {
                    String actual = rs.next() ? rs.getString(1) : null;
                    if (!expected.getValue().equalsIgnoreCase(actual)) {
                        throw new IllegalStateException("SQLite " + expected.getKey() + " is " + actual + ", wanted " + expected.getValue());
                    }
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    public List<AppliedMigration> listSchemaMigrations(int limit) {
        List<AppliedMigration> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT version, description, checksum, applied_at_ms FROM schema_migrations ORDER BY version DESC LIMIT ?")) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new AppliedMigration(rs.getString(1), rs.getString(2), rs.getString(3), rs.getLong(4)));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record AppliedMigration(String version, String description, String checksum, long appliedAtMs) {
    }
}

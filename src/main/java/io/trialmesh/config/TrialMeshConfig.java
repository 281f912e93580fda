package io.trialmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TrialMeshConfig {
    public static final String DEFAULT_PROJECT = "default";
    public static final int DEFAULT_MAX_WORKERS = 4;
    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final long DEFAULT_RUN_TIMEOUT_MS = 60L * 60L * 1000L;
    public static final long DEFAULT_POLL_INTERVAL_MS = 500L;
    public static final int DEFAULT_CLAIM_BATCH_SIZE = 16;
    public static final int DEFAULT_START_YEAR = 2015;
    public static final int DEFAULT_END_YEAR = 2050;
    public static final long DEFAULT_BUSY_TIMEOUT_MS = 10_000L;

    private final Path rootDir;
    private final String project;

    public TrialMeshConfig(Path rootDir, String project) {
        this.rootDir = rootDir;
        this.project = project;
    }

    public static TrialMeshConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_PROJECT);
    }

    public static TrialMeshConfig fromRoot(String root, String project) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new TrialMeshConfig(resolved.toAbsolutePath().normalize(), sanitizeProject(project));
    }

    private static String sanitizeProject(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_PROJECT : raw.trim();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = Character.isLetterOrDigit(ch) || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.isBlank() || value.startsWith(".")) {
            return DEFAULT_PROJECT;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public String project() {
        return project;
    }

    public Path dbFile() {
        return rootDir.resolve("trialmesh.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("trialmesh-settings.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path sandboxDir() {
        return rootDir.resolve("sandbox").resolve(project);
    }

    public Path batchDir() {
        return rootDir.resolve("batch");
    }
}

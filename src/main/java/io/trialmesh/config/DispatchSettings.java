package io.trialmesh.config;

import io.trialmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Dispatcher tuning and configuration variables, read from {@code trialmesh-settings.json}.
 * Missing or out-of-range fields fall back to the {@link TrialMeshConfig} defaults.
 */
public record DispatchSettings(
        int maxWorkers,
        int maxRetries,
        long runTimeoutMs,
        long pollIntervalMs,
        boolean idleShutdown,
        int claimBatchSize,
        int startYear,
        int endYear,
        String clusterManager,
        BatchCommands batch,
        Map<String, String> variables
) {
    public static final String LOCAL_CLUSTER = "local";
    public static final String BATCH_CLUSTER = "batch";

    public DispatchSettings {
        variables = variables == null ? Map.of() : Map.copyOf(variables);
        batch = batch == null ? BatchCommands.defaults() : batch;
    }

    public static DispatchSettings defaults() {
        return new DispatchSettings(
                TrialMeshConfig.DEFAULT_MAX_WORKERS,
                TrialMeshConfig.DEFAULT_MAX_RETRIES,
                TrialMeshConfig.DEFAULT_RUN_TIMEOUT_MS,
                TrialMeshConfig.DEFAULT_POLL_INTERVAL_MS,
                true,
                TrialMeshConfig.DEFAULT_CLAIM_BATCH_SIZE,
                TrialMeshConfig.DEFAULT_START_YEAR,
                TrialMeshConfig.DEFAULT_END_YEAR,
                LOCAL_CLUSTER,
                BatchCommands.defaults(),
                Map.of()
        );
    }

    public static DispatchSettings load(Path file) {
        DispatchSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(parsed, defaults);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read settings file: " + file, e);
        }
    }

    static DispatchSettings fromFile(SettingsFile file, DispatchSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int startYear = sanitizeInt(file.startYear(), defaults.startYear(), 0);
        int endYear = sanitizeInt(file.endYear(), defaults.endYear(), startYear);
        String cluster = file.clusterManager() == null || file.clusterManager().isBlank()
                ? defaults.clusterManager()
                : file.clusterManager().trim().toLowerCase(Locale.ROOT);
        if (!LOCAL_CLUSTER.equals(cluster) && !BATCH_CLUSTER.equals(cluster)) {
            throw new ConfigurationException("Unknown clusterManager: " + file.clusterManager());
        }
        BatchCommands batch = file.batch() == null
                ? defaults.batch()
                : BatchCommands.merge(file.batch(), defaults.batch());
        Map<String, String> variables = new LinkedHashMap<>(defaults.variables());
        if (file.variables() != null) {
            file.variables().forEach((k, v) -> variables.put(k, v == null ? "" : v));
        }
        return new DispatchSettings(
                sanitizeInt(file.maxWorkers(), defaults.maxWorkers(), 1),
                sanitizeInt(file.maxRetries(), defaults.maxRetries(), 0),
                sanitizeLong(file.runTimeoutMs(), defaults.runTimeoutMs(), 1_000L),
                sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 10L),
                file.idleShutdown() == null ? defaults.idleShutdown() : file.idleShutdown(),
                sanitizeInt(file.claimBatchSize(), defaults.claimBatchSize(), 1),
                startYear,
                endYear,
                cluster,
                batch,
                variables
        );
    }

    public ConfigVariables configVariables() {
        return ConfigVariables.of(variables);
    }

    public DispatchSettings withMaxWorkers(int value) {
        return new DispatchSettings(Math.max(1, value), maxRetries, runTimeoutMs, pollIntervalMs, idleShutdown,
                claimBatchSize, startYear, endYear, clusterManager, batch, variables);
    }

    public DispatchSettings withRetries(int value) {
        return new DispatchSettings(maxWorkers, Math.max(0, value), runTimeoutMs, pollIntervalMs, idleShutdown,
                claimBatchSize, startYear, endYear, clusterManager, batch, variables);
    }

    public DispatchSettings withTimeouts(long runTimeout, long pollInterval) {
        return new DispatchSettings(maxWorkers, maxRetries, runTimeout, pollInterval, idleShutdown,
                claimBatchSize, startYear, endYear, clusterManager, batch, variables);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    /**
     * Command templates for a batch resource manager. Placeholders: {@code {jobName}},
     * {@code {workerCommand}}, {@code {jobId}}, {@code {simId}}, {@code {workerId}}.
     */
    public record BatchCommands(
            String submitCommand,
            String cancelCommand,
            String pollCommand,
            String workerCommand,
            Integer maxJobs
    ) {
        public static BatchCommands defaults() {
            return new BatchCommands(
                    "sbatch --parsable --job-name={jobName} --wrap \"{workerCommand}\"",
                    "scancel {jobId}",
                    "squeue -h -j {jobId} -o %T",
                    "trialmesh --root {root} worker {simId} --worker-id {workerId}",
                    TrialMeshConfig.DEFAULT_MAX_WORKERS
            );
        }

        static BatchCommands merge(BatchCommands raw, BatchCommands defaults) {
            return new BatchCommands(
                    blankTo(raw.submitCommand(), defaults.submitCommand()),
                    blankTo(raw.cancelCommand(), defaults.cancelCommand()),
                    blankTo(raw.pollCommand(), defaults.pollCommand()),
                    blankTo(raw.workerCommand(), defaults.workerCommand()),
                    raw.maxJobs() == null ? defaults.maxJobs() : Math.max(1, raw.maxJobs())
            );
        }

        private static String blankTo(String value, String fallback) {
            return value == null || value.isBlank() ? fallback : value.trim();
        }
    }

    record SettingsFile(
            Integer maxWorkers,
            Integer maxRetries,
            Long runTimeoutMs,
            Long pollIntervalMs,
            Boolean idleShutdown,
            Integer claimBatchSize,
            Integer startYear,
            Integer endYear,
            String clusterManager,
            BatchCommands batch,
            Map<String, String> variables
    ) {
    }
}

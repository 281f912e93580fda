package io.trialmesh.dispatch;

import io.trialmesh.config.DispatchSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Submits workers to a batch resource manager by running configured command templates.
 * The scheduler's argument syntax lives entirely in the templates.
 */
public final class BatchClusterManager implements ClusterManager {
    private static final Logger logger = LoggerFactory.getLogger(BatchClusterManager.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z]+)\\}");
    private static final Pattern JOB_ID = Pattern.compile("([A-Za-z0-9_.\\-]+)");
    private static final long COMMAND_TIMEOUT_MS = 30_000L;

    private final DispatchSettings.BatchCommands commands;
    private final Path root;
    private final Map<String, WorkerLaunch> jobs = new ConcurrentHashMap<>();

    public BatchClusterManager(DispatchSettings.BatchCommands commands, Path root) {
        this.commands = commands;
        this.root = root;
    }

    @Override
    public String submitWorker(WorkerLaunch launch) {
        Map<String, String> vars = Map.of(
                "root", root.toString(),
                "simId", Long.toString(launch.simId()),
                "workerId", launch.workerId(),
                "jobName", launch.jobName()
        );
        String workerCommand = fill(commands.workerCommand(), vars);
        Map<String, String> submitVars = new HashMap<>(vars);
        submitVars.put("workerCommand", workerCommand);
        ShellCommand.Outcome outcome = execute(fill(commands.submitCommand(), submitVars));
        if (!outcome.ok()) {
            throw new ClusterException("Worker submission failed: " + outcome.describe());
        }
        String jobId = parseJobId(outcome.output());
        jobs.put(jobId, launch);
        logger.info("Submitted worker {} as batch job {}", launch.workerId(), jobId);
        return jobId;
    }

    @Override
    public void cancel(String jobId) {
        ShellCommand.Outcome outcome = execute(fill(commands.cancelCommand(), Map.of("jobId", jobId, "root", root.toString())));
        jobs.remove(jobId);
        if (!outcome.ok()) {
            throw new ClusterException("Cancel of job " + jobId + " failed: " + outcome.describe());
        }
    }

    /**
     * Empty output or a failing poll command means the manager no longer knows the job.
     */
    @Override
    public JobState poll(String jobId) {
        ShellCommand.Outcome outcome = execute(fill(commands.pollCommand(), Map.of("jobId", jobId, "root", root.toString())));
        String state = outcome.output().strip().toUpperCase(Locale.ROOT);
        if (!outcome.ok() || state.isEmpty()) {
            jobs.remove(jobId);
            return JobState.DONE;
        }
        if (state.startsWith("PEND") || state.equals("PD") || state.equals("Q")) {
            return JobState.PENDING;
        }
        if (state.startsWith("RUN") || state.equals("R") || state.startsWith("CONFIG") || state.startsWith("COMPLETING")) {
            return JobState.RUNNING;
        }
        if (state.startsWith("COMPLETED") || state.startsWith("CANCEL") || state.startsWith("FAIL") || state.startsWith("TIMEOUT")) {
            jobs.remove(jobId);
            return JobState.DONE;
        }
        return JobState.UNKNOWN;
    }

    @Override
    public int availableSlots() {
        int max = commands.maxJobs() == null ? Integer.MAX_VALUE : commands.maxJobs();
        return Math.max(0, max - activeJobs());
    }

    @Override
    public int activeJobs() {
        int active = 0;
        for (String jobId : Set.copyOf(jobs.keySet())) {
            if (poll(jobId) != JobState.DONE) {
                active++;
            }
        }
        return active;
    }

    /**
     * Batch workers exit on their own once no work remains; idle release only cancels jobs
     * still waiting in the queue.
     */
    @Override
    public int releaseIdle(Set<String> busyJobIds) {
        int released = 0;
        for (String jobId : Set.copyOf(jobs.keySet())) {
            if (busyJobIds.contains(jobId) || poll(jobId) != JobState.PENDING) {
                continue;
            }
            try {
                cancel(jobId);
                released++;
            } catch (ClusterException e) {
                logger.warn("Failed to release idle job {}: {}", jobId, e.getMessage());
            }
        }
        return released;
    }

    @Override
    public void close() {
        jobs.clear();
    }

    Set<String> trackedJobs() {
        return Set.copyOf(jobs.keySet());
    }

    static String fill(String template, Map<String, String> vars) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder(template.length());
        while (m.find()) {
            String value = vars.get(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value == null ? m.group() : value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Job id from the submit output: {@code sbatch --parsable} prints {@code id[;cluster]},
     * plain submitters print a sentence ending in the id.
     */
    static String parseJobId(String output) {
        String firstLine = output == null ? "" : output.strip().split("\\R", 2)[0].trim();
        String[] words = firstLine.split("\\s+");
        String token = words[words.length - 1].split(";", 2)[0].trim();
        if (token.isEmpty() || !JOB_ID.matcher(token).matches()) {
            throw new ClusterException("Cannot parse job id from submit output: " + ShellCommand.truncate(output));
        }
        return token;
    }

    private ShellCommand.Outcome execute(String command) {
        try {
            return ShellCommand.run(command, root, COMMAND_TIMEOUT_MS);
        } catch (IOException e) {
            throw new ClusterException("Failed to run cluster command: " + command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusterException("Interrupted running cluster command: " + command, e);
        }
    }
}

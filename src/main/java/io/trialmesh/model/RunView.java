package io.trialmesh.model;

/**
 * One row of the {@code run_info} view: a run attempt with its experiment identity.
 */
public record RunView(
        long runId,
        long simId,
        long expId,
        int trialNum,
        String expName,
        ExperimentRole role,
        RunStatus status,
        int retryCount,
        String workerId,
        String jobId,
        String cause,
        Long queuedAtMs,
        Long startedAtMs,
        Long endedAtMs,
        long createdAtMs
) {
    public boolean isBaseline() {
        return role == ExperimentRole.BASELINE;
    }
}

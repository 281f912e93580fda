package io.trialmesh.dispatch;

import java.nio.file.Path;

/**
 * What a model step needs to know about the run it belongs to.
 */
public record RunContext(
        long simId,
        long runId,
        int trialNum,
        String experiment,
        String workerId,
        Path scenarioDir,
        long deadlineMs
) {
    public long remainingMs(long nowMs) {
        return deadlineMs - nowMs;
    }
}

package io.trialmesh.dispatch;

import io.trialmesh.storage.SimulationStore;

/**
 * What one controller pass did.
 */
public record ControlTick(
        int timedOut,
        int retried,
        int cascaded,
        int requiredWorkers,
        int submitted,
        int released,
        SimulationStore.ActiveCounts counts
) {
    public boolean idle() {
        return counts.total() == 0;
    }
}

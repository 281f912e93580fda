package io.trialmesh.dispatch;

import io.trialmesh.model.RunStatus;

import java.util.List;
import java.util.Map;

/**
 * Latest-attempt counts per experiment and status, plus every unit that did not succeed.
 */
public record DispatchSummary(
        long simId,
        Map<String, Map<RunStatus, Integer>> counts,
        List<FailedUnit> failures,
        boolean cancelled
) {
    public DispatchSummary {
        counts = Map.copyOf(counts);
        failures = List.copyOf(failures);
    }

    public int count(String experiment, RunStatus status) {
        return counts.getOrDefault(experiment, Map.of()).getOrDefault(status, 0);
    }

    public int total(RunStatus status) {
        int sum = 0;
        for (Map<RunStatus, Integer> byStatus : counts.values()) {
            sum += byStatus.getOrDefault(status, 0);
        }
        return sum;
    }

    public record FailedUnit(int trialNum, String experiment, RunStatus status, String cause) {
    }
}

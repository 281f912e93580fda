package io.trialmesh.sampling;

import java.util.Map;

/**
 * Per-draw inputs: the trial number, the (possibly rank-correlated) percentile in (0, 1), and
 * the draws of parameters already resolved for this trial.
 */
public record SampleContext(int trialNum, double percentile, Map<String, Double> resolved) {
    public SampleContext {
        resolved = resolved == null ? Map.of() : resolved;
    }

    public static SampleContext of(int trialNum, double percentile) {
        return new SampleContext(trialNum, percentile, Map.of());
    }
}

package io.trialmesh.dispatch;

import java.io.IOException;
import java.util.Map;

/**
 * Hands realized parameter values to the model before a run's steps execute.
 */
@FunctionalInterface
public interface TrialInputWriter {
    void write(RunContext context, Map<String, Double> values) throws IOException;
}

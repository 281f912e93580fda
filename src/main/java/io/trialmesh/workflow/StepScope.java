package io.trialmesh.workflow;

import io.trialmesh.config.ConfigurationException;
import io.trialmesh.model.ExperimentRole;

import java.util.Locale;

public enum StepScope {
    BASELINE,
    POLICY,
    ALL;

    public static StepScope fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALL;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "baseline" -> BASELINE;
            case "policy" -> POLICY;
            case "all", "both" -> ALL;
            default -> throw new ConfigurationException("Unknown step scope: " + raw);
        };
    }

    public boolean appliesTo(ExperimentRole role) {
        return this == ALL
                || (this == BASELINE && role == ExperimentRole.BASELINE)
                || (this == POLICY && role == ExperimentRole.POLICY);
    }
}

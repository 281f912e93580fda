package io.trialmesh.result;

import io.trialmesh.config.ConfigurationException;

import java.util.Locale;

public enum ResultType {
    SCENARIO,
    DIFF;

    public static ResultType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SCENARIO;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "scenario" -> SCENARIO;
            case "diff" -> DIFF;
            default -> throw new ConfigurationException("Unknown result type: " + raw);
        };
    }
}

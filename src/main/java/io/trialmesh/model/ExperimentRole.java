package io.trialmesh.model;

import java.util.Locale;

public enum ExperimentRole {
    BASELINE,
    POLICY;

    public static ExperimentRole fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return POLICY;
        }
        String v = raw.trim().toUpperCase(Locale.ROOT);
        if ("BASELINE".equals(v) || "REFERENCE".equals(v)) {
            return BASELINE;
        }
        if ("POLICY".equals(v)) {
            return POLICY;
        }
        throw new IllegalArgumentException("Unknown experiment role: " + raw);
    }
}

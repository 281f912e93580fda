package io.trialmesh.parameter;

import io.trialmesh.config.ConfigurationException;

import java.util.Locale;

/**
 * Whether one draw per trial is reused by every experiment ({@code SHARED}) or each experiment
 * draws afresh ({@code INDEPENDENT}).
 */
public enum DrawMode {
    SHARED,
    INDEPENDENT;

    public static DrawMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SHARED;
        }
        String v = raw.trim().toUpperCase(Locale.ROOT);
        for (DrawMode mode : values()) {
            if (mode.name().equals(v)) {
                return mode;
            }
        }
        throw new ConfigurationException("Unknown parameter mode: " + raw);
    }
}

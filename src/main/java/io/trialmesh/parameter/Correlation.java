package io.trialmesh.parameter;

import io.trialmesh.config.ConfigurationException;

/**
 * Target rank correlation between the declaring parameter and {@code with}.
 */
public record Correlation(String with, double coefficient) {
    public Correlation {
        if (with == null || with.isBlank()) {
            throw new ConfigurationException("Correlation target must not be blank");
        }
        if (Double.isNaN(coefficient) || coefficient < -1.0 || coefficient > 1.0) {
            throw new ConfigurationException("Correlation coefficient with '" + with + "' must be in [-1, 1]: " + coefficient);
        }
        with = with.trim();
    }
}

package io.trialmesh.workflow;

import io.trialmesh.config.ConfigurationException;

/**
 * A user variable. With {@code configVar} the value names a configuration variable (blank
 * means the same name); with {@code eval} placeholders inside the value are expanded when
 * the variable is referenced.
 */
public record StepVariable(String name, String value, boolean configVar, boolean eval) {
    public StepVariable {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Variable name cannot be empty");
        }
        name = name.trim();
        value = value == null ? "" : value;
    }

    public static StepVariable literal(String name, String value) {
        return new StepVariable(name, value, false, false);
    }

    public static StepVariable evaluated(String name, String value) {
        return new StepVariable(name, value, false, true);
    }

    public static StepVariable fromConfig(String name, String configName) {
        return new StepVariable(name, configName, true, false);
    }
}

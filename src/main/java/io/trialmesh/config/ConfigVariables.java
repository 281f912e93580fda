package io.trialmesh.config;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the configuration-variable namespace.
 */
public interface ConfigVariables {
    Optional<String> get(String name);

    Set<String> names();

    static ConfigVariables of(Map<String, String> values) {
        return new MapConfigVariables(values);
    }

    static ConfigVariables empty() {
        return new MapConfigVariables(Map.of());
    }
}

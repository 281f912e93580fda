package io.trialmesh.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class MapConfigVariables implements ConfigVariables {
    private final Map<String, String> values;

    public MapConfigVariables(Map<String, String> values) {
        this.values = values == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(values));
    }

    @Override
    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    @Override
    public Set<String> names() {
        return values.keySet();
    }
}

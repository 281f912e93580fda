package io.trialmesh.parameter;

import io.trialmesh.config.ConfigurationException;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class ApplyFunctionRegistry {
    private final Map<String, ApplyFunction> functions = new ConcurrentHashMap<>();

    public void register(String name, ApplyFunction function) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("apply function name cannot be empty");
        }
        if (ApplyOperator.isBuiltin(name)) {
            throw new IllegalArgumentException("apply function name shadows a builtin operator: " + name);
        }
        functions.put(name.trim(), function);
    }

    public Optional<ApplyFunction> find(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public ApplyFunction require(String name) {
        return find(name).orElseThrow(() -> new ConfigurationException("Unknown apply operator: " + name));
    }

    public Collection<String> names() {
        return functions.keySet();
    }
}

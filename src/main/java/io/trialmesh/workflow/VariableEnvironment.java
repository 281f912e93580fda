package io.trialmesh.workflow;

import io.trialmesh.config.ConfigVariables;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layered variable bindings used to render step templates. Configuration variables are the
 * bottom layer, user variables override them and automatic run variables override both.
 */
public final class VariableEnvironment {
    static final int MAX_EXPANSION_DEPTH = 16;

    private final Map<String, String> bindings;
    private final Set<String> evaluated;

    private VariableEnvironment(Map<String, String> bindings, Set<String> evaluated) {
        this.bindings = Map.copyOf(bindings);
        this.evaluated = Set.copyOf(evaluated);
    }

    public static Builder builder(ConfigVariables config) {
        return new Builder(config == null ? ConfigVariables.empty() : config);
    }

    /**
     * Copy with one extra automatic binding, e.g. the current step name.
     */
    public VariableEnvironment with(String name, String value) {
        Map<String, String> next = new LinkedHashMap<>(bindings);
        next.put(name, value == null ? "" : value);
        Set<String> nextEvaluated = new HashSet<>(evaluated);
        nextEvaluated.remove(name);
        return new VariableEnvironment(next, nextEvaluated);
    }

    public boolean has(String name) {
        return bindings.containsKey(name);
    }

    public String resolve(String name) {
        return resolve(name, 0);
    }

    public String render(String template) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        return render(template, 0);
    }

    public Map<String, String> bindings() {
        return bindings;
    }

    private String render(String template, int depth) {
        return Templates.render(template, name -> resolve(name, depth));
    }

    private String resolve(String name, int depth) {
        String value = bindings.get(name);
        if (value == null) {
            throw new UnresolvedVariableException(name, "Unresolved variable {" + name + "}");
        }
        if (!evaluated.contains(name)) {
            return value;
        }
        if (depth >= MAX_EXPANSION_DEPTH) {
            throw new UnresolvedVariableException(name, "Variable {" + name + "} exceeds expansion depth " + MAX_EXPANSION_DEPTH);
        }
        return render(value, depth + 1);
    }

    public static final class Builder {
        private final ConfigVariables config;
        private final Map<String, String> bindings = new LinkedHashMap<>();
        private final Set<String> evaluated = new HashSet<>();

        private Builder(ConfigVariables config) {
            this.config = config;
            for (String name : config.names()) {
                config.get(name).ifPresent(v -> bindings.put(name, v));
            }
        }

        public Builder user(List<StepVariable> variables) {
            if (variables == null) {
                return this;
            }
            for (StepVariable v : variables) {
                if (v.configVar()) {
                    String configName = v.value().isBlank() ? v.name() : v.value().trim();
                    String value = config.get(configName).orElseThrow(() -> new UnresolvedVariableException(
                            v.name(), "Variable {" + v.name() + "} refers to unknown configuration variable '" + configName + "'"));
                    bindings.put(v.name(), value);
                    evaluated.remove(v.name());
                } else {
                    bindings.put(v.name(), v.value());
                    if (v.eval()) {
                        evaluated.add(v.name());
                    } else {
                        evaluated.remove(v.name());
                    }
                }
            }
            return this;
        }

        public Builder auto(Map<String, String> values) {
            values.forEach((k, v) -> {
                bindings.put(k, v == null ? "" : v);
                evaluated.remove(k);
            });
            return this;
        }

        public VariableEnvironment build() {
            return new VariableEnvironment(bindings, evaluated);
        }
    }
}

package io.trialmesh.sampling;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A distribution kind plus its named arguments, e.g. {@code uniform{factor=1.2}}.
 */
public record DistributionSpec(DistributionKind kind, Map<String, Object> args) {
    public static final String TYPE_KEY = "type";

    public DistributionSpec {
        if (kind == null) {
            throw new DistributionSpecException("Distribution kind must not be null");
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (args != null) {
            args.forEach((k, v) -> {
                if (v != null) {
                    normalized.put(k.trim().toLowerCase(Locale.ROOT), v);
                }
            });
        }
        args = Map.copyOf(normalized);
    }

    /**
     * Builds a spec from a declaration map whose {@code type} entry names the kind and whose
     * other entries are the arguments.
     */
    public static DistributionSpec fromMap(Map<String, Object> declaration) {
        if (declaration == null || !declaration.containsKey(TYPE_KEY)) {
            throw new DistributionSpecException("Distribution declaration needs a '" + TYPE_KEY + "' entry");
        }
        Map<String, Object> args = new LinkedHashMap<>(declaration);
        Object type = args.remove(TYPE_KEY);
        return new DistributionSpec(DistributionKind.fromString(String.valueOf(type)), args);
    }

    public static DistributionSpec of(DistributionKind kind, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must come in pairs");
        }
        Map<String, Object> args = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            args.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new DistributionSpec(kind, args);
    }

    public static DistributionSpec constant(double value) {
        return of(DistributionKind.CONSTANT, "value", value);
    }

    public static DistributionSpec uniform(double min, double max) {
        return of(DistributionKind.UNIFORM, "min", min, "max", max);
    }

    public static DistributionSpec normal(double mean, double stdev) {
        return of(DistributionKind.NORMAL, "mean", mean, "stdev", stdev);
    }

    public static DistributionSpec triangle(double min, double mode, double max) {
        return of(DistributionKind.TRIANGLE, "min", min, "mode", mode, "max", max);
    }

    public static DistributionSpec sequence(List<Double> values) {
        return of(DistributionKind.SEQUENCE, "values", List.copyOf(values));
    }

    public static DistributionSpec linked(String parameter) {
        return of(DistributionKind.LINKED, "parameter", parameter);
    }

    public Set<String> argNames() {
        return new TreeSet<>(args.keySet());
    }

    public boolean has(String name) {
        return args.containsKey(name);
    }

    public double number(String name) {
        Object raw = args.get(name);
        if (raw == null) {
            throw new DistributionSpecException(kind.name().toLowerCase(Locale.ROOT) + " requires argument '" + name + "'");
        }
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            throw new DistributionSpecException("Argument '" + name + "' is not numeric: " + raw, e);
        }
    }

    public String text(String name) {
        Object raw = args.get(name);
        if (raw == null || String.valueOf(raw).isBlank()) {
            throw new DistributionSpecException(kind.name().toLowerCase(Locale.ROOT) + " requires argument '" + name + "'");
        }
        return String.valueOf(raw).trim();
    }

    /**
     * Sequence values, given either as a list or as a comma-separated string.
     */
    public List<Double> values() {
        Object raw = args.get("values");
        List<Double> out = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                out.add(parseValue(item));
            }
        } else if (raw != null) {
            for (String token : String.valueOf(raw).split(",")) {
                if (!token.isBlank()) {
                    out.add(parseValue(token.trim()));
                }
            }
        }
        if (out.isEmpty()) {
            throw new DistributionSpecException("sequence requires a non-empty 'values' list");
        }
        return out;
    }

    public String linkedParameter() {
        return kind == DistributionKind.LINKED ? text("parameter") : null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(TYPE_KEY, kind.name().toLowerCase(Locale.ROOT));
        out.putAll(args);
        return out;
    }

    private static double parseValue(Object item) {
        if (item instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(item).trim());
        } catch (NumberFormatException e) {
            throw new DistributionSpecException("Sequence value is not numeric: " + item, e);
        }
    }
}

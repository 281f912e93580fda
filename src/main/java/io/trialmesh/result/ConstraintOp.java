package io.trialmesh.result;

import io.trialmesh.config.ConfigurationException;

import java.util.Locale;

public enum ConstraintOp {
    EQUAL,
    NOT_EQUAL,
    STARTS_WITH,
    ENDS_WITH,
    CONTAINS;

    public static ConstraintOp fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Constraint operator cannot be empty");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "==", "eq", "equal" -> EQUAL;
            case "!=", "neq", "notequal" -> NOT_EQUAL;
            case "startswith" -> STARTS_WITH;
            case "endswith" -> ENDS_WITH;
            case "contains" -> CONTAINS;
            default -> throw new ConfigurationException("Unknown constraint operator: " + raw);
        };
    }

    public boolean test(String actual, String expected) {
        if (actual == null) {
            return this == NOT_EQUAL;
        }
        return switch (this) {
            case EQUAL -> actual.equals(expected);
            case NOT_EQUAL -> !actual.equals(expected);
            case STARTS_WITH -> actual.startsWith(expected);
            case ENDS_WITH -> actual.endsWith(expected);
            case CONTAINS -> actual.contains(expected);
        };
    }
}

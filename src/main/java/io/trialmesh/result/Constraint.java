package io.trialmesh.result;

import io.trialmesh.config.ConfigurationException;

import java.util.Map;

public record Constraint(String column, ConstraintOp op, String value) {
    public Constraint {
        if (column == null || column.isBlank()) {
            throw new ConfigurationException("Constraint column cannot be empty");
        }
        if (op == null) {
            throw new ConfigurationException("Constraint operator is required for column " + column);
        }
        column = column.trim();
        value = value == null ? "" : value;
    }

    public static Constraint parse(String column, String op, String value) {
        return new Constraint(column, ConstraintOp.fromString(op), value);
    }

    public boolean matches(Map<String, String> row) {
        return op.test(row.get(column), value);
    }
}

package io.trialmesh.parameter;

import java.util.Locale;

/**
 * How a draw is merged into its target input. Names other than the builtins refer to an
 * {@link ApplyFunction} registered in an {@link ApplyFunctionRegistry}.
 */
public record ApplyOperator(Kind kind, String functionName) {
    public enum Kind {
        DIRECT,
        REPLACE,
        ADD,
        MULTIPLY,
        CUSTOM
    }

    public static ApplyOperator parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new ApplyOperator(Kind.DIRECT, null);
        }
        String v = raw.trim();
        Kind builtin = builtin(v);
        return builtin == null ? new ApplyOperator(Kind.CUSTOM, v) : new ApplyOperator(builtin, null);
    }

    static boolean isBuiltin(String raw) {
        return builtin(raw.trim()) != null;
    }

    private static Kind builtin(String v) {
        switch (v.toLowerCase(Locale.ROOT)) {
            case "direct":
                return Kind.DIRECT;
            case "replace":
                return Kind.REPLACE;
            case "add":
                return Kind.ADD;
            case "mult":
            case "multiply":
                return Kind.MULTIPLY;
            default:
                return null;
        }
    }
}

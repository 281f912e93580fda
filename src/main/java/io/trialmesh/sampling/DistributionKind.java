package io.trialmesh.sampling;

import java.util.Locale;

public enum DistributionKind {
    CONSTANT(false),
    UNIFORM(true),
    LOGUNIFORM(true),
    NORMAL(true),
    LOGNORMAL(true),
    TRIANGLE(true),
    INTEGERS(true),
    GRID(false),
    SEQUENCE(false),
    BINARY(true),
    LINKED(false);

    private final boolean random;

    DistributionKind(boolean random) {
        this.random = random;
    }

    /**
     * Whether draws come from a percentile; the other kinds depend only on the trial number or
     * another parameter.
     */
    public boolean isRandom() {
        return random;
    }

    public static DistributionKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new DistributionSpecException("Distribution type must not be blank");
        }
        String v = raw.trim().toUpperCase(Locale.ROOT).replace("_", "").replace("-", "");
        switch (v) {
            case "TRIANGULAR":
                return TRIANGLE;
            case "INTEGER":
                return INTEGERS;
            case "LOGNORMAL":
                return LOGNORMAL;
            case "LOGUNIFORM":
                return LOGUNIFORM;
            default:
                break;
        }
        for (DistributionKind kind : values()) {
            if (kind.name().equals(v)) {
                return kind;
            }
        }
        throw new DistributionSpecException("Unknown distribution type: " + raw);
    }
}

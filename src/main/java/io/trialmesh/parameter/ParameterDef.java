package io.trialmesh.parameter;

import io.trialmesh.config.ConfigurationException;
import io.trialmesh.sampling.DistributionKind;
import io.trialmesh.sampling.DistributionSpec;

import java.util.ArrayList;
import java.util.List;

public record ParameterDef(
        String name,
        DistributionSpec distribution,
        DrawMode mode,
        Double lowBound,
        Double highBound,
        String apply,
        List<Correlation> correlations,
        boolean active
) {
    public static final String DEFAULT_APPLY = "direct";

    public ParameterDef {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Parameter name must not be blank");
        }
        if (distribution == null) {
            throw new ConfigurationException("Parameter '" + name + "' has no distribution");
        }
        if (lowBound != null && highBound != null && lowBound > highBound) {
            throw new ConfigurationException("Parameter '" + name + "' has lowbound " + lowBound + " above highbound " + highBound);
        }
        name = name.trim();
        mode = mode == null ? DrawMode.SHARED : mode;
        apply = apply == null || apply.isBlank() ? DEFAULT_APPLY : apply.trim();
        correlations = correlations == null ? List.of() : List.copyOf(correlations);
    }

    public static ParameterDef shared(String name, DistributionSpec distribution) {
        return new ParameterDef(name, distribution, DrawMode.SHARED, null, null, DEFAULT_APPLY, List.of(), true);
    }

    public static ParameterDef independent(String name, DistributionSpec distribution) {
        return new ParameterDef(name, distribution, DrawMode.INDEPENDENT, null, null, DEFAULT_APPLY, List.of(), true);
    }

    public ParameterDef bounded(Double low, Double high) {
        return new ParameterDef(name, distribution, mode, low, high, apply, correlations, active);
    }

    public ParameterDef applying(String operator) {
        return new ParameterDef(name, distribution, mode, lowBound, highBound, operator, correlations, active);
    }

    public ParameterDef correlatedWith(String other, double coefficient) {
        List<Correlation> next = new ArrayList<>(correlations);
        next.add(new Correlation(other, coefficient));
        return new ParameterDef(name, distribution, mode, lowBound, highBound, apply, next, active);
    }

    public ParameterDef inactive() {
        return new ParameterDef(name, distribution, mode, lowBound, highBound, apply, correlations, false);
    }

    public boolean isLinked() {
        return distribution.kind() == DistributionKind.LINKED;
    }

    public String linkTarget() {
        return distribution.linkedParameter();
    }
}

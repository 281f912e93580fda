package io.trialmesh.parameter;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Supplies the existing value of a parameter's target input for one experiment.
 */
@FunctionalInterface
public interface BaseValueSource {
    BaseValueSource NONE = (parameterName, experiment) -> OptionalDouble.empty();

    OptionalDouble baseValue(String parameterName, String experiment);

    static BaseValueSource of(Map<String, Double> values) {
        Map<String, Double> copy = Map.copyOf(values);
        return (parameterName, experiment) -> {
            Double value = copy.get(parameterName);
            return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
        };
    }
}

package io.trialmesh.parameter;

/**
 * Custom combination of a draw with the target input's base value, registered by name.
 */
@FunctionalInterface
public interface ApplyFunction {
    double apply(String parameterName, double draw, double baseValue);
}

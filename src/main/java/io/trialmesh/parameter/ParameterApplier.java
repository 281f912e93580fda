package io.trialmesh.parameter;

import java.util.OptionalDouble;

/**
 * Combines a draw with the target's base value through the parameter's apply operator, then
 * clamps the combined value into the parameter's bounds.
 */
public final class ParameterApplier {
    private final ApplyFunctionRegistry functions;

    public ParameterApplier(ApplyFunctionRegistry functions) {
        this.functions = functions;
    }

    /**
     * Fails with a configuration error when the operator names an unregistered function.
     */
    public ApplyOperator validate(ParameterDef def) {
        ApplyOperator operator = ApplyOperator.parse(def.apply());
        if (operator.kind() == ApplyOperator.Kind.CUSTOM) {
            functions.require(operator.functionName());
        }
        return operator;
    }

    public double realize(ParameterDef def, double draw, OptionalDouble base) {
        ApplyOperator operator = ApplyOperator.parse(def.apply());
        double combined = switch (operator.kind()) {
            case DIRECT, REPLACE -> draw;
            case ADD -> base.orElse(0.0) + draw;
            case MULTIPLY -> base.orElse(1.0) * draw;
            case CUSTOM -> functions.require(operator.functionName()).apply(def.name(), draw, base.orElse(Double.NaN));
        };
        return clamp(combined, def.lowBound(), def.highBound());
    }

    public double realize(ParameterDef def, double draw, double base) {
        return realize(def, draw, OptionalDouble.of(base));
    }

    static double clamp(double value, Double low, Double high) {
        double out = value;
        if (low != null && out < low) {
            out = low;
        }
        if (high != null && out > high) {
            out = high;
        }
        return out;
    }
}

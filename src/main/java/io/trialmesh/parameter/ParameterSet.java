package io.trialmesh.parameter;

import java.util.List;

public record ParameterSet(List<ParameterDef> parameters, long seed) {
    public ParameterSet {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}

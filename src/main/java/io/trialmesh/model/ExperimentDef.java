package io.trialmesh.model;

public record ExperimentDef(String name, ExperimentRole role, String description) {
    public static ExperimentDef baseline(String name) {
        return new ExperimentDef(name, ExperimentRole.BASELINE, null);
    }

    public static ExperimentDef policy(String name) {
        return new ExperimentDef(name, ExperimentRole.POLICY, null);
    }
}

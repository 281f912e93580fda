package io.trialmesh.model;

public record ExperimentView(
        long expId,
        long simId,
        String name,
        ExperimentRole role,
        String description
) {
    public boolean isBaseline() {
        return role == ExperimentRole.BASELINE;
    }
}

package io.trialmesh.model;

public record SimulationView(
        long simId,
        String name,
        int trialCount,
        long seed,
        String description,
        long createdAtMs
) {
}

package io.trialmesh.dispatch;

@FunctionalInterface
public interface SimulationPlans {
    SimulationPlan plan(long simId);
}

package io.trialmesh.dispatch;

/**
 * Request to start one worker for a simulation.
 */
public record WorkerLaunch(long simId, String workerId, String jobName) {
    public static WorkerLaunch forSimulation(long simId, String workerId) {
        return new WorkerLaunch(simId, workerId, "trialmesh-s" + simId + "-" + workerId);
    }
}

package io.trialmesh.dispatch;

import java.util.Set;

/**
 * Owns the worker jobs. The dispatcher only asks for workers and cancellations; where a
 * worker runs is the manager's business.
 */
public interface ClusterManager extends AutoCloseable {
    /**
     * Starts a worker and returns its job id.
     */
    String submitWorker(WorkerLaunch launch);

    void cancel(String jobId);

    JobState poll(String jobId);

    int availableSlots();

    int activeJobs();

    /**
     * Stops workers whose job id is not in {@code busyJobIds}. Returns how many were asked to
     * stop.
     */
    int releaseIdle(Set<String> busyJobIds);

    @Override
    void close();
}

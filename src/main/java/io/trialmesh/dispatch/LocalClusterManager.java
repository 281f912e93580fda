package io.trialmesh.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Runs workers as threads of a fixed pool; one slot per thread.
 */
public final class LocalClusterManager implements ClusterManager {
    private static final Logger logger = LoggerFactory.getLogger(LocalClusterManager.class);

    private final int slots;
    private final WorkerFactory factory;
    private final ExecutorService pool;
    private final Map<String, LocalJob> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public LocalClusterManager(int slots, WorkerFactory factory) {
        if (slots < 1) {
            throw new IllegalArgumentException("slots must be at least 1");
        }
        this.slots = slots;
        this.factory = factory;
        AtomicInteger threadIndex = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(slots, r -> {
            Thread t = new Thread(r, "trialmesh-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String submitWorker(WorkerLaunch launch) {
        String jobId = "local-" + sequence.incrementAndGet();
        AtomicBoolean stop = new AtomicBoolean(false);
        Runnable body = factory.create(jobId, launch, stop::get);
        try {
            Future<?> future = pool.submit(() -> {
                try {
                    body.run();
                } catch (RuntimeException e) {
                    logger.error("Worker {} ({}) crashed", launch.workerId(), jobId, e);
                    throw e;
                } finally {
                    jobs.remove(jobId);
                }
            });
            jobs.put(jobId, new LocalJob(jobId, launch, future, stop));
        } catch (RejectedExecutionException e) {
            throw new ClusterException("Local pool rejected worker " + launch.workerId(), e);
        }
        logger.debug("Started worker {} as {}", launch.workerId(), jobId);
        return jobId;
    }

    @Override
    public void cancel(String jobId) {
        LocalJob job = jobs.get(jobId);
        if (job == null) {
            return;
        }
        job.stop().set(true);
        job.future().cancel(true);
    }

    @Override
    public JobState poll(String jobId) {
        LocalJob job = jobs.get(jobId);
        if (job == null) {
            return JobState.DONE;
        }
        return job.future().isDone() ? JobState.DONE : JobState.RUNNING;
    }

    @Override
    public int availableSlots() {
        return Math.max(0, slots - activeJobs());
    }

    @Override
    public int activeJobs() {
        jobs.values().removeIf(job -> job.future().isDone());
        int active = 0;
        for (LocalJob job : jobs.values()) {
            if (!job.future().isDone() && !job.stop().get()) {
                active++;
            }
        }
        return active;
    }

    @Override
    public int releaseIdle(Set<String> busyJobIds) {
        jobs.values().removeIf(job -> job.future().isDone());
        int released = 0;
        for (LocalJob job : jobs.values()) {
            if (!busyJobIds.contains(job.jobId()) && !job.stop().get()) {
                job.stop().set(true);
                released++;
            }
        }
        return released;
    }

    @Override
    public void close() {
        jobs.values().forEach(job -> job.stop().set(true));
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Builds the body of a local worker. The body must return once {@code stopRequested}
     * turns true.
     */
    @FunctionalInterface
    public interface WorkerFactory {
        Runnable create(String jobId, WorkerLaunch launch, BooleanSupplier stopRequested);
    }

    private record LocalJob(String jobId, WorkerLaunch launch, Future<?> future, AtomicBoolean stop) {
    }
}

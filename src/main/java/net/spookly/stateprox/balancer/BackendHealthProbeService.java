package net.spookly.stateprox.balancer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs periodic active probes for every cluster with a health section and feeds the results
 * into the health tracker.
 */
public final class BackendHealthProbeService implements AutoCloseable {
    private static final int DEFAULT_TIMEOUT_MS = 1000;

    private final ClusterManager clusterManager;
    private final BackendHealthTracker healthTracker;
    private final BackendHealthProbe probe;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final List<ScheduledFuture<?>> scheduledTasks = new ArrayList<>();

    public BackendHealthProbeService(ClusterManager clusterManager,
                                     BackendHealthTracker healthTracker,
                                     BackendHealthProbe probe) {
        this.clusterManager = Objects.requireNonNull(clusterManager, "clusterManager");
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory());
    }

    /**
     * Schedule probes for clusters that configure {@code health}.
     */
    public synchronized void start() {
        if (stopped.get() || !scheduledTasks.isEmpty()) {
            return;
        }
        for (Cluster cluster : clusterManager.clusters()) {
            if (!cluster.hasHealthCheck()) {
                continue;
            }
            scheduledTasks.add(scheduler.scheduleAtFixedRate(
                    () -> runOnce(cluster),
                    0,
                    cluster.healthIntervalSeconds(),
                    TimeUnit.SECONDS
            ));
        }
    }

    /**
     * Stop periodic probes and release probe resources.
     */
    public synchronized void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        for (ScheduledFuture<?> task : scheduledTasks) {
            task.cancel(false);
        }
        scheduledTasks.clear();
        scheduler.shutdownNow();
        try {
            probe.close();
        } catch (Exception e) {
            System.err.println("Failed to stop health probe: " + e.getMessage());
        }
    }

    @Override
    public void close() {
        stop();
    }

    void runOnce() {
        for (Cluster cluster : clusterManager.clusters()) {
            if (cluster.hasHealthCheck()) {
                runOnce(cluster);
            }
        }
    }

    void runOnce(Cluster cluster) {
        if (stopped.get()) {
            return;
        }
        int timeoutMs = cluster.healthTimeoutMs() == null ? DEFAULT_TIMEOUT_MS : cluster.healthTimeoutMs();
        for (Endpoint endpoint : cluster.endpoints()) {
            probeEndpoint(endpoint, timeoutMs);
        }
    }

    private void probeEndpoint(Endpoint endpoint, int timeoutMs) {
        try {
            probe.probe(endpoint, timeoutMs).whenComplete((success, error) -> {
                if (error != null || !Boolean.TRUE.equals(success)) {
                    healthTracker.recordActiveFailure(endpoint);
                    return;
                }
                healthTracker.recordActiveSuccess(endpoint);
            });
        } catch (RuntimeException e) {
            healthTracker.recordActiveFailure(endpoint);
        }
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "stateprox-health-probe");
            thread.setDaemon(true);
            return thread;
        };
    }
}

package net.spookly.stateprox.balancer;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

import net.spookly.stateprox.session.BackendAddress;

/**
 * Counts in-flight requests per backend for least-request selection.
 */
public final class EndpointLoadTracker {
    private final ConcurrentMap<BackendAddress, AtomicInteger> activeCounts = new ConcurrentHashMap<>();

    /**
     * Count one request against the endpoint until the returned lease is closed.
     */
    public EndpointLease acquire(Endpoint endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        BackendAddress key = endpoint.address();
        activeCounts.computeIfAbsent(key, ignored -> new AtomicInteger()).incrementAndGet();
        return new EndpointLease(endpoint, this, key);
    }

    public int activeRequests(Endpoint endpoint) {
        if (endpoint == null) {
            return 0;
        }
        AtomicInteger counter = activeCounts.get(endpoint.address());
        return counter == null ? 0 : Math.max(0, counter.get());
    }

    void release(BackendAddress key) {
        if (key == null) {
            return;
        }
        AtomicInteger counter = activeCounts.get(key);
        if (counter == null) {
            return;
        }
        int remaining = counter.decrementAndGet();
        if (remaining <= 0) {
            activeCounts.remove(key, counter);
        }
    }
}
